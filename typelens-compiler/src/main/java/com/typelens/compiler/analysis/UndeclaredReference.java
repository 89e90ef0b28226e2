package com.typelens.compiler.analysis;

import java.util.Objects;

/**
 * 未声明名称的一次引用。所有字段参与相等性判断。
 */
public final class UndeclaredReference {
    public static final String LOAD_CONTEXT = "load";

    private final String name;
    private final int line;
    private final int column;
    private final String context;
    private final String function;    // 模块级引用为 null

    public UndeclaredReference(String name, int line, int column, String function) {
        this.name = name;
        this.line = line;
        this.column = column;
        this.context = LOAD_CONTEXT;
        this.function = function;
    }

    public String getName() { return name; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public String getContext() { return context; }
    public String getFunction() { return function; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UndeclaredReference)) return false;
        UndeclaredReference that = (UndeclaredReference) o;
        return line == that.line && column == that.column
                && name.equals(that.name) && context.equals(that.context)
                && Objects.equals(function, that.function);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, line, column, context, function);
    }

    @Override
    public String toString() {
        return name + " at " + line + ":" + column + (function != null ? " in " + function : "");
    }
}
