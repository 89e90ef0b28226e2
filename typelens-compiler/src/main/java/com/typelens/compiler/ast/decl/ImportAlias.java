package com.typelens.compiler.ast.decl;

/**
 * 导入项：name [as asName]
 */
public final class ImportAlias {
    private final String name;
    private final String asName;

    public ImportAlias(String name, String asName) {
        this.name = name;
        this.asName = asName;
    }

    /** 原始名称（可能为点分路径，如 os.path） */
    public String getName() {
        return name;
    }

    public String getAsName() {
        return asName;
    }

    /**
     * 实际绑定到作用域的名称：有别名取别名，
     * 否则 {@code import a.b} 绑定首段 a
     */
    public String getBoundName() {
        if (asName != null) return asName;
        int dot = name.indexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    @Override
    public String toString() {
        return asName != null ? name + " as " + asName : name;
    }
}
