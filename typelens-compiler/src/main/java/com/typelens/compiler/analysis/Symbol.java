package com.typelens.compiler.analysis;

/**
 * 符号表记录的公共部分
 */
public abstract class Symbol {
    protected final String name;
    protected final int line;

    protected Symbol(String name, int line) {
        this.name = name;
        this.line = line;
    }

    public String getName() { return name; }

    /** 声明所在行（从 1 开始） */
    public int getLine() { return line; }

    public abstract SymbolKind getKind();
}
