package com.typelens.compiler.analysis;

/**
 * 作用域中的一个名称条目
 */
public final class ScopeEntry {
    private final String name;
    private final SymbolKind kind;
    private final int line;
    private final Symbol symbol;   // BINDING / PARAMETER 时为 null

    public ScopeEntry(String name, SymbolKind kind, int line, Symbol symbol) {
        this.name = name;
        this.kind = kind;
        this.line = line;
        this.symbol = symbol;
    }

    public String getName() { return name; }
    public SymbolKind getKind() { return kind; }
    public int getLine() { return line; }
    public Symbol getSymbol() { return symbol; }

    @Override
    public String toString() {
        return name + ":" + kind.getDisplayName() + "@" + line;
    }
}
