package com.typelens.compiler.analysis;

import com.typelens.compiler.analysis.types.PyType;

/**
 * 变量符号
 */
public final class VariableSymbol extends Symbol {
    private final int column;
    private final String annotation;      // 可选
    private final int scopeDepth;
    private final boolean simpleTarget;   // 由单目标语句绑定（可安全改写该行）
    private PyType inferredType;          // 带注解但无值时为 null

    public VariableSymbol(String name, int line, int column, String annotation,
                          PyType inferredType, int scopeDepth, boolean simpleTarget) {
        super(name, line);
        this.column = column;
        this.annotation = annotation;
        this.inferredType = inferredType;
        this.scopeDepth = scopeDepth;
        this.simpleTarget = simpleTarget;
    }

    @Override
    public SymbolKind getKind() { return SymbolKind.VARIABLE; }

    public int getColumn() { return column; }
    public String getAnnotation() { return annotation; }
    public boolean hasAnnotation() { return annotation != null; }
    public int getScopeDepth() { return scopeDepth; }
    public boolean isSimpleTarget() { return simpleTarget; }

    public PyType getInferredType() { return inferredType; }

    /** 仅供延迟占位解析使用 */
    void setInferredType(PyType inferredType) { this.inferredType = inferredType; }
}
