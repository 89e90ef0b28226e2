package com.typelens.compiler.ast.expr;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.NodeKind;
import com.typelens.compiler.ast.SourceLocation;

/**
 * 常量字面量
 */
public class Literal extends Expression {

    public enum LiteralKind {
        INT,
        FLOAT,
        COMPLEX,
        STRING,
        BYTES,
        BOOLEAN,
        NONE,
        ELLIPSIS
    }

    private final LiteralKind literalKind;
    private final Object value;

    public Literal(SourceLocation location, LiteralKind literalKind, Object value) {
        super(location);
        this.literalKind = literalKind;
        this.value = value;
    }

    public LiteralKind getLiteralKind() {
        return literalKind;
    }

    public Object getValue() {
        return value;
    }

    /**
     * 以源码形式返回值（用于可视化与默认值渲染）
     */
    public String getSourceText() {
        switch (literalKind) {
            case NONE: return "None";
            case ELLIPSIS: return "...";
            case BOOLEAN: return Boolean.TRUE.equals(value) ? "True" : "False";
            case STRING: return "'" + value + "'";
            case BYTES: return "b'" + value + "'";
            case COMPLEX: return value + "j";
            default: return String.valueOf(value);
        }
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CONSTANT;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }
}
