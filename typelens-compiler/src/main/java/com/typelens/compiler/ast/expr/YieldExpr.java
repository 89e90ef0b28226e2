package com.typelens.compiler.ast.expr;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.NodeKind;
import com.typelens.compiler.ast.SourceLocation;

/**
 * yield / yield from 表达式
 */
public class YieldExpr extends Expression {
    private final Expression value;   // 可选
    private final boolean delegate;   // yield from

    public YieldExpr(SourceLocation location, Expression value, boolean delegate) {
        super(location);
        this.value = value;
        this.delegate = delegate;
    }

    public Expression getValue() {
        return value;
    }

    public boolean isDelegate() {
        return delegate;
    }

    @Override
    public NodeKind getKind() {
        return delegate ? NodeKind.YIELD_FROM : NodeKind.YIELD;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitYieldExpr(this, context);
    }
}
