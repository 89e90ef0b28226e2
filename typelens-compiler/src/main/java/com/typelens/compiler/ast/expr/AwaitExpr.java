package com.typelens.compiler.ast.expr;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.NodeKind;
import com.typelens.compiler.ast.SourceLocation;

/**
 * await 表达式
 */
public class AwaitExpr extends Expression {
    private final Expression value;

    public AwaitExpr(SourceLocation location, Expression value) {
        super(location);
        this.value = value;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.AWAIT;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAwaitExpr(this, context);
    }
}
