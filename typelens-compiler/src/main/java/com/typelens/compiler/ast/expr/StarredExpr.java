package com.typelens.compiler.ast.expr;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.NodeKind;
import com.typelens.compiler.ast.SourceLocation;
import com.typelens.compiler.ast.ExprContext;

/**
 * 星号展开：*value
 */
public class StarredExpr extends Expression {
    private final Expression value;
    private ExprContext context = ExprContext.LOAD;

    public StarredExpr(SourceLocation location, Expression value) {
        super(location);
        this.value = value;
    }

    public Expression getValue() {
        return value;
    }

    public ExprContext getContext() {
        return context;
    }

    public void setContext(ExprContext context) {
        this.context = context;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.STARRED;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStarredExpr(this, context);
    }
}
