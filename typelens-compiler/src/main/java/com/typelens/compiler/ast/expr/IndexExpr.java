package com.typelens.compiler.ast.expr;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.NodeKind;
import com.typelens.compiler.ast.SourceLocation;
import com.typelens.compiler.ast.ExprContext;

/**
 * 下标访问：obj[index]
 */
public class IndexExpr extends Expression {
    private final Expression target;
    private final Expression index;
    private ExprContext context = ExprContext.LOAD;

    public IndexExpr(SourceLocation location, Expression target, Expression index) {
        super(location);
        this.target = target;
        this.index = index;
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getIndex() {
        return index;
    }

    public ExprContext getContext() {
        return context;
    }

    public void setContext(ExprContext context) {
        this.context = context;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.SUBSCRIPT;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIndexExpr(this, context);
    }
}
