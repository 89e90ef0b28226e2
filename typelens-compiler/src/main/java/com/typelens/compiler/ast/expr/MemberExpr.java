package com.typelens.compiler.ast.expr;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.NodeKind;
import com.typelens.compiler.ast.SourceLocation;
import com.typelens.compiler.ast.ExprContext;

/**
 * 成员访问：obj.attr
 */
public class MemberExpr extends Expression {
    private final Expression target;
    private final String member;
    private ExprContext context = ExprContext.LOAD;

    public MemberExpr(SourceLocation location, Expression target, String member) {
        super(location);
        this.target = target;
        this.member = member;
    }

    public Expression getTarget() {
        return target;
    }

    public String getMember() {
        return member;
    }

    public ExprContext getContext() {
        return context;
    }

    public void setContext(ExprContext context) {
        this.context = context;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ATTRIBUTE;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMemberExpr(this, context);
    }
}
