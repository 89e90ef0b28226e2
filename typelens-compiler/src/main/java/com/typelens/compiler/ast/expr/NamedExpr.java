package com.typelens.compiler.ast.expr;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.NodeKind;
import com.typelens.compiler.ast.SourceLocation;

/**
 * 海象赋值：(name := value)
 */
public class NamedExpr extends Expression {
    private final Identifier target;
    private final Expression value;

    public NamedExpr(SourceLocation location, Identifier target, Expression value) {
        super(location);
        this.target = target;
        this.value = value;
    }

    public Identifier getTarget() {
        return target;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.NAMED_EXPR;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitNamedExpr(this, context);
    }
}
