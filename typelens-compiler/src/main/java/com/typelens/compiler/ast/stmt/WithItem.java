package com.typelens.compiler.ast.stmt;

import com.typelens.compiler.ast.AstNode;
import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.NodeKind;
import com.typelens.compiler.ast.SourceLocation;
import com.typelens.compiler.ast.expr.Expression;

/**
 * with 项：expr [as target]
 */
public class WithItem extends AstNode {
    private final Expression contextExpr;
    private final Expression target;  // 可选

    public WithItem(SourceLocation location, Expression contextExpr, Expression target) {
        super(location);
        this.contextExpr = contextExpr;
        this.target = target;
    }

    public Expression getContextExpr() {
        return contextExpr;
    }

    public Expression getTarget() {
        return target;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.WITH_ITEM;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitWithItem(this, context);
    }
}
