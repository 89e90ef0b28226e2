package com.typelens.compiler.ast.stmt;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.NodeKind;
import com.typelens.compiler.ast.SourceLocation;
import com.typelens.compiler.ast.expr.BinaryExpr;
import com.typelens.compiler.ast.expr.Expression;

/**
 * 增强赋值：x += 1
 */
public class AugAssignStmt extends Statement {
    private final Expression target;
    private final BinaryExpr.BinaryOp operator;
    private final Expression value;

    public AugAssignStmt(SourceLocation location, Expression target,
                         BinaryExpr.BinaryOp operator, Expression value) {
        super(location);
        this.target = target;
        this.operator = operator;
        this.value = value;
    }

    public Expression getTarget() {
        return target;
    }

    public BinaryExpr.BinaryOp getOperator() {
        return operator;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.AUG_ASSIGN;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAugAssignStmt(this, context);
    }
}
