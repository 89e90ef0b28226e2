package com.typelens.compiler.ast.stmt;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.NodeKind;
import com.typelens.compiler.ast.SourceLocation;
import com.typelens.compiler.ast.expr.Expression;

import java.util.List;

/**
 * 赋值语句，支持链式赋值：a = b = value
 */
public class AssignStmt extends Statement {
    private final List<Expression> targets;
    private final Expression value;

    public AssignStmt(SourceLocation location, List<Expression> targets, Expression value) {
        super(location);
        this.targets = targets;
        this.value = value;
    }

    public List<Expression> getTargets() {
        return targets;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ASSIGN;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssignStmt(this, context);
    }
}
