package com.typelens.compiler.ast.stmt;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.NodeKind;
import com.typelens.compiler.ast.SourceLocation;
import com.typelens.compiler.ast.expr.Expression;

import java.util.List;

/**
 * del 语句
 */
public class DeleteStmt extends Statement {
    private final List<Expression> targets;

    public DeleteStmt(SourceLocation location, List<Expression> targets) {
        super(location);
        this.targets = targets;
    }

    public List<Expression> getTargets() {
        return targets;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.DELETE;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDeleteStmt(this, context);
    }
}
