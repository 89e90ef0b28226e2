package com.typelens.compiler.ast.stmt;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.NodeKind;
import com.typelens.compiler.ast.SourceLocation;
import com.typelens.compiler.ast.expr.Expression;

import java.util.List;

/**
 * while 循环（可带 else 子句）
 */
public class WhileStmt extends Statement {
    private final Expression condition;
    private final List<Statement> body;
    private final List<Statement> orElse;

    public WhileStmt(SourceLocation location, Expression condition,
                     List<Statement> body, List<Statement> orElse) {
        super(location);
        this.condition = condition;
        this.body = body;
        this.orElse = orElse;
    }

    public Expression getCondition() {
        return condition;
    }

    public List<Statement> getBody() {
        return body;
    }

    public List<Statement> getOrElse() {
        return orElse;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.WHILE;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitWhileStmt(this, context);
    }
}
