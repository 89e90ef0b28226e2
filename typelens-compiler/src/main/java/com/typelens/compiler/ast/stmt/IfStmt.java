package com.typelens.compiler.ast.stmt;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.NodeKind;
import com.typelens.compiler.ast.SourceLocation;
import com.typelens.compiler.ast.expr.Expression;

import java.util.List;

/**
 * if 语句。elif 表示为 orElse 中嵌套的单个 IfStmt。
 */
public class IfStmt extends Statement {
    private final Expression condition;
    private final List<Statement> body;
    private final List<Statement> orElse;

    public IfStmt(SourceLocation location, Expression condition,
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
        return NodeKind.IF;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIfStmt(this, context);
    }
}
