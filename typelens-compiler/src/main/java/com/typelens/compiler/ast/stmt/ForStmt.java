package com.typelens.compiler.ast.stmt;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.NodeKind;
import com.typelens.compiler.ast.SourceLocation;
import com.typelens.compiler.ast.expr.Expression;

import java.util.List;

/**
 * for 循环：for target in iterable
 */
public class ForStmt extends Statement {
    private final Expression target;
    private final Expression iterable;
    private final List<Statement> body;
    private final List<Statement> orElse;
    private final boolean isAsync;

    public ForStmt(SourceLocation location, Expression target, Expression iterable,
                   List<Statement> body, List<Statement> orElse, boolean isAsync) {
        super(location);
        this.target = target;
        this.iterable = iterable;
        this.body = body;
        this.orElse = orElse;
        this.isAsync = isAsync;
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getIterable() {
        return iterable;
    }

    public List<Statement> getBody() {
        return body;
    }

    public List<Statement> getOrElse() {
        return orElse;
    }

    public boolean isAsync() {
        return isAsync;
    }

    @Override
    public NodeKind getKind() {
        return isAsync ? NodeKind.ASYNC_FOR : NodeKind.FOR;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForStmt(this, context);
    }
}
