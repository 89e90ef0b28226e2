package com.typelens.compiler.ast.stmt;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.NodeKind;
import com.typelens.compiler.ast.SourceLocation;

import java.util.List;

/**
 * try 语句
 */
public class TryStmt extends Statement {
    private final List<Statement> body;
    private final List<ExceptHandler> handlers;
    private final List<Statement> orElse;
    private final List<Statement> finallyBody;

    public TryStmt(SourceLocation location, List<Statement> body, List<ExceptHandler> handlers,
                   List<Statement> orElse, List<Statement> finallyBody) {
        super(location);
        this.body = body;
        this.handlers = handlers;
        this.orElse = orElse;
        this.finallyBody = finallyBody;
    }

    public List<Statement> getBody() {
        return body;
    }

    public List<ExceptHandler> getHandlers() {
        return handlers;
    }

    public List<Statement> getOrElse() {
        return orElse;
    }

    public List<Statement> getFinallyBody() {
        return finallyBody;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.TRY;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTryStmt(this, context);
    }
}
