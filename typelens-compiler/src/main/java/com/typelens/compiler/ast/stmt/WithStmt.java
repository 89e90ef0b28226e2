package com.typelens.compiler.ast.stmt;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.NodeKind;
import com.typelens.compiler.ast.SourceLocation;

import java.util.List;

/**
 * with 语句
 */
public class WithStmt extends Statement {
    private final List<WithItem> items;
    private final List<Statement> body;
    private final boolean isAsync;

    public WithStmt(SourceLocation location, List<WithItem> items,
                    List<Statement> body, boolean isAsync) {
        super(location);
        this.items = items;
        this.body = body;
        this.isAsync = isAsync;
    }

    public List<WithItem> getItems() {
        return items;
    }

    public List<Statement> getBody() {
        return body;
    }

    public boolean isAsync() {
        return isAsync;
    }

    @Override
    public NodeKind getKind() {
        return isAsync ? NodeKind.ASYNC_WITH : NodeKind.WITH;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitWithStmt(this, context);
    }
}
