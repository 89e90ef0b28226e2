package com.typelens.compiler.ast.stmt;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.NodeKind;
import com.typelens.compiler.ast.SourceLocation;
import com.typelens.compiler.ast.expr.Expression;

/**
 * assert 语句
 */
public class AssertStmt extends Statement {
    private final Expression test;
    private final Expression message;  // 可选

    public AssertStmt(SourceLocation location, Expression test, Expression message) {
        super(location);
        this.test = test;
        this.message = message;
    }

    public Expression getTest() {
        return test;
    }

    public Expression getMessage() {
        return message;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ASSERT;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssertStmt(this, context);
    }
}
