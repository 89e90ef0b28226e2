package com.typelens.compiler.ast.stmt;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.NodeKind;
import com.typelens.compiler.ast.SourceLocation;

/**
 * pass 语句
 */
public class PassStmt extends Statement {

    public PassStmt(SourceLocation location) {
        super(location);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.PASS;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitPassStmt(this, context);
    }
}
