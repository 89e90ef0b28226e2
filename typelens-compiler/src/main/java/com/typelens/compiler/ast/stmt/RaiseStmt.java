package com.typelens.compiler.ast.stmt;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.NodeKind;
import com.typelens.compiler.ast.SourceLocation;
import com.typelens.compiler.ast.expr.Expression;

/**
 * raise 语句：raise [exc [from cause]]
 */
public class RaiseStmt extends Statement {
    private final Expression exception;  // 可选
    private final Expression cause;      // 可选

    public RaiseStmt(SourceLocation location, Expression exception, Expression cause) {
        super(location);
        this.exception = exception;
        this.cause = cause;
    }

    public Expression getException() {
        return exception;
    }

    public Expression getCause() {
        return cause;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.RAISE;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitRaiseStmt(this, context);
    }
}
