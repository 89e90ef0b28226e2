package com.typelens.compiler.ast.stmt;

import com.typelens.compiler.ast.AstNode;
import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.NodeKind;
import com.typelens.compiler.ast.SourceLocation;
import com.typelens.compiler.ast.expr.Expression;

import java.util.List;

/**
 * except 子句：except [type [as name]]:
 */
public class ExceptHandler extends AstNode {
    private final Expression exceptionType;  // 可选
    private final String name;               // 可选
    private final List<Statement> body;

    public ExceptHandler(SourceLocation location, Expression exceptionType,
                         String name, List<Statement> body) {
        super(location);
        this.exceptionType = exceptionType;
        this.name = name;
        this.body = body;
    }

    public Expression getExceptionType() {
        return exceptionType;
    }

    public String getName() {
        return name;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.EXCEPT_HANDLER;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitExceptHandler(this, context);
    }
}
