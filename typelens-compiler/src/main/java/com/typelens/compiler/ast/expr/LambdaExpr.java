package com.typelens.compiler.ast.expr;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.NodeKind;
import com.typelens.compiler.ast.SourceLocation;
import com.typelens.compiler.ast.decl.Parameter;

import java.util.List;

/**
 * Lambda 表达式
 */
public class LambdaExpr extends Expression {
    private final List<Parameter> params;
    private final Expression body;

    public LambdaExpr(SourceLocation location, List<Parameter> params, Expression body) {
        super(location);
        this.params = params;
        this.body = body;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public Expression getBody() {
        return body;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.LAMBDA;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLambdaExpr(this, context);
    }
}
