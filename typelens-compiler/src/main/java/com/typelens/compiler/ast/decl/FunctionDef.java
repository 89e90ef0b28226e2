package com.typelens.compiler.ast.decl;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.NodeKind;
import com.typelens.compiler.ast.SourceLocation;
import com.typelens.compiler.ast.expr.Expression;
import com.typelens.compiler.ast.stmt.Statement;

import java.util.List;

/**
 * 函数声明（def / async def）
 */
public class FunctionDef extends Declaration {
    private final List<Parameter> params;
    private final Expression returns;            // 可选返回注解
    private final boolean isAsync;

    public FunctionDef(SourceLocation location, String name, List<Parameter> params,
                       Expression returns, List<Statement> body,
                       List<Expression> decorators, boolean isAsync) {
        super(location, name, decorators, body);
        this.params = params;
        this.returns = returns;
        this.isAsync = isAsync;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public Expression getReturns() {
        return returns;
    }

    public boolean hasReturnAnnotation() {
        return returns != null;
    }

    public boolean isAsync() {
        return isAsync;
    }

    @Override
    public NodeKind getKind() {
        return isAsync ? NodeKind.ASYNC_FUNCTION_DEF : NodeKind.FUNCTION_DEF;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionDef(this, context);
    }
}
