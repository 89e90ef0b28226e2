package com.typelens.compiler.ast.expr;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.NodeKind;
import com.typelens.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 函数调用。位置参数中的 *x 表示为 {@link StarredExpr}，
 * 关键字参数与 **x 展开表示为 {@link KeywordArgument}。
 */
public class CallExpr extends Expression {
    private final Expression callee;
    private final List<Expression> args;
    private final List<KeywordArgument> keywords;

    public CallExpr(SourceLocation location, Expression callee,
                    List<Expression> args, List<KeywordArgument> keywords) {
        super(location);
        this.callee = callee;
        this.args = args;
        this.keywords = keywords;
    }

    public Expression getCallee() {
        return callee;
    }

    public List<Expression> getArgs() {
        return args;
    }

    public List<KeywordArgument> getKeywords() {
        return keywords;
    }

    /**
     * 被调用者为简单名称时返回该名称，否则返回 null
     */
    public String getCalleeName() {
        return callee instanceof Identifier ? ((Identifier) callee).getName() : null;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CALL;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }
}
