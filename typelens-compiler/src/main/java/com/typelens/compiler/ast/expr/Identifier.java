package com.typelens.compiler.ast.expr;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.NodeKind;
import com.typelens.compiler.ast.SourceLocation;
import com.typelens.compiler.ast.ExprContext;

/**
 * 名称引用
 */
public class Identifier extends Expression {
    private final String name;
    private ExprContext context = ExprContext.LOAD;

    public Identifier(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public ExprContext getContext() {
        return context;
    }

    public void setContext(ExprContext context) {
        this.context = context;
    }

    public boolean isLoad() {
        return context == ExprContext.LOAD;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.NAME;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIdentifier(this, context);
    }

    @Override
    public String toString() {
        return name;
    }
}
