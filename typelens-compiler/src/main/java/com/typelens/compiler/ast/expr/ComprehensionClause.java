package com.typelens.compiler.ast.expr;

import com.typelens.compiler.ast.AstNode;
import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.NodeKind;
import com.typelens.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 推导式子句：[async] for target in iterable [if cond]*
 */
public class ComprehensionClause extends AstNode {
    private final Expression target;
    private final Expression iterable;
    private final List<Expression> conditions;
    private final boolean isAsync;

    public ComprehensionClause(SourceLocation location, Expression target, Expression iterable,
                               List<Expression> conditions, boolean isAsync) {
        super(location);
        this.target = target;
        this.iterable = iterable;
        this.conditions = conditions;
        this.isAsync = isAsync;
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getIterable() {
        return iterable;
    }

    public List<Expression> getConditions() {
        return conditions;
    }

    public boolean isAsync() {
        return isAsync;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.COMPREHENSION;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitComprehensionClause(this, context);
    }
}
