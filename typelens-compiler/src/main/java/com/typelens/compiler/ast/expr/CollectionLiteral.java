package com.typelens.compiler.ast.expr;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.NodeKind;
import com.typelens.compiler.ast.SourceLocation;
import com.typelens.compiler.ast.ExprContext;

import java.util.List;

/**
 * 列表 / 元组 / 集合字面量
 */
public class CollectionLiteral extends Expression {

    public enum CollectionKind {
        LIST,
        TUPLE,
        SET
    }

    private final CollectionKind collectionKind;
    private final List<Expression> elements;
    private ExprContext context = ExprContext.LOAD;

    public CollectionLiteral(SourceLocation location, CollectionKind collectionKind,
                             List<Expression> elements) {
        super(location);
        this.collectionKind = collectionKind;
        this.elements = elements;
    }

    public CollectionKind getCollectionKind() {
        return collectionKind;
    }

    public List<Expression> getElements() {
        return elements;
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public ExprContext getContext() {
        return context;
    }

    public void setContext(ExprContext context) {
        this.context = context;
    }

    @Override
    public NodeKind getKind() {
        switch (collectionKind) {
            case TUPLE: return NodeKind.TUPLE;
            case SET: return NodeKind.SET;
            default: return NodeKind.LIST;
        }
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCollectionLiteral(this, context);
    }
}
