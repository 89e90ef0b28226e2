package com.typelens.compiler.ast.expr;

import com.typelens.compiler.ast.AstNode;
import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.NodeKind;
import com.typelens.compiler.ast.SourceLocation;

/**
 * 关键字参数：name=value；name 为 null 时表示 **value
 */
public class KeywordArgument extends AstNode {
    private final String name;
    private final Expression value;

    public KeywordArgument(SourceLocation location, String name, Expression value) {
        super(location);
        this.name = name;
        this.value = value;
    }

    public String getName() {
        return name;
    }

    public Expression getValue() {
        return value;
    }

    public boolean isDoubleStar() {
        return name == null;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ARGUMENT;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitKeywordArgument(this, context);
    }
}
