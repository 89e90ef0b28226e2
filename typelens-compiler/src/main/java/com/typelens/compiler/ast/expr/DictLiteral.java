package com.typelens.compiler.ast.expr;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.NodeKind;
import com.typelens.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 字典字面量。key 为 null 的条目表示 **mapping 展开。
 */
public class DictLiteral extends Expression {
    private final List<Expression> keys;
    private final List<Expression> values;

    public DictLiteral(SourceLocation location, List<Expression> keys, List<Expression> values) {
        super(location);
        this.keys = keys;
        this.values = values;
    }

    public List<Expression> getKeys() {
        return keys;
    }

    public List<Expression> getValues() {
        return values;
    }

    public int size() {
        return keys.size();
    }

    public boolean isEmpty() {
        return keys.isEmpty();
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.DICT;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDictLiteral(this, context);
    }
}
