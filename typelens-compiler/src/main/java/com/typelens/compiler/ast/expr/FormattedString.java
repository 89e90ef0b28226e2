package com.typelens.compiler.ast.expr;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.NodeKind;
import com.typelens.compiler.ast.SourceLocation;

import java.util.List;

/**
 * f-string。values 为各替换字段中解析出的表达式。
 */
public class FormattedString extends Expression {
    private final String rawText;
    private final List<Expression> values;

    public FormattedString(SourceLocation location, String rawText, List<Expression> values) {
        super(location);
        this.rawText = rawText;
        this.values = values;
    }

    public String getRawText() {
        return rawText;
    }

    public List<Expression> getValues() {
        return values;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.FORMATTED_STRING;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFormattedString(this, context);
    }
}
