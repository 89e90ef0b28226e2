package com.typelens.compiler.ast.expr;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.NodeKind;
import com.typelens.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 布尔运算：a and b and c
 */
public class BoolOpExpr extends Expression {

    public enum BoolOp {
        AND("And"),
        OR("Or");

        private final String displayName;

        BoolOp(String displayName) {
            this.displayName = displayName;
        }

        public String getDisplayName() {
            return displayName;
        }
    }

    private final BoolOp operator;
    private final List<Expression> values;

    public BoolOpExpr(SourceLocation location, BoolOp operator, List<Expression> values) {
        super(location);
        this.operator = operator;
        this.values = values;
    }

    public BoolOp getOperator() {
        return operator;
    }

    public List<Expression> getValues() {
        return values;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.BOOL_OP;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBoolOpExpr(this, context);
    }
}
