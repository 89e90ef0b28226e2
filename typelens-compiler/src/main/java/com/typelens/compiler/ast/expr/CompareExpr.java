package com.typelens.compiler.ast.expr;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.NodeKind;
import com.typelens.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 比较链：a < b <= c
 */
public class CompareExpr extends Expression {

    public enum CompareOp {
        EQ("==", "Eq"),
        NE("!=", "NotEq"),
        LT("<", "Lt"),
        LE("<=", "LtE"),
        GT(">", "Gt"),
        GE(">=", "GtE"),
        IN("in", "In"),
        NOT_IN("not in", "NotIn"),
        IS("is", "Is"),
        IS_NOT("is not", "IsNot");

        private final String symbol;
        private final String displayName;

        CompareOp(String symbol, String displayName) {
            this.symbol = symbol;
            this.displayName = displayName;
        }

        public String getSymbol() {
            return symbol;
        }

        public String getDisplayName() {
            return displayName;
        }
    }

    private final Expression left;
    private final List<CompareOp> operators;
    private final List<Expression> comparators;

    public CompareExpr(SourceLocation location, Expression left,
                       List<CompareOp> operators, List<Expression> comparators) {
        super(location);
        this.left = left;
        this.operators = operators;
        this.comparators = comparators;
    }

    public Expression getLeft() {
        return left;
    }

    public List<CompareOp> getOperators() {
        return operators;
    }

    public List<Expression> getComparators() {
        return comparators;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.COMPARE;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCompareExpr(this, context);
    }
}
