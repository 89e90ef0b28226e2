package com.typelens.compiler.ast.expr;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.NodeKind;
import com.typelens.compiler.ast.SourceLocation;

/**
 * 二元运算
 */
public class BinaryExpr extends Expression {

    /**
     * 二元运算符
     */
    public enum BinaryOp {
        ADD("+", "Add"),
        SUB("-", "Sub"),
        MUL("*", "Mult"),
        DIV("/", "Div"),
        FLOOR_DIV("//", "FloorDiv"),
        MOD("%", "Mod"),
        POW("**", "Pow"),
        MAT_MUL("@", "MatMult"),
        BIT_OR("|", "BitOr"),
        BIT_XOR("^", "BitXor"),
        BIT_AND("&", "BitAnd"),
        LSHIFT("<<", "LShift"),
        RSHIFT(">>", "RShift");

        private final String symbol;
        private final String displayName;

        BinaryOp(String symbol, String displayName) {
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
    private final BinaryOp operator;
    private final Expression right;

    public BinaryExpr(SourceLocation location, Expression left, BinaryOp operator, Expression right) {
        super(location);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.BINARY_OP;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryExpr(this, context);
    }
}
