package com.typelens.compiler.ast.expr;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.NodeKind;
import com.typelens.compiler.ast.SourceLocation;

/**
 * 切片：lower:upper:step（三部分均可省略）
 */
public class SliceExpr extends Expression {
    private final Expression lower;
    private final Expression upper;
    private final Expression step;

    public SliceExpr(SourceLocation location, Expression lower, Expression upper, Expression step) {
        super(location);
        this.lower = lower;
        this.upper = upper;
        this.step = step;
    }

    public Expression getLower() {
        return lower;
    }

    public Expression getUpper() {
        return upper;
    }

    public Expression getStep() {
        return step;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.SLICE;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSliceExpr(this, context);
    }
}
