package com.typelens.compiler.ast.stmt;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.NodeKind;
import com.typelens.compiler.ast.SourceLocation;
import com.typelens.compiler.ast.expr.Expression;

/**
 * 带注解的赋值：x: int = 1（值可省略）
 */
public class AnnAssignStmt extends Statement {
    private final Expression target;
    private final Expression annotation;
    private final Expression value;     // 可选
    private final boolean simple;       // 目标为未加括号的简单名称

    public AnnAssignStmt(SourceLocation location, Expression target, Expression annotation,
                         Expression value, boolean simple) {
        super(location);
        this.target = target;
        this.annotation = annotation;
        this.value = value;
        this.simple = simple;
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getAnnotation() {
        return annotation;
    }

    public Expression getValue() {
        return value;
    }

    public boolean hasValue() {
        return value != null;
    }

    public boolean isSimple() {
        return simple;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ANN_ASSIGN;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAnnAssignStmt(this, context);
    }
}
