package com.typelens.compiler.ast.expr;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.NodeKind;
import com.typelens.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 推导式：[x for x in xs]、{x}、{k: v ...}、(x for ...)
 */
public class ComprehensionExpr extends Expression {

    public enum ComprehensionKind {
        LIST,
        SET,
        DICT,
        GENERATOR
    }

    private final ComprehensionKind comprehensionKind;
    private final Expression element;    // 字典推导式中为键
    private final Expression value;      // 仅字典推导式
    private final List<ComprehensionClause> clauses;

    public ComprehensionExpr(SourceLocation location, ComprehensionKind comprehensionKind,
                             Expression element, Expression value,
                             List<ComprehensionClause> clauses) {
        super(location);
        this.comprehensionKind = comprehensionKind;
        this.element = element;
        this.value = value;
        this.clauses = clauses;
    }

    public ComprehensionKind getComprehensionKind() {
        return comprehensionKind;
    }

    public Expression getElement() {
        return element;
    }

    public Expression getValue() {
        return value;
    }

    public List<ComprehensionClause> getClauses() {
        return clauses;
    }

    @Override
    public NodeKind getKind() {
        switch (comprehensionKind) {
            case SET: return NodeKind.SET_COMP;
            case DICT: return NodeKind.DICT_COMP;
            case GENERATOR: return NodeKind.GENERATOR_EXP;
            default: return NodeKind.LIST_COMP;
        }
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitComprehensionExpr(this, context);
    }
}
