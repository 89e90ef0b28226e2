package com.typelens.compiler.ast.decl;

import com.typelens.compiler.ast.AstNode;
import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.NodeKind;
import com.typelens.compiler.ast.SourceLocation;
import com.typelens.compiler.ast.expr.Expression;

/**
 * 函数 / lambda 参数
 */
public class Parameter extends AstNode {

    /**
     * 参数种类
     */
    public enum ParamKind {
        POSITIONAL_ONLY,    // '/' 之前
        POSITIONAL,
        VAR_POSITIONAL,     // *args
        KEYWORD_ONLY,       // '*' 之后
        VAR_KEYWORD         // **kwargs
    }

    private final String name;
    private final Expression annotation;     // 可选
    private final Expression defaultValue;   // 可选
    private ParamKind paramKind;

    public Parameter(SourceLocation location, String name, Expression annotation,
                     Expression defaultValue, ParamKind paramKind) {
        super(location);
        this.name = name;
        this.annotation = annotation;
        this.defaultValue = defaultValue;
        this.paramKind = paramKind;
    }

    public String getName() {
        return name;
    }

    public Expression getAnnotation() {
        return annotation;
    }

    public boolean hasAnnotation() {
        return annotation != null;
    }

    public Expression getDefaultValue() {
        return defaultValue;
    }

    public boolean hasDefaultValue() {
        return defaultValue != null;
    }

    public ParamKind getParamKind() {
        return paramKind;
    }

    /** 遇到 '/' 时把之前的参数改为仅位置参数 */
    public void markPositionalOnly() {
        if (paramKind == ParamKind.POSITIONAL) {
            paramKind = ParamKind.POSITIONAL_ONLY;
        }
    }

    public boolean isVariadic() {
        return paramKind == ParamKind.VAR_POSITIONAL || paramKind == ParamKind.VAR_KEYWORD;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.PARAMETER;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitParameter(this, context);
    }
}
