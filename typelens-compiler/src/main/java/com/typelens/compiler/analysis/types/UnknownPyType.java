package com.typelens.compiler.analysis.types;

/**
 * unknown：推断规则未覆盖的表达式
 */
public final class UnknownPyType extends PyType {

    public static final UnknownPyType INSTANCE = new UnknownPyType();

    private UnknownPyType() {
    }

    @Override
    public boolean isIndeterminate() {
        return true;
    }

    @Override
    public String toDisplayString() {
        return "unknown";
    }
}
