package com.typelens.compiler.analysis.types;

/**
 * Any：已知无法给出更精确类型时的兜底
 */
public final class AnyPyType extends PyType {

    public static final AnyPyType INSTANCE = new AnyPyType();

    private AnyPyType() {
    }

    @Override
    public boolean isIndeterminate() {
        return true;
    }

    @Override
    public String toDisplayString() {
        return "Any";
    }
}
