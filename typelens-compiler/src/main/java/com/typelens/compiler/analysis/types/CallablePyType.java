package com.typelens.compiler.analysis.types;

/**
 * 可调用类型：Callable[..., R]
 */
public final class CallablePyType extends PyType {

    private final PyType returnType;

    public CallablePyType(PyType returnType) {
        this.returnType = returnType;
    }

    public PyType getReturnType() {
        return returnType;
    }

    @Override
    public String toDisplayString() {
        return "Callable[..., " + returnType.toDisplayString() + "]";
    }
}
