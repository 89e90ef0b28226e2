package com.typelens.compiler.analysis.types;

/**
 * 原始类型: int, float, complex, str, bool, bytes, None
 */
public final class PrimitivePyType extends PyType {

    private final String name;

    PrimitivePyType(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /** int / float / complex / bool 参与数值运算 */
    public boolean isNumeric() {
        switch (name) {
            case "int": case "float": case "complex": case "bool":
                return true;
            default:
                return false;
        }
    }

    @Override
    public String toDisplayString() {
        return name;
    }
}
