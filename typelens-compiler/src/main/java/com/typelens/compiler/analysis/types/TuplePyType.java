package com.typelens.compiler.analysis.types;

import java.util.Collections;
import java.util.List;

/**
 * 元组类型：定长 tuple[int, str] 或变长 tuple[int, ...]
 */
public final class TuplePyType extends PyType {

    private final List<PyType> elements;
    private final boolean variadic;

    private TuplePyType(List<PyType> elements, boolean variadic) {
        this.elements = Collections.unmodifiableList(elements);
        this.variadic = variadic;
    }

    /** 逐位置类型 */
    public static TuplePyType of(List<PyType> elements) {
        return new TuplePyType(elements, false);
    }

    /** 同质变长元组 */
    public static TuplePyType homogeneous(PyType element) {
        return new TuplePyType(Collections.singletonList(element), true);
    }

    public List<PyType> getElements() {
        return elements;
    }

    public boolean isVariadic() {
        return variadic;
    }

    /**
     * 取指定下标的元素类型；变长元组总是返回元素类型，越界返回 null
     */
    public PyType elementAt(int index) {
        if (variadic) return elements.get(0);
        if (index < 0) index += elements.size();
        return index >= 0 && index < elements.size() ? elements.get(index) : null;
    }

    @Override
    public String toDisplayString() {
        StringBuilder sb = new StringBuilder("tuple[");
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(elements.get(i).toDisplayString());
        }
        if (variadic) sb.append(", ...");
        return sb.append(']').toString();
    }
}
