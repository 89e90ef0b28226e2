package com.typelens.compiler.analysis.types;

import java.util.Collections;
import java.util.List;

/**
 * 联合类型：2 到 3 个互不相同、不含嵌套联合的备选，以 " | " 连接。
 * 只能通过 {@link PyTypes#union} 构造。
 */
public final class UnionPyType extends PyType {

    public static final String SEPARATOR = " | ";
    public static final int MAX_ALTERNATIVES = 3;

    private final List<PyType> alternatives;

    UnionPyType(List<PyType> alternatives) {
        this.alternatives = Collections.unmodifiableList(alternatives);
    }

    public List<PyType> getAlternatives() {
        return alternatives;
    }

    public boolean contains(PyType type) {
        return alternatives.contains(type);
    }

    @Override
    public boolean isUnion() {
        return true;
    }

    @Override
    public String toDisplayString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < alternatives.size(); i++) {
            if (i > 0) sb.append(SEPARATOR);
            sb.append(alternatives.get(i).toDisplayString());
        }
        return sb.toString();
    }
}
