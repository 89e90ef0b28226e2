package com.typelens.compiler.analysis.types;

import java.util.Collections;
import java.util.List;

/**
 * 名义类型，可含类型参数: Greeter, list[int], dict[str, int], Generator[int, None, None]
 */
public final class ClassPyType extends PyType {

    private final String name;
    private final List<PyType> typeArgs;

    public ClassPyType(String name) {
        this(name, Collections.<PyType>emptyList());
    }

    public ClassPyType(String name, List<PyType> typeArgs) {
        this.name = name;
        this.typeArgs = Collections.unmodifiableList(typeArgs);
    }

    public String getName() {
        return name;
    }

    public List<PyType> getTypeArgs() {
        return typeArgs;
    }

    public boolean hasTypeArgs() {
        return !typeArgs.isEmpty();
    }

    /** 第 index 个类型参数，不存在时返回 null */
    public PyType getTypeArg(int index) {
        return index < typeArgs.size() ? typeArgs.get(index) : null;
    }

    @Override
    public String toDisplayString() {
        if (typeArgs.isEmpty()) {
            return name;
        }
        StringBuilder sb = new StringBuilder(name).append('[');
        for (int i = 0; i < typeArgs.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(typeArgs.get(i).toDisplayString());
        }
        return sb.append(']').toString();
    }
}
