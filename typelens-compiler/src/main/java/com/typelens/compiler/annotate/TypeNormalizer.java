package com.typelens.compiler.annotate;

import com.typelens.compiler.analysis.types.DeferredPyType;
import com.typelens.compiler.analysis.types.PyType;

/**
 * 注解文本规范化
 */
public final class TypeNormalizer {

    public static final String ANY = "Any";

    private TypeNormalizer() {}

    /**
     * 空、unknown 与延迟占位 → Any；NoneType → None；TextIOWrapper → TextIO
     */
    public static String normalize(String type) {
        if (type == null) return ANY;
        String cleaned = type.trim();
        if (cleaned.isEmpty() || "unknown".equals(cleaned) || cleaned.contains(DeferredPyType.PREFIX)) {
            return ANY;
        }
        return cleaned.replace("NoneType", "None").replace("TextIOWrapper", "TextIO");
    }

    public static String normalize(PyType type) {
        return type == null ? ANY : normalize(type.toDisplayString());
    }
}
