package com.typelens.compiler.analysis;

import com.typelens.compiler.analysis.types.PyType;
import com.typelens.compiler.analysis.types.PyTypes;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 元素抽样 + 类型统一。
 */
public final class TypeUnifier {

    public static final int DEFAULT_SAMPLE_LIMIT = 10;

    private final int sampleLimit;

    public TypeUnifier() {
        this(DEFAULT_SAMPLE_LIMIT);
    }

    public TypeUnifier(int sampleLimit) {
        if (sampleLimit < 2) {
            throw new IllegalArgumentException("sample limit must be at least 2: " + sampleLimit);
        }
        this.sampleLimit = sampleLimit;
    }

    public int getSampleLimit() {
        return sampleLimit;
    }

    /**
     * 抽样下标：数量不超过上限时全部取用，否则等步长取 sampleLimit 个，总是包含首尾
     */
    public List<Integer> sampleIndices(int size) {
        List<Integer> indices = new ArrayList<Integer>();
        if (size <= sampleLimit) {
            for (int i = 0; i < size; i++) indices.add(i);
            return indices;
        }
        for (int i = 0; i < sampleLimit; i++) {
            indices.add((int) ((long) i * (size - 1) / (sampleLimit - 1)));
        }
        return indices;
    }

    /** 从列表中取抽样元素 */
    public <T> List<T> sample(List<T> items) {
        List<T> out = new ArrayList<T>();
        for (int index : sampleIndices(items.size())) {
            out.add(items.get(index));
        }
        return out;
    }

    /**
     * 统一一组类型：
     * 相同 → 该类型；仅 int 与 float → float；数值与 str 混合 → Any；
     * 含不确定类型（Any / unknown / 延迟占位）→ Any；其余取最多三路的联合，否则 Any。
     * 空集合返回 unknown。
     */
    public PyType unify(Collection<? extends PyType> types) {
        Set<PyType> distinct = new LinkedHashSet<PyType>();
        for (PyType t : types) {
            if (t != null) distinct.add(t);
        }
        if (distinct.isEmpty()) return PyTypes.UNKNOWN;
        if (distinct.size() == 1) return distinct.iterator().next();

        boolean hasNumeric = false;
        boolean onlyIntFloat = true;
        for (PyType t : distinct) {
            if (t.isIndeterminate()) return PyTypes.ANY;
            if (PyTypes.isNumeric(t)) hasNumeric = true;
            if (!t.equals(PyTypes.INT) && !t.equals(PyTypes.FLOAT)) onlyIntFloat = false;
        }
        if (onlyIntFloat) {
            return PyTypes.FLOAT;
        }
        if (hasNumeric && distinct.contains(PyTypes.STR)) {
            return PyTypes.ANY;
        }
        return PyTypes.union(distinct);
    }

    public PyType unify(PyType a, PyType b) {
        List<PyType> pair = new ArrayList<PyType>(2);
        pair.add(a);
        pair.add(b);
        return unify(pair);
    }

    /**
     * 是否可作为容器元素类型参数：确定、非 unknown
     */
    public static boolean isConcrete(PyType type) {
        return type != null && !type.isIndeterminate() && type != PyTypes.UNKNOWN;
    }
}
