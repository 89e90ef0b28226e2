package com.typelens.compiler.analysis.types;

/**
 * 类型描述符基类
 *
 * <p>类型描述符是不可变值，以规范化的显示字符串区分相等性：
 * 两个描述符显示字符串相同即视为同一类型。</p>
 */
public abstract class PyType {

    /** 规范化的显示字符串，如 {@code list[int]}、{@code int | None} */
    public abstract String toDisplayString();

    /** 是否为占位 / 兜底类型（Any、unknown、deferred） */
    public boolean isIndeterminate() {
        return false;
    }

    public boolean isUnion() {
        return false;
    }

    @Override
    public String toString() {
        return toDisplayString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PyType)) return false;
        return toDisplayString().equals(((PyType) o).toDisplayString());
    }

    @Override
    public int hashCode() {
        return toDisplayString().hashCode();
    }
}
