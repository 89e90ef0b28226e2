package com.typelens.compiler.analysis.types;

/**
 * 延迟占位：调用目标的返回类型在构建阶段尚不可知，
 * 由 {@link com.typelens.compiler.analysis.DeferredResolver} 在符号表完整后解析
 */
public final class DeferredPyType extends PyType {

    public static final String PREFIX = "deferred(";

    private final String targetName;

    public DeferredPyType(String targetName) {
        this.targetName = targetName;
    }

    /** 被调用的函数名或方法名 */
    public String getTargetName() {
        return targetName;
    }

    @Override
    public boolean isIndeterminate() {
        return true;
    }

    @Override
    public String toDisplayString() {
        return PREFIX + targetName + ")";
    }
}
