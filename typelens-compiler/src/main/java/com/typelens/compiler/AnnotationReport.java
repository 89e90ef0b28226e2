package com.typelens.compiler;

import com.typelens.compiler.annotate.TypeInfo;

/**
 * 注解报告。失败时 annotatedCode 与原文相同，typeInfo 为 null。
 */
public final class AnnotationReport {

    private final boolean success;
    private final String originalCode;
    private final String annotatedCode;
    private final TypeInfo typeInfo;
    private final String error;
    private final String codeHash;

    private AnnotationReport(boolean success, String originalCode, String annotatedCode,
                             TypeInfo typeInfo, String error, String codeHash) {
        this.success = success;
        this.originalCode = originalCode;
        this.annotatedCode = annotatedCode;
        this.typeInfo = typeInfo;
        this.error = error;
        this.codeHash = codeHash;
    }

    static AnnotationReport success(String original, String annotated, TypeInfo typeInfo, String codeHash) {
        return new AnnotationReport(true, original, annotated, typeInfo, null, codeHash);
    }

    static AnnotationReport failure(String original, String error, String codeHash) {
        return new AnnotationReport(false, original, original, null, error, codeHash);
    }

    public boolean isSuccess() { return success; }
    public String getOriginalCode() { return originalCode; }
    public String getAnnotatedCode() { return annotatedCode; }
    public TypeInfo getTypeInfo() { return typeInfo; }
    public String getError() { return error; }
    public String getCodeHash() { return codeHash; }

    /** 变量条目数 + 函数条目数；失败时为 0 */
    public int getAnnotationCount() {
        return typeInfo != null ? typeInfo.getAnnotationCount() : 0;
    }

    /** 源码是否被改写 */
    public boolean isChanged() {
        return !originalCode.equals(annotatedCode);
    }
}
