package com.typelens.compiler.annotate;

/**
 * 注解合成结果：改写后的源码与选定的类型
 */
public final class AnnotationOutcome {
    private final String annotatedSource;
    private final TypeInfo typeInfo;

    public AnnotationOutcome(String annotatedSource, TypeInfo typeInfo) {
        this.annotatedSource = annotatedSource;
        this.typeInfo = typeInfo;
    }

    public String getAnnotatedSource() { return annotatedSource; }
    public TypeInfo getTypeInfo() { return typeInfo; }
}
