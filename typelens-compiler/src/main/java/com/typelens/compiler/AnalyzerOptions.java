package com.typelens.compiler;

import com.typelens.compiler.analysis.TypeInferenceEngine;
import com.typelens.compiler.analysis.TypeUnifier;

/**
 * 分析选项（不可变，通过 {@link #builder()} 构建）
 */
public final class AnalyzerOptions {

    public static final AnalyzerOptions DEFAULTS = builder().build();

    private final boolean includeTree;
    private final boolean detectUndeclared;
    private final int sampleLimit;
    private final int maxTupleArity;
    private final String fileName;

    private AnalyzerOptions(Builder b) {
        this.includeTree = b.includeTree;
        this.detectUndeclared = b.detectUndeclared;
        this.sampleLimit = b.sampleLimit;
        this.maxTupleArity = b.maxTupleArity;
        this.fileName = b.fileName;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** 分析报告是否携带语法树 */
    public boolean isIncludeTree() { return includeTree; }
    public boolean isDetectUndeclared() { return detectUndeclared; }
    /** 推断集合元素类型时的最大采样数 */
    public int getSampleLimit() { return sampleLimit; }
    /** 元组按位置给出精确类型的最大长度 */
    public int getMaxTupleArity() { return maxTupleArity; }
    public String getFileName() { return fileName; }

    public Builder toBuilder() {
        return new Builder()
                .includeTree(includeTree)
                .detectUndeclared(detectUndeclared)
                .sampleLimit(sampleLimit)
                .maxTupleArity(maxTupleArity)
                .fileName(fileName);
    }

    public static final class Builder {
        private boolean includeTree = true;
        private boolean detectUndeclared = true;
        private int sampleLimit = TypeUnifier.DEFAULT_SAMPLE_LIMIT;
        private int maxTupleArity = TypeInferenceEngine.DEFAULT_MAX_TUPLE_ARITY;
        private String fileName = "<input>";

        public Builder includeTree(boolean includeTree) {
            this.includeTree = includeTree;
            return this;
        }

        public Builder detectUndeclared(boolean detectUndeclared) {
            this.detectUndeclared = detectUndeclared;
            return this;
        }

        public Builder sampleLimit(int sampleLimit) {
            if (sampleLimit < 2) {
                throw new IllegalArgumentException("sample limit must be at least 2: " + sampleLimit);
            }
            this.sampleLimit = sampleLimit;
            return this;
        }

        public Builder maxTupleArity(int maxTupleArity) {
            if (maxTupleArity < 0) {
                throw new IllegalArgumentException("max tuple arity must not be negative: " + maxTupleArity);
            }
            this.maxTupleArity = maxTupleArity;
            return this;
        }

        public Builder fileName(String fileName) {
            if (fileName != null) this.fileName = fileName;
            return this;
        }

        public AnalyzerOptions build() {
            return new AnalyzerOptions(this);
        }
    }
}
