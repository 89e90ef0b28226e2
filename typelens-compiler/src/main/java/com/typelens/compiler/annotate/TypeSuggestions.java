package com.typelens.compiler.annotate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 外部提供的类型建议：变量名 → 类型，函数名 → 参数类型与返回类型。
 * 空或 null 的条目在构建时忽略。
 */
public final class TypeSuggestions {

    public static final TypeSuggestions EMPTY = new Builder().build();

    /**
     * 单个函数的建议
     */
    public static final class FunctionSuggestion {
        private final Map<String, String> params;
        private final String returnType;

        FunctionSuggestion(Map<String, String> params, String returnType) {
            this.params = Collections.unmodifiableMap(new LinkedHashMap<String, String>(params));
            this.returnType = returnType;
        }

        public Map<String, String> getParams() { return params; }
        public String getReturnType() { return returnType; }
    }

    private final Map<String, String> inferences;
    private final Map<String, FunctionSuggestion> functions;

    private TypeSuggestions(Map<String, String> inferences, Map<String, FunctionSuggestion> functions) {
        this.inferences = Collections.unmodifiableMap(inferences);
        this.functions = Collections.unmodifiableMap(functions);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, String> getInferences() { return inferences; }
    public Map<String, FunctionSuggestion> getFunctionSuggestions() { return functions; }

    /** 变量建议，没有时返回 null */
    public String getInference(String variable) {
        return inferences.get(variable);
    }

    public String getParamSuggestion(String function, String param) {
        FunctionSuggestion fs = functions.get(function);
        return fs != null ? fs.getParams().get(param) : null;
    }

    public String getReturnSuggestion(String function) {
        FunctionSuggestion fs = functions.get(function);
        return fs != null ? fs.getReturnType() : null;
    }

    public boolean isEmpty() {
        return inferences.isEmpty() && functions.isEmpty();
    }

    public static final class Builder {
        private final Map<String, String> inferences = new LinkedHashMap<String, String>();
        private final Map<String, Map<String, String>> params = new LinkedHashMap<String, Map<String, String>>();
        private final Map<String, String> returns = new LinkedHashMap<String, String>();

        private static boolean usable(String s) {
            return s != null && !s.trim().isEmpty();
        }

        public Builder inference(String variable, String type) {
            if (variable != null && usable(type)) inferences.put(variable, type.trim());
            return this;
        }

        public Builder param(String function, String param, String type) {
            if (function == null) return this;
            Map<String, String> forFunction = params.computeIfAbsent(function, k -> new LinkedHashMap<String, String>());
            if (param != null && usable(type)) {
                forFunction.put(param, type.trim());
            }
            return this;
        }

        public Builder returnType(String function, String type) {
            if (function != null && usable(type)) returns.put(function, type.trim());
            return this;
        }

        public TypeSuggestions build() {
            Map<String, FunctionSuggestion> functions = new LinkedHashMap<String, FunctionSuggestion>();
            for (Map.Entry<String, Map<String, String>> e : params.entrySet()) {
                functions.put(e.getKey(), new FunctionSuggestion(e.getValue(), returns.get(e.getKey())));
            }
            for (Map.Entry<String, String> e : returns.entrySet()) {
                if (!functions.containsKey(e.getKey())) {
                    functions.put(e.getKey(), new FunctionSuggestion(Collections.<String, String>emptyMap(), e.getValue()));
                }
            }
            return new TypeSuggestions(new LinkedHashMap<String, String>(inferences), functions);
        }
    }
}
