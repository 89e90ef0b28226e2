package com.typelens.compiler.annotate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 合成注解时为每个变量和函数选定的类型
 */
public final class TypeInfo {

    /** 变量类型的来源 */
    public enum Source {
        ANNOTATION("annotation"),
        INFERRED("inferred"),
        SUGGESTION("suggestion"),
        FALLBACK("fallback");

        private final String displayName;

        Source(String displayName) {
            this.displayName = displayName;
        }

        public String getDisplayName() {
            return displayName;
        }
    }

    public static final class VariableType {
        private final String type;
        private final int line;
        private final Source source;

        public VariableType(String type, int line, Source source) {
            this.type = type;
            this.line = line;
            this.source = source;
        }

        public String getType() { return type; }
        public int getLine() { return line; }
        public Source getSource() { return source; }
    }

    public static final class FunctionType {
        private final Map<String, String> params;
        private final String returnType;
        private final int line;

        public FunctionType(Map<String, String> params, String returnType, int line) {
            this.params = Collections.unmodifiableMap(new LinkedHashMap<String, String>(params));
            this.returnType = returnType;
            this.line = line;
        }

        /** 参数名 → 类型（不含方法接收者） */
        public Map<String, String> getParams() { return params; }
        public String getReturnType() { return returnType; }
        public int getLine() { return line; }
    }

    private final Map<String, VariableType> variables;
    private final Map<String, FunctionType> functions;

    public TypeInfo(Map<String, VariableType> variables, Map<String, FunctionType> functions) {
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<String, VariableType>(variables));
        this.functions = Collections.unmodifiableMap(new LinkedHashMap<String, FunctionType>(functions));
    }

    public Map<String, VariableType> getVariables() { return variables; }
    public Map<String, FunctionType> getFunctions() { return functions; }

    public VariableType getVariable(String name) { return variables.get(name); }
    public FunctionType getFunction(String name) { return functions.get(name); }

    /** 变量条目数 + 函数条目数 */
    public int getAnnotationCount() {
        return variables.size() + functions.size();
    }
}
