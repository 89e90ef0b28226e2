package com.typelens.compiler.analysis;

import com.typelens.compiler.analysis.types.PyType;
import com.typelens.compiler.ast.decl.Parameter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 函数符号
 */
public final class FunctionSymbol extends Symbol {

    /**
     * 单个参数的声明信息
     */
    public static final class ParameterInfo {
        private final String name;
        private final Parameter.ParamKind kind;
        private final String annotation;      // 可选
        private final PyType defaultType;     // 无默认值时为 null

        public ParameterInfo(String name, Parameter.ParamKind kind, String annotation, PyType defaultType) {
            this.name = name;
            this.kind = kind;
            this.annotation = annotation;
            this.defaultType = defaultType;
        }

        public String getName() { return name; }
        public Parameter.ParamKind getKind() { return kind; }
        public String getAnnotation() { return annotation; }
        public PyType getDefaultType() { return defaultType; }
        public boolean hasDefault() { return defaultType != null; }
    }

    private final List<ParameterInfo> parameters;
    private final String returnAnnotation;
    private final List<String> decorators;
    private final int scopeDepth;
    private final boolean async;
    private final String ownerClass;          // 方法所在类，普通函数为 null
    private final Set<String> localNames = new LinkedHashSet<String>();

    private PyType inferredReturnType;        // 没有带值的 return 时为 null
    private boolean generator;
    private boolean hasValueReturn;

    public FunctionSymbol(String name, int line, List<ParameterInfo> parameters, String returnAnnotation,
                          List<String> decorators, int scopeDepth, boolean async, String ownerClass) {
        super(name, line);
        this.parameters = Collections.unmodifiableList(new ArrayList<ParameterInfo>(parameters));
        this.returnAnnotation = returnAnnotation;
        this.decorators = Collections.unmodifiableList(new ArrayList<String>(decorators));
        this.scopeDepth = scopeDepth;
        this.async = async;
        this.ownerClass = ownerClass;
    }

    @Override
    public SymbolKind getKind() { return SymbolKind.FUNCTION; }

    public List<ParameterInfo> getParameters() { return parameters; }

    /** 按声明顺序的参数名 */
    public List<String> getParameterNames() {
        List<String> names = new ArrayList<String>(parameters.size());
        for (ParameterInfo p : parameters) {
            names.add(p.getName());
        }
        return names;
    }

    public ParameterInfo getParameter(String name) {
        for (ParameterInfo p : parameters) {
            if (p.getName().equals(name)) return p;
        }
        return null;
    }

    public String getReturnAnnotation() { return returnAnnotation; }
    public List<String> getDecorators() { return decorators; }
    public int getScopeDepth() { return scopeDepth; }
    public boolean isAsync() { return async; }

    /** 是否直接声明在类体中 */
    public boolean isMethod() { return ownerClass != null; }
    public String getOwnerClass() { return ownerClass; }

    /** 是否带有 @staticmethod 装饰器（首参数不是接收者） */
    public boolean isStaticMethod() {
        return decorators.contains("staticmethod");
    }

    public PyType getInferredReturnType() { return inferredReturnType; }
    public void setInferredReturnType(PyType inferredReturnType) { this.inferredReturnType = inferredReturnType; }

    public boolean isGenerator() { return generator; }
    public void setGenerator(boolean generator) { this.generator = generator; }

    public boolean hasValueReturn() { return hasValueReturn; }
    public void setHasValueReturn(boolean hasValueReturn) { this.hasValueReturn = hasValueReturn; }

    /** 函数体内绑定的名称（不含参数） */
    public Set<String> getLocalNames() { return Collections.unmodifiableSet(localNames); }

    void addLocalNames(Iterable<String> names) {
        for (String n : names) {
            localNames.add(n);
        }
    }
}
