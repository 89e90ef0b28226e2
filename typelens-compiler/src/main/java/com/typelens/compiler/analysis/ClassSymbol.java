package com.typelens.compiler.analysis;

import com.typelens.compiler.analysis.types.PyType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 类符号
 */
public final class ClassSymbol extends Symbol {
    private final List<String> bases;
    private final List<String> decorators;
    private final int scopeDepth;
    private final List<String> methods = new ArrayList<String>();
    private final Map<String, PyType> attributes = new LinkedHashMap<String, PyType>();

    public ClassSymbol(String name, int line, List<String> bases, List<String> decorators, int scopeDepth) {
        super(name, line);
        this.bases = Collections.unmodifiableList(new ArrayList<String>(bases));
        this.decorators = Collections.unmodifiableList(new ArrayList<String>(decorators));
        this.scopeDepth = scopeDepth;
    }

    @Override
    public SymbolKind getKind() { return SymbolKind.CLASS; }

    public List<String> getBases() { return bases; }
    public List<String> getDecorators() { return decorators; }
    public int getScopeDepth() { return scopeDepth; }

    /** 直接声明在类体中的方法名 */
    public List<String> getMethods() { return Collections.unmodifiableList(methods); }

    public boolean hasMethod(String name) { return methods.contains(name); }

    void addMethod(String name) {
        if (!methods.contains(name)) {
            methods.add(name);
        }
    }

    /** 实例属性（self.x = ...）及其推断类型 */
    public Map<String, PyType> getAttributes() { return Collections.unmodifiableMap(attributes); }

    public PyType getAttributeType(String name) { return attributes.get(name); }

    /**
     * 记录实例属性。同一属性多次赋值时取联合类型。
     */
    void addAttribute(String name, PyType type) {
        attributes.merge(name, type, (a, b) -> a.equals(b) ? a
                : com.typelens.compiler.analysis.types.PyTypes.union(a, b));
    }
}
