package com.typelens.compiler.analysis;

import com.typelens.compiler.analysis.types.PyType;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * 推断上下文：符号表 + 局部绑定（推导式目标、lambda 参数、方法接收者）
 *
 * <p>不可变；{@link #withBindings(Map)} 返回叠加了新绑定的上下文。</p>
 */
public final class InferenceContext {
    private final SymbolTable symbolTable;
    private final Map<String, PyType> bindings;

    public InferenceContext(SymbolTable symbolTable) {
        this(symbolTable, Collections.<String, PyType>emptyMap());
    }

    private InferenceContext(SymbolTable symbolTable, Map<String, PyType> bindings) {
        this.symbolTable = symbolTable;
        this.bindings = bindings;
    }

    public SymbolTable getSymbolTable() {
        return symbolTable;
    }

    /** 局部绑定的类型，未绑定时返回 null */
    public PyType lookupBinding(String name) {
        return bindings.get(name);
    }

    public InferenceContext withBindings(Map<String, PyType> extra) {
        if (extra.isEmpty()) return this;
        Map<String, PyType> merged = new HashMap<String, PyType>(bindings);
        merged.putAll(extra);
        return new InferenceContext(symbolTable, Collections.unmodifiableMap(merged));
    }
}
