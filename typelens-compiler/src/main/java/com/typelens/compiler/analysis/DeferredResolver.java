package com.typelens.compiler.analysis;

import com.typelens.compiler.analysis.types.ClassPyType;
import com.typelens.compiler.analysis.types.DeferredPyType;
import com.typelens.compiler.analysis.types.PyType;
import com.typelens.compiler.analysis.types.PyTypes;
import com.typelens.compiler.analysis.types.UnionPyType;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * 延迟占位解析：符号表构建完成后执行一次，不做不动点迭代。
 *
 * <p>deferred(name) 的解析顺序：已知类 → 类名；大写开头 → 该名称；
 * 已知函数的返回注解或确定的推断返回类型 → 该类型；从不返回值的普通函数 → None；
 * 其余保持占位。先处理函数返回类型，再处理变量。</p>
 */
public final class DeferredResolver {

    private static final Logger LOG = Logger.getLogger(DeferredResolver.class.getName());

    /**
     * @return 被改写的记录数
     */
    public int resolve(SymbolTable table) {
        int resolved = 0;
        for (FunctionSymbol fn : table.getFunctions().values()) {
            PyType type = fn.getInferredReturnType();
            if (type == null) continue;
            PyType result = resolveType(type, table);
            if (!result.equals(type)) {
                fn.setInferredReturnType(result);
                resolved++;
            }
        }
        for (VariableSymbol v : table.getVariables().values()) {
            PyType type = v.getInferredType();
            if (type == null) continue;
            PyType result = resolveType(type, table);
            if (!result.equals(type)) {
                v.setInferredType(result);
                resolved++;
            }
        }
        LOG.fine("已解析延迟占位: " + resolved);
        return resolved;
    }

    /** 解析单个类型；联合类型逐个备选解析 */
    public PyType resolveType(PyType type, SymbolTable table) {
        if (type instanceof DeferredPyType) {
            return resolveName(((DeferredPyType) type).getTargetName(), table);
        }
        if (type instanceof UnionPyType) {
            List<PyType> alternatives = new ArrayList<PyType>();
            for (PyType alt : ((UnionPyType) type).getAlternatives()) {
                alternatives.add(resolveType(alt, table));
            }
            return PyTypes.union(alternatives);
        }
        return type;
    }

    private PyType resolveName(String name, SymbolTable table) {
        if (table.hasClass(name)) {
            return new ClassPyType(name);
        }
        if (!name.isEmpty() && Character.isUpperCase(name.charAt(0))) {
            return new ClassPyType(name);
        }
        FunctionSymbol fn = table.getFunction(name);
        if (fn != null) {
            if (fn.getReturnAnnotation() != null) {
                return PyTypes.parse(fn.getReturnAnnotation());
            }
            PyType inferred = fn.getInferredReturnType();
            if (TypeUnifier.isConcrete(inferred) && !containsDeferred(inferred)) {
                return inferred;
            }
            if (!fn.hasValueReturn() && !fn.isGenerator()) {
                return PyTypes.NONE;
            }
        }
        return PyTypes.deferred(name);
    }

    static boolean containsDeferred(PyType type) {
        if (type instanceof DeferredPyType) return true;
        if (type instanceof UnionPyType) {
            for (PyType alt : ((UnionPyType) type).getAlternatives()) {
                if (alt instanceof DeferredPyType) return true;
            }
        }
        return false;
    }
}
