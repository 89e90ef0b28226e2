package com.typelens.compiler.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 符号表：四类按名称索引的登记表 + 模块级作用域
 *
 * <p>同一登记表内后声明的覆盖先声明的。</p>
 */
public final class SymbolTable {
    private final Scope globalScope;
    private final Map<String, FunctionSymbol> functions = new LinkedHashMap<String, FunctionSymbol>();
    private final Map<String, ClassSymbol> classes = new LinkedHashMap<String, ClassSymbol>();
    private final Map<String, VariableSymbol> variables = new LinkedHashMap<String, VariableSymbol>();
    private final Map<String, ImportSymbol> imports = new LinkedHashMap<String, ImportSymbol>();

    public SymbolTable() {
        this.globalScope = new Scope(Scope.ScopeType.GLOBAL, null, null);
    }

    public Scope getGlobalScope() { return globalScope; }

    // ============ 登记 ============

    public void defineFunction(FunctionSymbol symbol) { functions.put(symbol.getName(), symbol); }
    public void defineClass(ClassSymbol symbol) { classes.put(symbol.getName(), symbol); }
    public void defineVariable(VariableSymbol symbol) { variables.put(symbol.getName(), symbol); }
    public void defineImport(ImportSymbol symbol) { imports.put(symbol.getName(), symbol); }

    // ============ 查询 ============

    public FunctionSymbol getFunction(String name) { return functions.get(name); }
    public ClassSymbol getClass(String name) { return classes.get(name); }
    public VariableSymbol getVariable(String name) { return variables.get(name); }
    public ImportSymbol getImport(String name) { return imports.get(name); }

    public boolean hasFunction(String name) { return functions.containsKey(name); }
    public boolean hasClass(String name) { return classes.containsKey(name); }
    public boolean hasVariable(String name) { return variables.containsKey(name); }
    public boolean hasImport(String name) { return imports.containsKey(name); }

    public Map<String, FunctionSymbol> getFunctions() { return Collections.unmodifiableMap(functions); }
    public Map<String, ClassSymbol> getClasses() { return Collections.unmodifiableMap(classes); }
    public Map<String, VariableSymbol> getVariables() { return Collections.unmodifiableMap(variables); }
    public Map<String, ImportSymbol> getImports() { return Collections.unmodifiableMap(imports); }

    /** 四个登记表与模块级作用域中的全部名称 */
    public Set<String> getDeclaredNames() {
        Set<String> names = new LinkedHashSet<String>();
        names.addAll(functions.keySet());
        names.addAll(classes.keySet());
        names.addAll(variables.keySet());
        names.addAll(imports.keySet());
        names.addAll(globalScope.getEntries().keySet());
        return names;
    }

    /** 作用域树中的作用域总数 */
    public int getScopeCount() {
        return globalScope.countScopes();
    }
}
