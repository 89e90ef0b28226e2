package com.typelens.compiler.analysis;

import com.typelens.compiler.analysis.types.PyType;
import com.typelens.compiler.ast.AstNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 作用域
 */
public final class Scope {

    public enum ScopeType {
        GLOBAL,     // 模块顶层
        CLASS,      // class body
        FUNCTION    // function body
    }

    private final ScopeType type;
    private final Scope parent;
    private final AstNode node;
    private final int depth;
    private final Map<String, ScopeEntry> entries = new LinkedHashMap<String, ScopeEntry>();
    private final List<Scope> children = new ArrayList<Scope>();
    // 参数与接收者在本作用域内的已知类型
    private final Map<String, PyType> localTypes = new LinkedHashMap<String, PyType>();

    // 所属类名（class scope 中 = 类名；方法 scope 中 = 所在类名）
    private String ownerTypeName;
    // 方法的第一个参数名（通常为 self），用于识别实例属性赋值
    private String receiverName;

    public Scope(ScopeType type, Scope parent, AstNode node) {
        this.type = type;
        this.parent = parent;
        this.node = node;
        this.depth = parent != null ? parent.depth + 1 : 0;
    }

    public ScopeType getType() { return type; }
    public Scope getParent() { return parent; }
    public AstNode getNode() { return node; }
    /** 嵌套深度：模块为 0，每进入一层函数或类体加 1 */
    public int getDepth() { return depth; }
    public List<Scope> getChildren() { return Collections.unmodifiableList(children); }

    public String getOwnerTypeName() { return ownerTypeName; }
    public void setOwnerTypeName(String ownerTypeName) { this.ownerTypeName = ownerTypeName; }

    public String getReceiverName() { return receiverName; }
    public void setReceiverName(String receiverName) { this.receiverName = receiverName; }

    public void addChild(Scope child) { children.add(child); }

    public void setLocalType(String name, PyType type) { localTypes.put(name, type); }

    /**
     * 从外到内合并各层函数作用域的局部类型，内层覆盖外层
     */
    public Map<String, PyType> collectLocalTypes() {
        Map<String, PyType> merged = parent != null ? parent.collectLocalTypes() : new LinkedHashMap<String, PyType>();
        if (type == ScopeType.FUNCTION) {
            merged.putAll(localTypes);
        }
        return merged;
    }

    /** 注册名称到当前作用域（同名后者覆盖前者） */
    public void define(ScopeEntry entry) {
        entries.put(entry.getName(), entry);
    }

    /** 仅在尚未定义时注册，已有更具体的条目时保留原条目 */
    public void defineIfAbsent(ScopeEntry entry) {
        entries.putIfAbsent(entry.getName(), entry);
    }

    /** 从当前作用域向上查找 */
    public ScopeEntry resolve(String name) {
        ScopeEntry e = entries.get(name);
        if (e != null) return e;
        if (parent != null) return parent.resolve(name);
        return null;
    }

    /** 仅查找当前作用域 */
    public ScopeEntry resolveLocal(String name) {
        return entries.get(name);
    }

    public Map<String, ScopeEntry> getEntries() {
        return Collections.unmodifiableMap(entries);
    }

    /** 作用域树中的作用域总数（含自身） */
    public int countScopes() {
        int count = 1;
        for (Scope child : children) {
            count += child.countScopes();
        }
        return count;
    }
}
