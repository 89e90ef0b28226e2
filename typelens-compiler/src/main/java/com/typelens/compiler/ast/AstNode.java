package com.typelens.compiler.ast;

/**
 * AST 节点基类
 *
 * <p>节点 id 由 {@link NodeNumberer} 在构建完成后按先序遍历分配，
 * 仅在单次构建内唯一，与结构相等性无关。</p>
 */
public abstract class AstNode {
    protected final SourceLocation location;
    private int id = -1;

    protected AstNode(SourceLocation location) {
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public int getLine() {
        return location.getLine();
    }

    public int getColumn() {
        return location.getColumn();
    }

    public int getId() {
        return id;
    }

    void assignId(int id) {
        this.id = id;
    }

    /** 节点种类（封闭集合） */
    public abstract NodeKind getKind();

    public abstract <R, C> R accept(AstVisitor<R, C> visitor, C context);
}
