package com.typelens.compiler.ast;

/**
 * 按先序遍历为每个节点分配 id（从 0 开始，单次构建内唯一）
 */
public final class NodeNumberer extends AstScanner<Void> {
    private int next;

    private NodeNumberer() {
    }

    /**
     * 为整棵树编号，返回节点总数
     */
    public static int number(AstNode root) {
        NodeNumberer numberer = new NodeNumberer();
        numberer.scan(root, null);
        return numberer.next;
    }

    @Override
    protected void scan(AstNode node, Void ctx) {
        if (node == null) return;
        node.assignId(next++);
        node.accept(this, ctx);
    }
}
