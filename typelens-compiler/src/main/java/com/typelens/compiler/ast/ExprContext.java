package com.typelens.compiler.ast;

/**
 * 名称引用的上下文：读取、绑定或删除
 */
public enum ExprContext {
    LOAD("Load"),
    STORE("Store"),
    DEL("Del");

    private final String displayName;

    ExprContext(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
