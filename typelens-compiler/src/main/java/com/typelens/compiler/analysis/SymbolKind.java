package com.typelens.compiler.analysis;

/**
 * 作用域条目类型
 */
public enum SymbolKind {
    FUNCTION,       // def 声明
    CLASS,          // class 声明
    VARIABLE,       // 对简单名称的赋值
    IMPORT,         // 导入绑定的名称
    PARAMETER,      // 函数参数
    BINDING;        // 循环目标、with/except 别名、global/nonlocal 等其他绑定

    /** 与可视化输出一致的小写名称 */
    public String getDisplayName() {
        return name().toLowerCase();
    }
}
