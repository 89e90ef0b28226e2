package com.typelens.compiler.ast.expr;

import com.typelens.compiler.ast.AstNode;
import com.typelens.compiler.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }
}
