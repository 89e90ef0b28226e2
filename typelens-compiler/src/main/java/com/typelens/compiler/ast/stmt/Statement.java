package com.typelens.compiler.ast.stmt;

import com.typelens.compiler.ast.AstNode;
import com.typelens.compiler.ast.SourceLocation;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }
}
