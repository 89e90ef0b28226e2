package com.typelens.compiler.ast.decl;

import com.typelens.compiler.ast.AstNode;
import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.NodeKind;
import com.typelens.compiler.ast.SourceLocation;
import com.typelens.compiler.ast.stmt.Statement;

import java.util.List;

/**
 * 模块（语法树根节点）
 */
public class Module extends AstNode {
    private final List<Statement> body;

    public Module(SourceLocation location, List<Statement> body) {
        super(location);
        this.body = body;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.MODULE;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitModule(this, context);
    }
}
