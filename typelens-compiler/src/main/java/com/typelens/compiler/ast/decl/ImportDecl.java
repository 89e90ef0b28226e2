package com.typelens.compiler.ast.decl;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.NodeKind;
import com.typelens.compiler.ast.SourceLocation;
import com.typelens.compiler.ast.stmt.Statement;

import java.util.List;

/**
 * 整模块导入：import a.b as c, d
 */
public class ImportDecl extends Statement {
    private final List<ImportAlias> names;

    public ImportDecl(SourceLocation location, List<ImportAlias> names) {
        super(location);
        this.names = names;
    }

    public List<ImportAlias> getNames() {
        return names;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.IMPORT;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitImportDecl(this, context);
    }
}
