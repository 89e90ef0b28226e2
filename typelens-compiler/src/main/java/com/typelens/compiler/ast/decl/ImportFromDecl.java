package com.typelens.compiler.ast.decl;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.NodeKind;
import com.typelens.compiler.ast.SourceLocation;
import com.typelens.compiler.ast.stmt.Statement;

import java.util.List;

/**
 * 选择性导入：from ..pkg.mod import a as b, c
 */
public class ImportFromDecl extends Statement {
    private final String module;    // 纯相对导入 (from . import x) 时为 null
    private final int level;        // 前导点的个数
    private final List<ImportAlias> names;

    public ImportFromDecl(SourceLocation location, String module, int level, List<ImportAlias> names) {
        super(location);
        this.module = module;
        this.level = level;
        this.names = names;
    }

    public String getModule() {
        return module;
    }

    public int getLevel() {
        return level;
    }

    public List<ImportAlias> getNames() {
        return names;
    }

    /** from m import * */
    public boolean isWildcard() {
        return names.size() == 1 && "*".equals(names.get(0).getName());
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.IMPORT_FROM;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitImportFromDecl(this, context);
    }
}
