package com.typelens.compiler.ast.decl;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.NodeKind;
import com.typelens.compiler.ast.SourceLocation;
import com.typelens.compiler.ast.expr.Expression;
import com.typelens.compiler.ast.expr.KeywordArgument;
import com.typelens.compiler.ast.stmt.Statement;

import java.util.List;

/**
 * 类声明
 */
public class ClassDef extends Declaration {
    private final List<Expression> bases;
    private final List<KeywordArgument> keywords;   // metaclass=... 等

    public ClassDef(SourceLocation location, String name, List<Expression> bases,
                    List<KeywordArgument> keywords, List<Statement> body,
                    List<Expression> decorators) {
        super(location, name, decorators, body);
        this.bases = bases;
        this.keywords = keywords;
    }

    public List<Expression> getBases() {
        return bases;
    }

    public List<KeywordArgument> getKeywords() {
        return keywords;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CLASS_DEF;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitClassDef(this, context);
    }
}
