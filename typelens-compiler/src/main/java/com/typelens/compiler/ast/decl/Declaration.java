package com.typelens.compiler.ast.decl;

import com.typelens.compiler.ast.SourceLocation;
import com.typelens.compiler.ast.expr.Expression;
import com.typelens.compiler.ast.stmt.Statement;

import java.util.List;

/**
 * 带名称与装饰器的声明（函数、类）
 *
 * <p>位置取 def / class 关键词所在行，而非第一个装饰器所在行。</p>
 */
public abstract class Declaration extends Statement {
    protected final String name;
    protected final List<Expression> decorators;
    protected final List<Statement> body;

    protected Declaration(SourceLocation location, String name,
                          List<Expression> decorators, List<Statement> body) {
        super(location);
        this.name = name;
        this.decorators = decorators;
        this.body = body;
    }

    public String getName() {
        return name;
    }

    public List<Expression> getDecorators() {
        return decorators;
    }

    public List<Statement> getBody() {
        return body;
    }
}
