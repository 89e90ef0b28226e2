package com.typelens.compiler.parser;

import com.typelens.compiler.ast.NodeNumberer;
import com.typelens.compiler.ast.decl.Module;
import com.typelens.compiler.lexer.Lexer;

/**
 * 语法树构建器：词法分析、语法分析并为每个节点按先序编号
 *
 * <p>源码无法分词或解析时抛出 {@link ParseException}，不返回部分结果。</p>
 */
public final class TreeBuilder {

    public static final String DEFAULT_FILE_NAME = "<input>";

    private final String fileName;

    public TreeBuilder() {
        this(DEFAULT_FILE_NAME);
    }

    public TreeBuilder(String fileName) {
        this.fileName = fileName != null ? fileName : DEFAULT_FILE_NAME;
    }

    public Module build(String source) {
        Lexer lexer = new Lexer(source, fileName);
        Parser parser = new Parser(lexer);
        Module module = parser.parse();
        NodeNumberer.number(module);
        return module;
    }
}
