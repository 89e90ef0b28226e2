package com.typelens.cli;

import com.typelens.compiler.CodeAnalyzer;
import com.typelens.compiler.ast.decl.Module;
import com.typelens.compiler.parser.ParseException;
import com.typelens.compiler.parser.TreeBuilder;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * picocli ast 子命令：只输出语法树
 */
@Command(name = "ast", description = "以 JSON 输出语法树")
public class AstCommand extends SourceCommand {

    @Option(names = "--pretty", description = "格式化 JSON 输出")
    boolean pretty;

    @Override
    public Integer call() {
        String source = readSource();
        if (source == null) return EXIT_FAILURE;
        try {
            Module tree = new TreeBuilder(fileName()).build(source);
            out().println(ReportJson.gson(pretty).toJson(AstJsonWriter.toJson(tree)));
            return EXIT_OK;
        } catch (ParseException e) {
            err().println("错误: " + CodeAnalyzer.SYNTAX_ERROR + ": " + e.getMessage());
            return EXIT_FAILURE;
        } catch (StackOverflowError e) {
            err().println("错误: " + CodeAnalyzer.ANALYSIS_ERROR + ": " + CodeAnalyzer.TOO_DEEP);
            return EXIT_FAILURE;
        }
    }
}
