package com.typelens.cli;

import com.google.gson.JsonParseException;
import com.typelens.compiler.AnalyzerOptions;
import com.typelens.compiler.AnnotationReport;
import com.typelens.compiler.CodeAnalyzer;
import com.typelens.compiler.annotate.TypeSuggestions;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

/**
 * picocli annotate 子命令：为源码补全类型注解
 */
@Command(name = "annotate", description = "为源码文件补全类型注解")
public class AnnotateCommand extends SourceCommand {

    @Option(names = {"-s", "--suggestions"}, description = "外部类型建议 JSON 文件")
    String suggestionsFile;

    @Option(names = {"-o", "--output"}, description = "写入注解后源码的路径（默认输出到标准输出）")
    String output;

    @Option(names = "--json", description = "输出完整的注解报告 JSON")
    boolean json;

    @Option(names = "--pretty", description = "格式化 JSON 输出")
    boolean pretty;

    @Override
    public Integer call() {
        String source = readSource();
        if (source == null) return EXIT_FAILURE;

        TypeSuggestions suggestions = TypeSuggestions.EMPTY;
        if (suggestionsFile != null) {
            String text = readText(suggestionsFile);
            if (text == null) return EXIT_FAILURE;
            try {
                suggestions = SuggestionsReader.read(text);
            } catch (JsonParseException e) {
                err().println("错误: 类型建议文件格式无效 - " + e.getMessage());
                return EXIT_FAILURE;
            }
        }

        AnalyzerOptions options = AnalyzerOptions.builder().fileName(fileName()).build();
        AnnotationReport report = new CodeAnalyzer(options).annotate(source, suggestions);
        if (!report.isSuccess()) {
            if (json) out().println(ReportJson.gson(pretty).toJson(ReportJson.annotation(report)));
            err().println("错误: " + report.getError());
            return EXIT_FAILURE;
        }

        if (output != null) {
            try {
                Files.write(Paths.get(output), report.getAnnotatedCode().getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                err().println("错误: 无法写入文件 - " + output + " (" + e.getMessage() + ")");
                return EXIT_FAILURE;
            }
        }
        if (json) {
            out().println(ReportJson.gson(pretty).toJson(ReportJson.annotation(report)));
        } else if (output == null) {
            out().print(report.getAnnotatedCode());
            out().flush();
        } else {
            out().println("已写入 " + report.getAnnotationCount() + " 条类型信息: " + output);
        }
        return EXIT_OK;
    }
}
