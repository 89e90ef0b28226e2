package com.typelens.cli;

import com.typelens.compiler.AnalysisReport;
import com.typelens.compiler.AnalyzerOptions;
import com.typelens.compiler.CodeAnalyzer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * picocli analyze 子命令：输出语法树、符号表与未声明引用
 */
@Command(name = "analyze", description = "分析源码文件并以 JSON 输出报告")
public class AnalyzeCommand extends SourceCommand {

    @Option(names = "--no-tree", description = "报告中不包含语法树")
    boolean noTree;

    @Option(names = "--no-undeclared", description = "跳过未声明名称检测")
    boolean noUndeclared;

    @Option(names = "--sample-limit", defaultValue = "10", description = "集合元素类型的最大采样数（默认 10）")
    int sampleLimit;

    @Option(names = "--pretty", description = "格式化 JSON 输出")
    boolean pretty;

    @Override
    public Integer call() {
        String source = readSource();
        if (source == null) return EXIT_FAILURE;

        AnalyzerOptions options = AnalyzerOptions.builder()
                .includeTree(!noTree)
                .detectUndeclared(!noUndeclared)
                .sampleLimit(sampleLimit)
                .fileName(fileName())
                .build();
        AnalysisReport report = new CodeAnalyzer(options).analyze(source);
        out().println(ReportJson.gson(pretty).toJson(ReportJson.analysis(report)));
        if (!report.isSuccess()) {
            err().println("错误: " + report.getError());
            return EXIT_FAILURE;
        }
        return EXIT_OK;
    }
}
