package com.typelens.compiler;

import com.typelens.compiler.analysis.DeferredResolver;
import com.typelens.compiler.analysis.SymbolTable;
import com.typelens.compiler.analysis.SymbolTableBuilder;
import com.typelens.compiler.analysis.TypeInferenceEngine;
import com.typelens.compiler.analysis.TypeUnifier;
import com.typelens.compiler.analysis.UndeclaredNameDetector;
import com.typelens.compiler.analysis.UndeclaredReference;
import com.typelens.compiler.annotate.AnnotationOutcome;
import com.typelens.compiler.annotate.AnnotationSynthesizer;
import com.typelens.compiler.annotate.TypeSuggestions;
import com.typelens.compiler.ast.decl.Module;
import com.typelens.compiler.parser.ParseException;
import com.typelens.compiler.parser.TreeBuilder;

import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 代码分析入口
 *
 * <p>流程：语法树构建 → 符号表构建 → 延迟占位解析 → 未声明名称检测 → 注解合成。
 * {@link #analyze} 与 {@link #annotate} 不抛出异常，失败写入报告的 error 字段。
 * 实例无状态，可在线程间共享。</p>
 */
public final class CodeAnalyzer {

    private static final Logger LOG = Logger.getLogger(CodeAnalyzer.class.getName());

    public static final String SYNTAX_ERROR = "Syntax error";
    public static final String ANALYSIS_ERROR = "Analysis error";
    public static final String ANNOTATION_ERROR = "Annotation error";

    public static final String TOO_DEEP = "source is nested too deeply";

    private final AnalyzerOptions options;

    public CodeAnalyzer() {
        this(AnalyzerOptions.DEFAULTS);
    }

    public CodeAnalyzer(AnalyzerOptions options) {
        this.options = options != null ? options : AnalyzerOptions.DEFAULTS;
    }

    public AnalyzerOptions getOptions() {
        return options;
    }

    // ============ 分析 ============

    public AnalysisReport analyze(String source) {
        if (source == null) {
            return AnalysisReport.failure(ANALYSIS_ERROR + ": source must not be null", null,
                    Collections.<String>emptyList());
        }
        String hash = CodeFingerprint.hash(source);
        List<String> patterns = CodeFingerprint.extractPatterns(source);
        try {
            Module tree = new TreeBuilder(options.getFileName()).build(source);
            SymbolTable table = buildSymbolTable(tree);
            List<UndeclaredReference> undeclared = options.isDetectUndeclared()
                    ? new UndeclaredNameDetector().detect(tree, table)
                    : Collections.<UndeclaredReference>emptyList();
            if (!undeclared.isEmpty() && LOG.isLoggable(Level.FINE)) {
                LOG.fine(options.getFileName() + ": " + undeclared.size() + " 个未声明引用");
            }
            return AnalysisReport.success(options.isIncludeTree() ? tree : null, table, undeclared, hash, patterns);
        } catch (ParseException e) {
            LOG.log(Level.FINE, "解析失败: " + options.getFileName(), e);
            return AnalysisReport.failure(SYNTAX_ERROR + ": " + e.getMessage(), hash, patterns);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "分析失败: " + options.getFileName(), e);
            return AnalysisReport.failure(ANALYSIS_ERROR + ": " + describe(e), hash, patterns);
        } catch (StackOverflowError e) {
            LOG.log(Level.WARNING, "嵌套过深: " + options.getFileName());
            return AnalysisReport.failure(ANALYSIS_ERROR + ": " + TOO_DEEP, hash, patterns);
        }
    }

    // ============ 注解 ============

    public AnnotationReport annotate(String source) {
        return annotate(source, TypeSuggestions.EMPTY);
    }

    public AnnotationReport annotate(String source, TypeSuggestions suggestions) {
        if (source == null) {
            return AnnotationReport.failure("", ANNOTATION_ERROR + ": source must not be null", null);
        }
        String hash = CodeFingerprint.hash(source);
        SymbolTable table;
        try {
            Module tree = new TreeBuilder(options.getFileName()).build(source);
            table = buildSymbolTable(tree);
        } catch (ParseException e) {
            LOG.log(Level.FINE, "解析失败: " + options.getFileName(), e);
            return AnnotationReport.failure(source, SYNTAX_ERROR + ": " + e.getMessage(), hash);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "分析失败: " + options.getFileName(), e);
            return AnnotationReport.failure(source, ANALYSIS_ERROR + ": " + describe(e), hash);
        } catch (StackOverflowError e) {
            LOG.log(Level.WARNING, "嵌套过深: " + options.getFileName());
            return AnnotationReport.failure(source, ANALYSIS_ERROR + ": " + TOO_DEEP, hash);
        }
        try {
            AnnotationOutcome outcome = new AnnotationSynthesizer().annotate(source, table, suggestions);
            return AnnotationReport.success(source, outcome.getAnnotatedSource(), outcome.getTypeInfo(), hash);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "注解合成失败: " + options.getFileName(), e);
            return AnnotationReport.failure(source, ANNOTATION_ERROR + ": " + describe(e), hash);
        } catch (StackOverflowError e) {
            LOG.log(Level.WARNING, "嵌套过深: " + options.getFileName());
            return AnnotationReport.failure(source, ANNOTATION_ERROR + ": " + TOO_DEEP, hash);
        }
    }

    // ============ 内部 ============

    private SymbolTable buildSymbolTable(Module tree) {
        TypeInferenceEngine engine = new TypeInferenceEngine(
                new TypeUnifier(options.getSampleLimit()), options.getMaxTupleArity());
        SymbolTable table = new SymbolTableBuilder(engine).build(tree);
        new DeferredResolver().resolve(table);
        return table;
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
