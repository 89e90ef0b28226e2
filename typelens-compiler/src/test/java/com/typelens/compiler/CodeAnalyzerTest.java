package com.typelens.compiler;

import com.typelens.compiler.analysis.UndeclaredReference;
import com.typelens.compiler.annotate.TypeInfo;
import com.typelens.compiler.annotate.TypeSuggestions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CodeAnalyzer 门面测试
 */
class CodeAnalyzerTest {

    private final CodeAnalyzer analyzer = new CodeAnalyzer();

    // ============ 分析 ============

    @Nested
    @DisplayName("analyze")
    class AnalyzeTests {

        @Test
        @DisplayName("成功时返回语法树、符号表和未声明引用")
        void testSuccess() {
            AnalysisReport report = analyzer.analyze("def f(x):\n    return x + y\nresult = f(1)\n");
            assertTrue(report.isSuccess());
            assertNull(report.getError());
            assertNotNull(report.getTree());
            assertEquals(2, report.getTree().getBody().size());
            assertTrue(report.getSymbolTable().hasFunction("f"));
            assertTrue(report.getSymbolTable().hasVariable("result"));
            List<UndeclaredReference> refs = report.getUndeclaredReferences();
            assertEquals(1, refs.size());
            assertEquals("y", refs.get(0).getName());
            assertEquals(CodeFingerprint.hash("def f(x):\n    return x + y\nresult = f(1)\n"), report.getCodeHash());
        }

        @Test
        @DisplayName("语法错误")
        void testSyntaxError() {
            AnalysisReport report = analyzer.analyze("def broken(:\n");
            assertFalse(report.isSuccess());
            assertTrue(report.getError().startsWith(CodeAnalyzer.SYNTAX_ERROR + ": "), report.getError());
            assertNull(report.getTree());
            assertNull(report.getSymbolTable());
            assertTrue(report.getUndeclaredReferences().isEmpty());
            assertNotNull(report.getCodeHash());
        }

        @Test
        @DisplayName("空源码")
        void testEmptySource() {
            AnalysisReport report = analyzer.analyze("");
            assertTrue(report.isSuccess());
            assertTrue(report.getTree().getBody().isEmpty());
            assertEquals(1, report.getSymbolTable().getScopeCount());
        }

        @Test
        @DisplayName("null 源码不抛异常")
        void testNullSource() {
            AnalysisReport report = analyzer.analyze(null);
            assertFalse(report.isSuccess());
            assertTrue(report.getError().startsWith(CodeAnalyzer.ANALYSIS_ERROR));
            assertNull(report.getCodeHash());
        }

        @Test
        @DisplayName("选项控制语法树和未声明检测")
        void testOptions() {
            CodeAnalyzer quiet = new CodeAnalyzer(AnalyzerOptions.builder()
                    .includeTree(false)
                    .detectUndeclared(false)
                    .build());
            AnalysisReport report = quiet.analyze("print(missing)\n");
            assertTrue(report.isSuccess());
            assertNull(report.getTree());
            assertTrue(report.getUndeclaredReferences().isEmpty());
        }

        @Test
        @DisplayName("抽样上限影响容器推断")
        void testSampleLimit() {
            String source = "mixed = [1, 'a', 'b', 2]\n";
            assertEquals("list", analyzer.analyze(source)
                    .getSymbolTable().getVariable("mixed").getInferredType().toDisplayString());
            CodeAnalyzer sampling = new CodeAnalyzer(AnalyzerOptions.builder().sampleLimit(2).build());
            assertEquals("list[int]", sampling.analyze(source)
                    .getSymbolTable().getVariable("mixed").getInferredType().toDisplayString());
        }

        @Test
        @DisplayName("无效选项")
        void testInvalidOptions() {
            assertThrows(IllegalArgumentException.class, () -> AnalyzerOptions.builder().sampleLimit(1));
            assertThrows(IllegalArgumentException.class, () -> AnalyzerOptions.builder().maxTupleArity(-1));
            AnalyzerOptions options = AnalyzerOptions.DEFAULTS.toBuilder().fileName(null).build();
            assertEquals("<input>", options.getFileName());
        }
    }

    // ============ 注解 ============

    @Nested
    @DisplayName("annotate")
    class AnnotateTests {

        @Test
        @DisplayName("成功时返回注解后的源码和类型信息")
        void testSuccess() {
            AnnotationReport report = analyzer.annotate("count = 0\ndef inc(step=1):\n    return count + step\n");
            assertTrue(report.isSuccess());
            assertEquals("count: int = 0\ndef inc(step: int = 1) -> int:\n    return count + step\n",
                    report.getAnnotatedCode());
            assertTrue(report.isChanged());
            assertEquals(2, report.getAnnotationCount());
            TypeInfo info = report.getTypeInfo();
            assertEquals("int", info.getVariable("count").getType());
        }

        @Test
        @DisplayName("建议参与类型选择")
        void testSuggestions() {
            TypeSuggestions suggestions = TypeSuggestions.builder().inference("raw", "bytes").build();
            AnnotationReport report = analyzer.annotate("raw = load()\n", suggestions);
            assertEquals("raw: bytes = load()\n", report.getAnnotatedCode());
        }

        @Test
        @DisplayName("语法错误时保留原文")
        void testSyntaxError() {
            AnnotationReport report = analyzer.annotate("x = (1,\n");
            assertFalse(report.isSuccess());
            assertTrue(report.getError().startsWith(CodeAnalyzer.SYNTAX_ERROR + ": "));
            assertEquals("x = (1,\n", report.getOriginalCode());
            assertEquals(report.getOriginalCode(), report.getAnnotatedCode());
            assertNull(report.getTypeInfo());
            assertEquals(0, report.getAnnotationCount());
            assertFalse(report.isChanged());
        }

        @Test
        @DisplayName("null 源码")
        void testNullSource() {
            AnnotationReport report = analyzer.annotate(null);
            assertFalse(report.isSuccess());
            assertEquals("", report.getOriginalCode());
            assertTrue(report.getError().startsWith(CodeAnalyzer.ANNOTATION_ERROR));
        }

        @Test
        @DisplayName("没有可注解内容时不变")
        void testNothingToAnnotate() {
            AnnotationReport report = analyzer.annotate("print('hi')\n");
            assertTrue(report.isSuccess());
            assertFalse(report.isChanged());
            assertEquals(0, report.getAnnotationCount());
        }
    }

    // ============ 深层嵌套 ============

    @Nested
    @DisplayName("深层嵌套")
    class DeepNestingTests {

        @Test
        @DisplayName("括号嵌套过深报告语法错误")
        void testDeepParentheses() {
            StringBuilder sb = new StringBuilder("x = ");
            for (int i = 0; i < 20000; i++) sb.append('(');
            sb.append('1');
            for (int i = 0; i < 20000; i++) sb.append(')');
            String source = sb.toString();

            AnalysisReport analysis = analyzer.analyze(source);
            assertFalse(analysis.isSuccess());
            assertTrue(analysis.getError().startsWith(CodeAnalyzer.SYNTAX_ERROR + ": too many nested parentheses"),
                    analysis.getError());

            AnnotationReport annotation = analyzer.annotate(source);
            assertFalse(annotation.isSuccess());
            assertEquals(source, annotation.getAnnotatedCode());
        }

        @Test
        @DisplayName("超长运算链不抛出异常")
        void testLongOperatorChain() {
            String source = chain("1", " + ", 100000);

            AnalysisReport analysis = assertDoesNotThrow(() -> analyzer.analyze(source));
            assertFalse(analysis.isSuccess());
            assertEquals(CodeAnalyzer.ANALYSIS_ERROR + ": " + CodeAnalyzer.TOO_DEEP, analysis.getError());
            assertNotNull(analysis.getCodeHash());

            AnnotationReport annotation = assertDoesNotThrow(() -> analyzer.annotate(source));
            assertFalse(annotation.isSuccess());
            assertTrue(annotation.getError().endsWith(CodeAnalyzer.TOO_DEEP));
            assertEquals(0, annotation.getAnnotationCount());
        }

        @Test
        @DisplayName("超长一元运算链不抛出异常")
        void testLongUnaryChain() {
            StringBuilder sb = new StringBuilder("x = ");
            for (int i = 0; i < 100000; i++) sb.append("-");
            sb.append('1');
            AnalysisReport report = assertDoesNotThrow(() -> analyzer.analyze(sb.toString()));
            assertFalse(report.isSuccess());
            assertTrue(report.getError().endsWith(CodeAnalyzer.TOO_DEEP), report.getError());
        }

        private String chain(String operand, String operator, int terms) {
            StringBuilder sb = new StringBuilder("x = ").append(operand);
            for (int i = 1; i < terms; i++) sb.append(operator).append(operand);
            return sb.append('\n').toString();
        }
    }

        // ============ 指纹 ============

    @Nested
    @DisplayName("代码指纹")
    class FingerprintTests {

        @Test
        @DisplayName("MD5 十六进制摘要")
        void testHash() {
            assertEquals("d41d8cd98f00b204e9800998ecf8427e", CodeFingerprint.hash(""));
            assertEquals("5d41402abc4b2a76b9719d911017c592", CodeFingerprint.hash("hello"));
        }

        @Test
        @DisplayName("相同源码得到相同摘要")
        void testDeterministic() {
            assertEquals(analyzer.analyze("x = 1\n").getCodeHash(), analyzer.annotate("x = 1\n").getCodeHash());
            assertNotEquals(CodeFingerprint.hash("x = 1\n"), CodeFingerprint.hash("x = 2\n"));
        }

        @Test
        @DisplayName("代码模式提取")
        void testPatterns() {
            List<String> patterns = CodeFingerprint.extractPatterns("x = 1\nif x:\n    print(x)\nprint(x)\n");
            assertEquals(Arrays.asList("assignment_x_1", "function_call_print", "control_flow_if"), patterns);
        }

        @Test
        @DisplayName("分析报告携带代码模式")
        void testReportPatterns() {
            AnalysisReport report = analyzer.analyze("total = 0\nfor i in range(3):\n    total = add(total, i)\n");
            assertEquals(Arrays.asList("assignment_total_0", "assignment_total_add(total, i)",
                    "function_call_range", "function_call_add", "control_flow_for"), report.getCodePatterns());
            AnalysisReport broken = analyzer.analyze("print(x)\ndef (:\n");
            assertFalse(broken.isSuccess());
            assertEquals(Arrays.asList("function_call_print"), broken.getCodePatterns());
            assertTrue(analyzer.analyze(null).getCodePatterns().isEmpty());
        }

        @Test
        @DisplayName("比较不算赋值")
        void testComparisonIgnored() {
            List<String> patterns = CodeFingerprint.extractPatterns("while a == b:\n    pass\n");
            assertEquals(Arrays.asList("control_flow_while"), patterns);
        }
    }
}
