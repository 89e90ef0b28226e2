package com.typelens.compiler.annotate;

import com.typelens.compiler.analysis.DeferredResolver;
import com.typelens.compiler.analysis.SymbolTable;
import com.typelens.compiler.analysis.SymbolTableBuilder;
import com.typelens.compiler.parser.TreeBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AnnotationSynthesizer 单元测试
 */
class AnnotationSynthesizerTest {

    private final AnnotationSynthesizer synthesizer = new AnnotationSynthesizer();

    // ============ 辅助方法 ============

    private AnnotationOutcome run(String source, TypeSuggestions suggestions) {
        SymbolTable table = new SymbolTableBuilder().build(new TreeBuilder("<test>").build(source));
        new DeferredResolver().resolve(table);
        return synthesizer.annotate(source, table, suggestions);
    }

    private String annotate(String source) {
        return run(source, TypeSuggestions.EMPTY).getAnnotatedSource();
    }

    private static String lines(String... lines) {
        return String.join("\n", lines);
    }

    // ============ 端到端 ============

    @Nested
    @DisplayName("源码改写")
    class RewriteTests {

        private final String greeter = lines(
                "class Greeter:",
                "    def __init__(self, name):",
                "        self.name = name",
                "    def greet(self):",
                "        return \"Hello, \" + self.name",
                "g = Greeter(\"Alice\")",
                "");

        @Test
        @DisplayName("方法、接收者与实例变量")
        void testGreeter() {
            String expected = lines(
                    "class Greeter:",
                    "    def __init__(self, name: str) -> None:",
                    "        self.name = name",
                    "    def greet(self) -> str:",
                    "        return \"Hello, \" + self.name",
                    "g: Greeter = Greeter(\"Alice\")",
                    "");
            assertEquals(expected, annotate(greeter));
        }

        @Test
        @DisplayName("对输出再次注解结果不变")
        void testIdempotent() {
            String once = annotate(greeter);
            assertEquals(once, annotate(once));
        }

        @Test
        @DisplayName("默认值参数")
        void testDefaults() {
            String source = lines("def scale(factor=2.0, label=None):", "    return factor");
            assertEquals(lines("def scale(factor: float = 2.0, label: Any = None) -> float:", "    return factor"),
                    annotate(source));
        }

        @Test
        @DisplayName("默认值为 None 时取可选类型")
        void testNoneDefault() {
            String source = lines("def greet(name=None):", "    return 'hi'");
            assertEquals(lines("def greet(name: str | None = None) -> str:", "    return 'hi'"),
                    annotate(source));
        }

        @Test
        @DisplayName("可变参数保持原样")
        void testVariadic() {
            String source = lines("def v(first, *args, **kwargs):", "    pass");
            assertEquals(lines("def v(first: Any, *args, **kwargs) -> None:", "    pass"), annotate(source));
        }

        @Test
        @DisplayName("仅关键字参数与仅位置参数分隔符")
        void testSeparators() {
            String source = lines("def s(a, /, b, *, c=1):", "    pass");
            assertEquals(lines("def s(a: Any, /, b: Any, *, c: int = 1) -> None:", "    pass"), annotate(source));
        }

        @Test
        @DisplayName("静态方法没有接收者")
        void testStaticMethod() {
            String source = lines(
                    "class Shape:",
                    "    @staticmethod",
                    "    def make(size):",
                    "        return Shape()");
            assertEquals(lines(
                    "class Shape:",
                    "    @staticmethod",
                    "    def make(size: Any) -> Shape:",
                    "        return Shape()"), annotate(source));
        }

        @Test
        @DisplayName("异步函数")
        void testAsync() {
            assertEquals(lines("async def run_all() -> None:", "    pass"),
                    annotate(lines("async def run_all():", "    pass")));
        }

        @Test
        @DisplayName("生成器")
        void testGenerator() {
            assertEquals(lines("def gen() -> Generator[int, None, None]:", "    yield 1"),
                    annotate(lines("def gen():", "    yield 1")));
        }

        @Test
        @DisplayName("单行函数体与行尾注释")
        void testInlineBodyAndComment() {
            assertEquals("def one() -> int: return 1", annotate("def one(): return 1"));
            assertEquals(lines("def f(x: Any) -> None:  # note", "    pass"),
                    annotate(lines("def f(x):  # note", "    pass")));
        }

        @Test
        @DisplayName("函数内变量保留缩进")
        void testNestedVariable() {
            String source = lines("def f():", "    total = 0", "    return total");
            assertEquals(lines("def f() -> int:", "    total: int = 0", "    return total"), annotate(source));
        }
    }

    // ============ 可逆性 ============

    @Nested
    @DisplayName("可逆性")
    class ReversibilityTests {

        @Test
        @DisplayName("删除插入的注解得到原始行")
        void testStripInsertedAnnotations() {
            String source = lines(
                    "count = 0",
                    "ratio = 0.5",
                    "def scale(value, factor = 2):",
                    "    return value * factor",
                    "class Shape:",
                    "    def area(self, side):",
                    "        return side * side",
                    "label = 'x'",
                    "");
            AnnotationOutcome outcome = run(source, TypeSuggestions.EMPTY);
            String[] original = source.split("\n", -1);
            String[] annotated = outcome.getAnnotatedSource().split("\n", -1);
            assertEquals(original.length, annotated.length);

            TypeInfo info = outcome.getTypeInfo();
            for (Map.Entry<String, TypeInfo.VariableType> e : info.getVariables().entrySet()) {
                int index = e.getValue().getLine() - 1;
                annotated[index] = annotated[index].replace(e.getKey() + ": " + e.getValue().getType(), e.getKey());
            }
            for (Map.Entry<String, TypeInfo.FunctionType> e : info.getFunctions().entrySet()) {
                int index = e.getValue().getLine() - 1;
                String line = annotated[index];
                for (Map.Entry<String, String> param : e.getValue().getParams().entrySet()) {
                    line = line.replace(param.getKey() + ": " + param.getValue(), param.getKey());
                }
                annotated[index] = line.replace(" -> " + e.getValue().getReturnType() + ":", ":");
            }
            assertArrayEquals(original, annotated);
            assertNotEquals(source, outcome.getAnnotatedSource());
        }
    }

    // ============ 跳过的行 ============

    @Nested
    @DisplayName("不改写的行")
    class SkipTests {

        @Test
        @DisplayName("已有注解的行")
        void testAlreadyAnnotated() {
            String source = lines("def add(a: int, b):", "    return a", "limit: int = 5", "def f(x) -> int:",
                    "    return x");
            assertEquals(source, annotate(source));
        }

        @Test
        @DisplayName("跨行的 def")
        void testMultiLineDef() {
            String source = lines("def long(a,", "         b):", "    pass");
            assertEquals(source, annotate(source));
        }

        @Test
        @DisplayName("分号、链式赋值与解包")
        void testNonSimpleAssignments() {
            String source = lines("a = 1; b = 2", "c = d = 0", "e, f = 1, 2", "");
            assertEquals(source, annotate(source));
        }

        @Test
        @DisplayName("比较运算不是赋值")
        void testComparisonLine() {
            assertNull(AnnotationSynthesizer.annotateVariableLine("x == 1", "x", "int"));
            assertEquals("x: int = 1", AnnotationSynthesizer.annotateVariableLine("x = 1", "x", "int"));
            assertNull(AnnotationSynthesizer.annotateVariableLine("xy = 1", "x", "int"));
        }

        @Test
        @DisplayName("函数名必须一致")
        void testFunctionNameMismatch() {
            TypeInfo.FunctionType type = new TypeInfo.FunctionType(new LinkedHashMap<String, String>(), "int", 1);
            assertNull(AnnotationSynthesizer.annotateFunctionLine("def other():", "one", type));
            assertNull(AnnotationSynthesizer.annotateFunctionLine("def one(", "one", type));
        }

        @Test
        @DisplayName("括号与字符串中的逗号")
        void testNestedDefaults() {
            Map<String, String> params = new LinkedHashMap<String, String>();
            params.put("pair", "tuple[int, int]");
            params.put("sep", "str");
            TypeInfo.FunctionType type = new TypeInfo.FunctionType(params, "None", 1);
            assertEquals("def j(pair: tuple[int, int] = (1, 2), sep: str = ',') -> None:",
                    AnnotationSynthesizer.annotateFunctionLine("def j(pair=(1, 2), sep=','):", "j", type));
        }
    }

    // ============ 类型选择 ============

    @Nested
    @DisplayName("类型选择")
    class CollectTests {

        @Test
        @DisplayName("变量类型来源")
        void testVariableSources() {
            TypeSuggestions suggestions = TypeSuggestions.builder().inference("payload", "dict").build();
            TypeInfo info = run(lines("limit: int = 5", "ratio = 0.5", "payload = remote()", "thing = remote()"),
                    suggestions).getTypeInfo();
            assertEquals(TypeInfo.Source.ANNOTATION, info.getVariable("limit").getSource());
            assertEquals(TypeInfo.Source.INFERRED, info.getVariable("ratio").getSource());
            assertEquals("float", info.getVariable("ratio").getType());
            assertEquals(TypeInfo.Source.SUGGESTION, info.getVariable("payload").getSource());
            assertEquals("dict", info.getVariable("payload").getType());
            assertEquals(TypeInfo.Source.FALLBACK, info.getVariable("thing").getSource());
            assertEquals("Any", info.getVariable("thing").getType());
            assertEquals(3, info.getVariable("payload").getLine());
        }

        @Test
        @DisplayName("建议只在无法推断时使用")
        void testSuggestions() {
            TypeSuggestions suggestions = TypeSuggestions.builder()
                    .param("area", "w", "int")
                    .param("area", "h", "int")
                    .returnType("area", "str")
                    .returnType("fetch", "bytes")
                    .inference("payload", "dict")
                    .build();
            String source = lines("def area(w, h):", "    return w * h", "def fetch():", "    return remote()",
                    "payload = remote()");
            String expected = lines("def area(w: int, h: int) -> int | float:", "    return w * h",
                    "def fetch() -> bytes:", "    return remote()", "payload: dict = remote()");
            assertEquals(expected, run(source, suggestions).getAnnotatedSource());
        }

        @Test
        @DisplayName("接收者不计入参数")
        void testReceiverExcluded() {
            TypeInfo info = run(lines("class C:", "    def m(self, count):", "        return count"),
                    TypeSuggestions.EMPTY).getTypeInfo();
            TypeInfo.FunctionType m = info.getFunction("m");
            assertFalse(m.getParams().containsKey("self"));
            assertEquals("int", m.getParams().get("count"));
            assertEquals("int", m.getReturnType());
            assertEquals(2, m.getLine());
        }

        @Test
        @DisplayName("注解文本规范化")
        void testNormalizedAnnotations() {
            TypeInfo info = run(lines("def f(a: 'Node', b: NoneType) -> TextIOWrapper:", "    pass"),
                    TypeSuggestions.EMPTY).getTypeInfo();
            TypeInfo.FunctionType f = info.getFunction("f");
            assertEquals("Node", f.getParams().get("a"));
            assertEquals("None", f.getParams().get("b"));
            assertEquals("TextIO", f.getReturnType());
        }

        @Test
        @DisplayName("条目总数")
        void testAnnotationCount() {
            TypeInfo info = run(lines("x = 1", "y = 'a'", "def f():", "    pass"), null).getTypeInfo();
            assertEquals(3, info.getAnnotationCount());
        }
    }
}
