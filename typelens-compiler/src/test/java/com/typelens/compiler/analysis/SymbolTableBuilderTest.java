package com.typelens.compiler.analysis;

import com.typelens.compiler.analysis.types.PyTypes;
import com.typelens.compiler.ast.decl.Parameter;
import com.typelens.compiler.parser.TreeBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SymbolTableBuilder 与 DeferredResolver 单元测试
 */
class SymbolTableBuilderTest {

    // ============ 辅助方法 ============

    private SymbolTable build(String source) {
        return new SymbolTableBuilder().build(new TreeBuilder("<test>").build(source));
    }

    private SymbolTable buildAndResolve(String source) {
        SymbolTable table = build(source);
        new DeferredResolver().resolve(table);
        return table;
    }

    private String variableType(SymbolTable table, String name) {
        VariableSymbol v = table.getVariable(name);
        assertNotNull(v, "variable not registered: " + name);
        return v.getInferredType().toDisplayString();
    }

    private String returnType(SymbolTable table, String name) {
        FunctionSymbol fn = table.getFunction(name);
        assertNotNull(fn, "function not registered: " + name);
        return fn.getInferredReturnType() == null ? null : fn.getInferredReturnType().toDisplayString();
    }

    // ============ 变量 ============

    @Nested
    @DisplayName("变量登记")
    class VariableTests {

        @Test
        @DisplayName("简单赋值")
        void testSimpleAssignment() {
            SymbolTable table = build("total = 0\nlabel = 'x'\n");
            VariableSymbol total = table.getVariable("total");
            assertEquals(1, total.getLine());
            assertEquals(0, total.getColumn());
            assertEquals(0, total.getScopeDepth());
            assertTrue(total.isSimpleTarget());
            assertEquals("int", variableType(table, "total"));
            assertEquals("str", variableType(table, "label"));
        }

        @Test
        @DisplayName("后一次赋值覆盖前一次")
        void testReassignment() {
            SymbolTable table = build("x = 1\nx = 'a'\n");
            assertEquals(2, table.getVariable("x").getLine());
            assertEquals("str", variableType(table, "x"));
        }

        @Test
        @DisplayName("带注解的赋值记录注解文本")
        void testAnnotated() {
            SymbolTable table = build("limit: Optional[int] = None\nalias: 'Node'\n");
            VariableSymbol limit = table.getVariable("limit");
            assertEquals("Optional[int]", limit.getAnnotation());
            assertEquals("None", limit.getInferredType().toDisplayString());
            assertEquals("Node", table.getVariable("alias").getAnnotation());
            assertNull(table.getVariable("alias").getInferredType());
        }

        @Test
        @DisplayName("链式赋值的目标不是单一目标")
        void testChainedTargets() {
            SymbolTable table = build("a = b = 0\n");
            assertFalse(table.getVariable("a").isSimpleTarget());
            assertFalse(table.getVariable("b").isSimpleTarget());
        }

        @Test
        @DisplayName("解包目标登记为绑定")
        void testUnpackBindings() {
            SymbolTable table = build("first, second = 1, 2\n");
            assertFalse(table.hasVariable("first"));
            ScopeEntry entry = table.getGlobalScope().resolveLocal("second");
            assertNotNull(entry);
            assertEquals(SymbolKind.BINDING, entry.getKind());
        }

        @Test
        @DisplayName("海象运算符目标")
        void testWalrus() {
            SymbolTable table = build("if (n := 10) > 5:\n    pass\n");
            VariableSymbol n = table.getVariable("n");
            assertNotNull(n);
            assertFalse(n.isSimpleTarget());
            assertEquals("int", n.getInferredType().toDisplayString());
        }

        @Test
        @DisplayName("循环、with、except 与 global 名称")
        void testOtherBindings() {
            SymbolTable table = build(
                    "for i in range(3):\n    pass\n"
                    + "with open('f') as handle:\n    pass\n"
                    + "try:\n    pass\nexcept ValueError as err:\n    pass\n"
                    + "def f():\n    global registry\n");
            Scope global = table.getGlobalScope();
            assertEquals(SymbolKind.BINDING, global.resolveLocal("i").getKind());
            assertEquals(SymbolKind.BINDING, global.resolveLocal("handle").getKind());
            assertEquals(SymbolKind.BINDING, global.resolveLocal("err").getKind());
            assertTrue(table.getFunction("f").getLocalNames().contains("registry"));
        }

        @Test
        @DisplayName("函数内变量同样进入登记表")
        void testFunctionLocals() {
            SymbolTable table = build("def f():\n    local = [1]\n    return local\n");
            VariableSymbol local = table.getVariable("local");
            assertEquals(1, local.getScopeDepth());
            assertEquals("list[int]", local.getInferredType().toDisplayString());
            assertTrue(table.getFunction("f").getLocalNames().contains("local"));
        }
    }

    // ============ 函数 ============

    @Nested
    @DisplayName("函数登记")
    class FunctionTests {

        @Test
        @DisplayName("参数信息")
        void testParameters() {
            SymbolTable table = build("def f(a, b: str, c=1.5, *rest, d=None, **options):\n    pass\n");
            FunctionSymbol fn = table.getFunction("f");
            assertEquals(Arrays.asList("a", "b", "c", "rest", "d", "options"), fn.getParameterNames());
            assertEquals("str", fn.getParameter("b").getAnnotation());
            assertEquals("float", fn.getParameter("c").getDefaultType().toDisplayString());
            assertEquals(PyTypes.NONE, fn.getParameter("d").getDefaultType());
            assertEquals(Parameter.ParamKind.KEYWORD_ONLY, fn.getParameter("d").getKind());
            assertEquals(Parameter.ParamKind.VAR_KEYWORD, fn.getParameter("options").getKind());
            assertFalse(fn.getParameter("a").hasDefault());
        }

        @Test
        @DisplayName("返回类型取各 return 值的联合")
        void testReturnUnion() {
            SymbolTable table = build("def f(flag):\n    if flag:\n        return 1\n    return None\n");
            FunctionSymbol fn = table.getFunction("f");
            assertTrue(fn.hasValueReturn());
            assertEquals("int | None", returnType(table, "f"));
        }

        @Test
        @DisplayName("参数类型参与返回类型推断")
        void testParameterTypesInBody() {
            SymbolTable table = build("def scale(x: float, times=2):\n    return x * times\n");
            assertEquals("float", returnType(table, "scale"));
        }

        @Test
        @DisplayName("没有 return 值时返回类型为空")
        void testNoReturn() {
            SymbolTable table = build("def log(msg):\n    print(msg)\n");
            assertFalse(table.getFunction("log").hasValueReturn());
            assertNull(returnType(table, "log"));
        }

        @Test
        @DisplayName("生成器")
        void testGenerator() {
            SymbolTable table = build("def gen():\n    yield 1\n    yield 2\n");
            assertTrue(table.getFunction("gen").isGenerator());
            assertEquals("Generator[int, None, None]", returnType(table, "gen"));
        }

        @Test
        @DisplayName("yield from 取可迭代对象的元素类型")
        void testYieldFrom() {
            SymbolTable table = build("def gen():\n    yield from ['a', 'b']\n");
            assertEquals("Generator[str, None, None]", returnType(table, "gen"));
        }

        @Test
        @DisplayName("嵌套函数中的 yield 不影响外层")
        void testNestedYield() {
            SymbolTable table = build("def outer():\n    def inner():\n        yield 1\n    return inner\n");
            assertFalse(table.getFunction("outer").isGenerator());
            assertTrue(table.getFunction("inner").isGenerator());
        }

        @Test
        @DisplayName("异步函数与装饰器")
        void testAsyncAndDecorators() {
            SymbolTable table = build("@app.route('/x')\nasync def handler():\n    pass\n");
            FunctionSymbol fn = table.getFunction("handler");
            assertTrue(fn.isAsync());
            assertEquals(Arrays.asList("app.route"), fn.getDecorators());
            assertEquals(2, fn.getLine());
        }
    }

    // ============ 类 ============

    @Nested
    @DisplayName("类登记")
    class ClassTests {

        private final String source = "class Account(Base):\n"
                + "    def __init__(self, owner):\n"
                + "        self.balance = 0.0\n"
                + "        self.owner = owner\n"
                + "    def deposit(self, amount):\n"
                + "        return self.balance + amount\n"
                + "    @staticmethod\n"
                + "    def create(owner):\n"
                + "        return Account(owner)\n";

        @Test
        @DisplayName("基类与方法")
        void testClassSymbol() {
            SymbolTable table = build(source);
            ClassSymbol cls = table.getClass("Account");
            assertEquals(Arrays.asList("Base"), cls.getBases());
            assertEquals(Arrays.asList("__init__", "deposit", "create"), cls.getMethods());
            assertEquals("Account", table.getFunction("deposit").getOwnerClass());
            assertTrue(table.getFunction("create").isStaticMethod());
        }

        @Test
        @DisplayName("self 属性登记为实例属性")
        void testAttributes() {
            SymbolTable table = build(source);
            ClassSymbol cls = table.getClass("Account");
            assertEquals("float", cls.getAttributeType("balance").toDisplayString());
            assertTrue(cls.getAttributes().containsKey("owner"));
            assertFalse(table.hasVariable("balance"));
        }

        @Test
        @DisplayName("接收者类型为所在类")
        void testReceiver() {
            SymbolTable table = build(source);
            assertEquals("float", returnType(table, "deposit"));
            assertEquals("Account", returnType(table, "create"));
        }

        @Test
        @DisplayName("作用域数量")
        void testScopeCount() {
            SymbolTable table = build(source);
            // 模块 + 类 + 三个方法
            assertEquals(5, table.getScopeCount());
        }
    }

    // ============ 导入 ============

    @Nested
    @DisplayName("导入登记")
    class ImportTests {

        @Test
        @DisplayName("import 与 from-import")
        void testImports() {
            SymbolTable table = build("import os.path\nimport numpy as np\nfrom ..util import helper as h\n");
            ImportSymbol os = table.getImport("os");
            assertNotNull(os);
            assertEquals("os.path", os.getModule());
            assertEquals(ImportSymbol.ImportKind.IMPORT, os.getImportKind());

            ImportSymbol np = table.getImport("np");
            assertEquals("numpy", np.getModule());
            assertEquals("np", np.getAlias());

            ImportSymbol h = table.getImport("h");
            assertEquals(ImportSymbol.ImportKind.FROM_IMPORT, h.getImportKind());
            assertEquals("util", h.getModule());
            assertEquals("helper", h.getOriginalName());
            assertEquals(2, h.getLevel());
        }

        @Test
        @DisplayName("通配导入不登记")
        void testWildcard() {
            assertTrue(build("from os import *\n").getImports().isEmpty());
        }
    }

    // ============ 延迟占位解析 ============

    @Nested
    @DisplayName("延迟占位解析")
    class DeferredTests {

        @Test
        @DisplayName("前向引用的函数返回类型")
        void testForwardReference() {
            String source = "result = compute()\n\ndef compute():\n    return 42\n";
            SymbolTable table = build(source);
            assertEquals("deferred(compute)", variableType(table, "result"));

            new DeferredResolver().resolve(table);
            assertEquals("int", variableType(table, "result"));
        }

        @Test
        @DisplayName("从不返回值的函数解析为 None")
        void testNoValueReturn() {
            SymbolTable table = buildAndResolve("outcome = setup()\n\ndef setup():\n    print('ready')\n");
            assertEquals("None", variableType(table, "outcome"));
        }

        @Test
        @DisplayName("函数返回类型中的延迟占位")
        void testFunctionReturn() {
            SymbolTable table = buildAndResolve("def a():\n    return b()\n\ndef b():\n    return 'x'\n");
            assertEquals("str", returnType(table, "a"));
        }

        @Test
        @DisplayName("联合类型逐个备选解析")
        void testUnionAlternatives() {
            SymbolTable table = buildAndResolve(
                    "def pick(flag):\n    if flag:\n        return load()\n    return None\n\ndef load():\n    return 1.5\n");
            assertEquals("float | None", returnType(table, "pick"));
        }

        @Test
        @DisplayName("未知名称保持占位")
        void testUnresolved() {
            SymbolTable table = buildAndResolve("value_x = fetch_remote()\n");
            assertEquals("deferred(fetch_remote)", variableType(table, "value_x"));
        }

        @Test
        @DisplayName("多个实例各自解析为所属类")
        void testInstancesOfLaterClasses() {
            SymbolTable table = buildAndResolve(
                    "alice = Person('Alice')\n"
                    + "bob = Person('Bob')\n"
                    + "ride = Car()\n"
                    + "\n"
                    + "class Person:\n"
                    + "    def __init__(self, name):\n"
                    + "        self.name = name\n"
                    + "\n"
                    + "class Car:\n"
                    + "    pass\n");
            assertEquals("Person", variableType(table, "alice"));
            assertEquals("Person", variableType(table, "bob"));
            assertEquals("Car", variableType(table, "ride"));
        }

        @Test
        @DisplayName("小写类名在类声明后解析")
        void testLowercaseClassDeclaredLater() {
            SymbolTable table = build(
                    "first = point(1)\nsecond = vector()\nthird = point(2)\n\n"
                    + "class point:\n    pass\n\nclass vector:\n    pass\n");
            assertEquals("deferred(point)", variableType(table, "first"));

            assertEquals(3, new DeferredResolver().resolve(table));
            assertEquals("point", variableType(table, "first"));
            assertEquals("vector", variableType(table, "second"));
            assertEquals("point", variableType(table, "third"));
        }

        @Test
        @DisplayName("解析计数")
        void testResolveCount() {
            SymbolTable table = build("r = later()\ndef later():\n    return 1\n");
            assertEquals(1, new DeferredResolver().resolve(table));
            assertEquals(0, new DeferredResolver().resolve(table));
        }
    }
}
