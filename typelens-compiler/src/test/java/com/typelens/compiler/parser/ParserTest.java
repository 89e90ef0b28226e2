package com.typelens.compiler.parser;

import com.typelens.compiler.ast.ExprContext;
import com.typelens.compiler.ast.decl.*;
import com.typelens.compiler.ast.decl.Module;
import com.typelens.compiler.ast.expr.*;
import com.typelens.compiler.ast.stmt.*;
import com.typelens.compiler.lexer.Lexer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parser 单元测试
 */
class ParserTest {

    // ============ 辅助方法 ============

    private Module parse(String source) {
        return new Parser(new Lexer(source, "<test>")).parse();
    }

    private Statement firstStatement(String source) {
        List<Statement> body = parse(source).getBody();
        assertFalse(body.isEmpty(), "Expected at least one statement");
        return body.get(0);
    }

    private Expression expression(String source) {
        Statement stmt = firstStatement(source);
        assertInstanceOf(ExpressionStmt.class, stmt);
        return ((ExpressionStmt) stmt).getExpression();
    }

    private ParseException parseError(String source) {
        return assertThrows(ParseException.class, () -> parse(source));
    }

    // ============ 赋值 ============

    @Nested
    @DisplayName("赋值语句")
    class AssignmentTests {

        @Test
        @DisplayName("简单赋值")
        void testSimpleAssign() {
            AssignStmt stmt = assertInstanceOf(AssignStmt.class, firstStatement("x = 1"));
            assertEquals(1, stmt.getTargets().size());
            Identifier target = assertInstanceOf(Identifier.class, stmt.getTargets().get(0));
            assertEquals("x", target.getName());
            assertEquals(ExprContext.STORE, target.getContext());
            Literal value = assertInstanceOf(Literal.class, stmt.getValue());
            assertEquals(Literal.LiteralKind.INT, value.getLiteralKind());
            assertEquals(1L, value.getValue());
        }

        @Test
        @DisplayName("链式赋值")
        void testChainedAssign() {
            AssignStmt stmt = assertInstanceOf(AssignStmt.class, firstStatement("a = b = 0"));
            assertEquals(2, stmt.getTargets().size());
            assertEquals("a", ((Identifier) stmt.getTargets().get(0)).getName());
            assertEquals("b", ((Identifier) stmt.getTargets().get(1)).getName());
        }

        @Test
        @DisplayName("元组解包")
        void testTupleUnpack() {
            AssignStmt stmt = assertInstanceOf(AssignStmt.class, firstStatement("a, b = 1, 2"));
            CollectionLiteral target = assertInstanceOf(CollectionLiteral.class, stmt.getTargets().get(0));
            assertEquals(CollectionLiteral.CollectionKind.TUPLE, target.getCollectionKind());
            assertEquals(ExprContext.STORE, target.getContext());
            assertEquals(ExprContext.STORE, ((Identifier) target.getElements().get(1)).getContext());
        }

        @Test
        @DisplayName("带注解赋值")
        void testAnnotatedAssign() {
            AnnAssignStmt stmt = assertInstanceOf(AnnAssignStmt.class, firstStatement("count: int = 0"));
            assertTrue(stmt.isSimple());
            assertTrue(stmt.hasValue());
            assertEquals("int", ((Identifier) stmt.getAnnotation()).getName());

            AnnAssignStmt bare = assertInstanceOf(AnnAssignStmt.class, firstStatement("label: str"));
            assertFalse(bare.hasValue());
        }

        @Test
        @DisplayName("增强赋值")
        void testAugAssign() {
            AugAssignStmt stmt = assertInstanceOf(AugAssignStmt.class, firstStatement("total += 2"));
            assertEquals(BinaryExpr.BinaryOp.ADD, stmt.getOperator());
        }

        @Test
        @DisplayName("分号分隔多条语句")
        void testSemicolon() {
            assertEquals(3, parse("a = 1; b = 2; c = 3").getBody().size());
        }

        @Test
        @DisplayName("不能给字面量赋值")
        void testAssignToLiteral() {
            ParseException e = parseError("1 = x");
            assertTrue(e.getMessage().startsWith("cannot assign to literal"), e.getMessage());
        }
    }

    // ============ 表达式 ============

    @Nested
    @DisplayName("表达式")
    class ExpressionTests {

        @Test
        @DisplayName("运算符优先级")
        void testPrecedence() {
            BinaryExpr add = assertInstanceOf(BinaryExpr.class, expression("1 + 2 * 3"));
            assertEquals(BinaryExpr.BinaryOp.ADD, add.getOperator());
            BinaryExpr mul = assertInstanceOf(BinaryExpr.class, add.getRight());
            assertEquals(BinaryExpr.BinaryOp.MUL, mul.getOperator());
        }

        @Test
        @DisplayName("链式比较")
        void testChainedCompare() {
            CompareExpr cmp = assertInstanceOf(CompareExpr.class, expression("0 < x <= 10"));
            assertEquals(Arrays.asList(CompareExpr.CompareOp.LT, CompareExpr.CompareOp.LE), cmp.getOperators());
            assertEquals(2, cmp.getComparators().size());
        }

        @Test
        @DisplayName("not in 与 is not")
        void testNegatedOperators() {
            CompareExpr notIn = assertInstanceOf(CompareExpr.class, expression("a not in b"));
            assertEquals(CompareExpr.CompareOp.NOT_IN, notIn.getOperators().get(0));
            CompareExpr isNot = assertInstanceOf(CompareExpr.class, expression("a is not None"));
            assertEquals(CompareExpr.CompareOp.IS_NOT, isNot.getOperators().get(0));
        }

        @Test
        @DisplayName("函数调用参数")
        void testCallArguments() {
            CallExpr call = assertInstanceOf(CallExpr.class, expression("f(1, *rest, key=2, **extra)"));
            assertEquals("f", call.getCalleeName());
            assertEquals(2, call.getArgs().size());
            assertInstanceOf(StarredExpr.class, call.getArgs().get(1));
            assertEquals(2, call.getKeywords().size());
            assertEquals("key", call.getKeywords().get(0).getName());
            assertTrue(call.getKeywords().get(1).isDoubleStar());
        }

        @Test
        @DisplayName("关键字参数之后不能有位置参数")
        void testPositionalAfterKeyword() {
            ParseException e = parseError("f(a=1, 2)");
            assertTrue(e.getMessage().startsWith("positional argument follows keyword argument"));
        }

        @Test
        @DisplayName("属性访问与下标")
        void testMemberAndIndex() {
            IndexExpr index = assertInstanceOf(IndexExpr.class, expression("obj.items[0]"));
            MemberExpr member = assertInstanceOf(MemberExpr.class, index.getTarget());
            assertEquals("items", member.getMember());
            assertEquals(ExprContext.LOAD, member.getContext());
        }

        @Test
        @DisplayName("切片")
        void testSlice() {
            IndexExpr index = assertInstanceOf(IndexExpr.class, expression("data[1:2]"));
            assertInstanceOf(SliceExpr.class, index.getIndex());
        }

        @Test
        @DisplayName("条件表达式与 lambda")
        void testConditionalAndLambda() {
            assertInstanceOf(ConditionalExpr.class, expression("a if cond else b"));
            LambdaExpr lambda = assertInstanceOf(LambdaExpr.class, expression("lambda x, y=1: x + y"));
            assertEquals(2, lambda.getParams().size());
            assertTrue(lambda.getParams().get(1).hasDefaultValue());
        }

        @Test
        @DisplayName("容器字面量")
        void testCollections() {
            CollectionLiteral list = assertInstanceOf(CollectionLiteral.class, expression("[1, 2, 3]"));
            assertEquals(CollectionLiteral.CollectionKind.LIST, list.getCollectionKind());
            assertEquals(3, list.getElements().size());

            CollectionLiteral set = assertInstanceOf(CollectionLiteral.class, expression("{1, 2}"));
            assertEquals(CollectionLiteral.CollectionKind.SET, set.getCollectionKind());

            DictLiteral dict = assertInstanceOf(DictLiteral.class, expression("{'a': 1, 'b': 2}"));
            assertEquals(2, dict.size());

            assertInstanceOf(DictLiteral.class, expression("{}"));
            CollectionLiteral empty = assertInstanceOf(CollectionLiteral.class, expression("()"));
            assertEquals(CollectionLiteral.CollectionKind.TUPLE, empty.getCollectionKind());
        }

        @Test
        @DisplayName("推导式")
        void testComprehensions() {
            ComprehensionExpr list = assertInstanceOf(ComprehensionExpr.class,
                    expression("[n * 2 for n in range(10) if n > 1]"));
            assertEquals(ComprehensionExpr.ComprehensionKind.LIST, list.getComprehensionKind());
            assertEquals(1, list.getClauses().size());
            assertEquals(1, list.getClauses().get(0).getConditions().size());

            ComprehensionExpr dict = assertInstanceOf(ComprehensionExpr.class,
                    expression("{k: v for k, v in pairs}"));
            assertEquals(ComprehensionExpr.ComprehensionKind.DICT, dict.getComprehensionKind());
            assertNotNull(dict.getValue());

            CallExpr call = assertInstanceOf(CallExpr.class, expression("sum(n for n in nums)"));
            ComprehensionExpr gen = assertInstanceOf(ComprehensionExpr.class, call.getArgs().get(0));
            assertEquals(ComprehensionExpr.ComprehensionKind.GENERATOR, gen.getComprehensionKind());
        }

        @Test
        @DisplayName("相邻字符串拼接")
        void testImplicitConcat() {
            Literal literal = assertInstanceOf(Literal.class, expression("'ab' 'cd'"));
            assertEquals("abcd", literal.getValue());
        }

        @Test
        @DisplayName("f-string 内的表达式")
        void testFormattedString() {
            FormattedString fs = assertInstanceOf(FormattedString.class, expression("f'{name}: {count + 1}'"));
            assertEquals(2, fs.getValues().size());
            assertInstanceOf(BinaryExpr.class, fs.getValues().get(1));
        }

        @Test
        @DisplayName("海象运算符")
        void testWalrus() {
            IfStmt stmt = assertInstanceOf(IfStmt.class, firstStatement("if (n := 10) > 5:\n    pass\n"));
            CompareExpr cond = assertInstanceOf(CompareExpr.class, stmt.getCondition());
            assertInstanceOf(NamedExpr.class, cond.getLeft());
        }
    }

    // ============ 声明 ============

    @Nested
    @DisplayName("函数与类声明")
    class DeclarationTests {

        @Test
        @DisplayName("函数参数种类")
        void testParameterKinds() {
            FunctionDef fn = assertInstanceOf(FunctionDef.class,
                    firstStatement("def f(a, /, b, *args, c=1, **kw):\n    pass\n"));
            List<Parameter> params = fn.getParams();
            assertEquals(5, params.size());
            assertEquals(Parameter.ParamKind.POSITIONAL_ONLY, params.get(0).getParamKind());
            assertEquals(Parameter.ParamKind.POSITIONAL, params.get(1).getParamKind());
            assertEquals(Parameter.ParamKind.VAR_POSITIONAL, params.get(2).getParamKind());
            assertEquals(Parameter.ParamKind.KEYWORD_ONLY, params.get(3).getParamKind());
            assertEquals(Parameter.ParamKind.VAR_KEYWORD, params.get(4).getParamKind());
        }

        @Test
        @DisplayName("注解与返回类型")
        void testAnnotations() {
            FunctionDef fn = assertInstanceOf(FunctionDef.class,
                    firstStatement("def add(a: int, b: int = 0) -> int:\n    return a + b\n"));
            assertTrue(fn.hasReturnAnnotation());
            assertTrue(fn.getParams().get(0).hasAnnotation());
            assertTrue(fn.getParams().get(1).hasDefaultValue());
            assertInstanceOf(ReturnStmt.class, fn.getBody().get(0));
        }

        @Test
        @DisplayName("异步函数与装饰器")
        void testAsyncAndDecorators() {
            Module module = parse("@app.route('/x')\n@cached\nasync def handler():\n    await work()\n");
            FunctionDef fn = assertInstanceOf(FunctionDef.class, module.getBody().get(0));
            assertTrue(fn.isAsync());
            assertEquals(2, fn.getDecorators().size());
            assertEquals(3, fn.getLine());
        }

        @Test
        @DisplayName("类声明")
        void testClass() {
            ClassDef cls = assertInstanceOf(ClassDef.class,
                    firstStatement("class Dog(Animal, metaclass=Meta):\n    def bark(self):\n        pass\n"));
            assertEquals("Dog", cls.getName());
            assertEquals(1, cls.getBases().size());
            assertEquals(1, cls.getKeywords().size());
            assertInstanceOf(FunctionDef.class, cls.getBody().get(0));
        }

        @Test
        @DisplayName("默认值之后不能有无默认值参数")
        void testDefaultOrder() {
            ParseException e = parseError("def f(a=1, b):\n    pass\n");
            assertTrue(e.getMessage().startsWith("parameter without a default follows parameter with a default"));
        }

        @Test
        @DisplayName("import 语句")
        void testImports() {
            Module module = parse("import os.path as p\nfrom ..pkg import a, b as c\nfrom m import *\n");
            ImportDecl imp = assertInstanceOf(ImportDecl.class, module.getBody().get(0));
            assertNotNull(imp);
            ImportFromDecl from = assertInstanceOf(ImportFromDecl.class, module.getBody().get(1));
            assertEquals("pkg", from.getModule());
            assertEquals(2, from.getLevel());
            assertEquals("c", from.getNames().get(1).getBoundName());
            ImportFromDecl star = assertInstanceOf(ImportFromDecl.class, module.getBody().get(2));
            assertTrue(star.isWildcard());
        }
    }

    // ============ 复合语句 ============

    @Nested
    @DisplayName("复合语句")
    class CompoundTests {

        @Test
        @DisplayName("if / elif / else")
        void testIfElif() {
            IfStmt stmt = assertInstanceOf(IfStmt.class,
                    firstStatement("if a:\n    x = 1\nelif b:\n    x = 2\nelse:\n    x = 3\n"));
            IfStmt elif = assertInstanceOf(IfStmt.class, stmt.getOrElse().get(0));
            assertEquals(1, elif.getOrElse().size());
        }

        @Test
        @DisplayName("for / else")
        void testForElse() {
            ForStmt stmt = assertInstanceOf(ForStmt.class,
                    firstStatement("for i, v in enumerate(xs):\n    pass\nelse:\n    done = True\n"));
            assertInstanceOf(CollectionLiteral.class, stmt.getTarget());
            assertEquals(1, stmt.getOrElse().size());
        }

        @Test
        @DisplayName("try / except / finally")
        void testTry() {
            TryStmt stmt = assertInstanceOf(TryStmt.class, firstStatement(
                    "try:\n    run()\nexcept ValueError as e:\n    pass\nexcept:\n    pass\nfinally:\n    close()\n"));
            assertEquals(2, stmt.getHandlers().size());
            assertEquals("e", stmt.getHandlers().get(0).getName());
            assertNull(stmt.getHandlers().get(1).getExceptionType());
            assertEquals(1, stmt.getFinallyBody().size());
        }

        @Test
        @DisplayName("try 缺少 except 或 finally")
        void testTryWithoutHandler() {
            ParseException e = parseError("try:\n    pass\nx = 1\n");
            assertTrue(e.getMessage().startsWith("expected 'except' or 'finally' block"));
        }

        @Test
        @DisplayName("with 多个上下文")
        void testWith() {
            WithStmt stmt = assertInstanceOf(WithStmt.class,
                    firstStatement("with open(a) as f, lock:\n    pass\n"));
            assertEquals(2, stmt.getItems().size());
            assertNotNull(stmt.getItems().get(0).getTarget());
            assertNull(stmt.getItems().get(1).getTarget());
        }

        @Test
        @DisplayName("单行代码块")
        void testInlineBlock() {
            WhileStmt stmt = assertInstanceOf(WhileStmt.class, firstStatement("while True: x = 1; break\n"));
            assertEquals(2, stmt.getBody().size());
        }
    }

    // ============ 错误 ============

    @Nested
    @DisplayName("语法错误")
    class ErrorTests {

        @Test
        @DisplayName("缺少冒号")
        void testMissingColon() {
            ParseException e = parseError("def f()\n    pass\n");
            assertEquals(1, e.getLine());
            assertEquals("COLON", e.getExpected());
        }

        @Test
        @DisplayName("意外缩进")
        void testUnexpectedIndent() {
            ParseException e = parseError("x = 1\n    y = 2\n");
            assertTrue(e.getMessage().startsWith("unexpected indent"));
            assertEquals(2, e.getLine());
        }

        @Test
        @DisplayName("词法错误以解析异常抛出")
        void testLexicalError() {
            ParseException e = parseError("x = 'abc\n");
            assertTrue(e.getMessage().startsWith("unterminated string literal"));
        }

        @Test
        @DisplayName("match 语句不受支持")
        void testMatchUnsupported() {
            assertThrows(ParseException.class, () -> parse("match cmd:\n    case 1:\n        pass\n"));
        }

        @Test
        @DisplayName("错误信息包含位置")
        void testMessageFormat() {
            ParseException e = parseError("x = )");
            assertTrue(e.getMessage().contains("at line 1, column 4"), e.getMessage());
            assertTrue(e.getMessage().contains("(found ')')"), e.getMessage());
        }

        @Test
        @DisplayName("括号嵌套达到上限仍可解析")
        void testNestingAtLimit() {
            AssignStmt stmt = assertInstanceOf(AssignStmt.class,
                    firstStatement(nested("(", ")", ExprParser.MAX_NESTING)));
            assertInstanceOf(Literal.class, stmt.getValue());
        }

        @Test
        @DisplayName("括号嵌套超过上限")
        void testNestingTooDeep() {
            ParseException e = parseError(nested("(", ")", ExprParser.MAX_NESTING + 1));
            assertTrue(e.getMessage().startsWith("too many nested parentheses"), e.getMessage());
            e = parseError(nested("[", "]", 20000));
            assertTrue(e.getMessage().startsWith("too many nested parentheses"), e.getMessage());
        }

        private String nested(String open, String close, int depth) {
            StringBuilder sb = new StringBuilder("x = ");
            for (int i = 0; i < depth; i++) sb.append(open);
            sb.append('1');
            for (int i = 0; i < depth; i++) sb.append(close);
            return sb.append('\n').toString();
        }
    }

    // ============ TreeBuilder ============

    @Nested
    @DisplayName("TreeBuilder")
    class TreeBuilderTests {

        @Test
        @DisplayName("先序编号从 0 开始")
        void testNumbering() {
            Module module = new TreeBuilder().build("x = 1\n");
            assertEquals(0, module.getId());
            AssignStmt assign = (AssignStmt) module.getBody().get(0);
            assertEquals(1, assign.getId());
            assertEquals(2, assign.getTargets().get(0).getId());
            assertEquals(3, assign.getValue().getId());
        }

        @Test
        @DisplayName("空源码得到空模块")
        void testEmpty() {
            assertTrue(new TreeBuilder().build("").getBody().isEmpty());
        }
    }
}
