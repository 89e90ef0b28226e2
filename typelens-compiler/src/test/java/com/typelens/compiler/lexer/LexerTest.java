package com.typelens.compiler.lexer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lexer 单元测试
 */
class LexerTest {

    // ============ 辅助方法 ============

    private List<Token> scan(String source) {
        return new Lexer(source, "<test>").scanTokens();
    }

    /** 去掉 EOF 和 NEWLINE 后的 token */
    private List<Token> tokens(String source) {
        return scan(source).stream()
                .filter(t -> t.getType() != TokenType.EOF && t.getType() != TokenType.NEWLINE)
                .collect(Collectors.toList());
    }

    private List<TokenType> types(String source) {
        return scan(source).stream().map(Token::getType).collect(Collectors.toList());
    }

    private Token assertSingleToken(String source, TokenType expected) {
        List<Token> result = tokens(source);
        assertEquals(1, result.size(), "Expected single token for: " + source);
        assertEquals(expected, result.get(0).getType());
        return result.get(0);
    }

    // ============ 运算符与分隔符 ============

    @Nested
    @DisplayName("运算符与分隔符")
    class OperatorTests {

        @Test
        @DisplayName("单字符运算符")
        void testSingleChar() {
            assertSingleToken("+", TokenType.PLUS);
            assertSingleToken("-", TokenType.MINUS);
            assertSingleToken("*", TokenType.STAR);
            assertSingleToken("/", TokenType.SLASH);
            assertSingleToken("%", TokenType.PERCENT);
            assertSingleToken("@", TokenType.AT);
            assertSingleToken("|", TokenType.PIPE);
            assertSingleToken("~", TokenType.TILDE);
            assertSingleToken(",", TokenType.COMMA);
            assertSingleToken(".", TokenType.DOT);
        }

        @Test
        @DisplayName("多字符运算符")
        void testMultiChar() {
            assertSingleToken("**", TokenType.DOUBLE_STAR);
            assertSingleToken("//", TokenType.DOUBLE_SLASH);
            assertSingleToken("->", TokenType.ARROW);
            assertSingleToken(":=", TokenType.WALRUS);
            assertSingleToken("==", TokenType.EQ);
            assertSingleToken("!=", TokenType.NE);
            assertSingleToken("<=", TokenType.LE);
            assertSingleToken(">>", TokenType.RSHIFT);
            assertSingleToken("...", TokenType.ELLIPSIS);
        }

        @Test
        @DisplayName("复合赋值")
        void testAugmentedAssign() {
            assertSingleToken("+=", TokenType.PLUS_ASSIGN);
            assertSingleToken("//=", TokenType.DOUBLE_SLASH_ASSIGN);
            assertSingleToken("**=", TokenType.DOUBLE_STAR_ASSIGN);
            assertSingleToken("<<=", TokenType.LSHIFT_ASSIGN);
        }

        @Test
        @DisplayName("单独的 ! 是错误")
        void testBangAlone() {
            Token t = assertSingleToken("!", TokenType.ERROR);
            assertEquals("Unexpected character '!'", t.getLiteral());
        }
    }

    // ============ 关键字与标识符 ============

    @Nested
    @DisplayName("关键字与标识符")
    class KeywordTests {

        @Test
        @DisplayName("关键字")
        void testKeywords() {
            assertSingleToken("def", TokenType.KW_DEF);
            assertSingleToken("class", TokenType.KW_CLASS);
            assertSingleToken("lambda", TokenType.KW_LAMBDA);
            assertSingleToken("async", TokenType.KW_ASYNC);
            assertSingleToken("yield", TokenType.KW_YIELD);
            assertSingleToken("None", TokenType.KW_NONE);
            assertSingleToken("True", TokenType.KW_TRUE);
            assertSingleToken("is", TokenType.KW_IS);
        }

        @Test
        @DisplayName("软关键字按标识符处理")
        void testSoftKeywords() {
            assertSingleToken("match", TokenType.IDENTIFIER);
            assertSingleToken("case", TokenType.IDENTIFIER);
            assertSingleToken("type", TokenType.IDENTIFIER);
        }

        @Test
        @DisplayName("大小写敏感")
        void testCaseSensitive() {
            assertSingleToken("none", TokenType.IDENTIFIER);
            assertSingleToken("Def", TokenType.IDENTIFIER);
        }

        @Test
        @DisplayName("Unicode 标识符")
        void testUnicodeIdentifier() {
            Token t = assertSingleToken("变量_1", TokenType.IDENTIFIER);
            assertEquals("变量_1", t.getLexeme());
        }
    }

    // ============ 数字字面量 ============

    @Nested
    @DisplayName("数字字面量")
    class NumberTests {

        @Test
        @DisplayName("十进制整数与下划线")
        void testDecimal() {
            assertEquals(42L, assertSingleToken("42", TokenType.INT_LITERAL).getLiteral());
            assertEquals(1000000L, assertSingleToken("1_000_000", TokenType.INT_LITERAL).getLiteral());
        }

        @Test
        @DisplayName("进制前缀")
        void testRadix() {
            assertEquals(31L, assertSingleToken("0x1F", TokenType.INT_LITERAL).getLiteral());
            assertEquals(8L, assertSingleToken("0o10", TokenType.INT_LITERAL).getLiteral());
            assertEquals(5L, assertSingleToken("0b101", TokenType.INT_LITERAL).getLiteral());
        }

        @Test
        @DisplayName("超出 long 范围时为 BigInteger")
        void testBigInteger() {
            Token t = assertSingleToken("123456789012345678901234567890", TokenType.INT_LITERAL);
            assertEquals(new BigInteger("123456789012345678901234567890"), t.getLiteral());
        }

        @Test
        @DisplayName("浮点数与指数")
        void testFloat() {
            assertEquals(3.14, assertSingleToken("3.14", TokenType.FLOAT_LITERAL).getLiteral());
            assertEquals(1500.0, assertSingleToken("1.5e3", TokenType.FLOAT_LITERAL).getLiteral());
            assertEquals(0.01, assertSingleToken("1e-2", TokenType.FLOAT_LITERAL).getLiteral());
        }

        @Test
        @DisplayName("虚数")
        void testImaginary() {
            assertEquals(2.0, assertSingleToken("2j", TokenType.IMAGINARY_LITERAL).getLiteral());
        }

        @Test
        @DisplayName("空的十六进制字面量")
        void testEmptyHex() {
            Token t = tokens("0x").get(0);
            assertEquals(TokenType.ERROR, t.getType());
            assertEquals("invalid hexadecimal literal", t.getLiteral());
        }
    }

    // ============ 字符串字面量 ============

    @Nested
    @DisplayName("字符串字面量")
    class StringTests {

        @Test
        @DisplayName("单引号与双引号")
        void testQuotes() {
            assertEquals("hello", assertSingleToken("'hello'", TokenType.STRING_LITERAL).getLiteral());
            assertEquals("it's", assertSingleToken("\"it's\"", TokenType.STRING_LITERAL).getLiteral());
        }

        @Test
        @DisplayName("转义序列")
        void testEscapes() {
            assertEquals("a\nb\tc", assertSingleToken("'a\\nb\\tc'", TokenType.STRING_LITERAL).getLiteral());
            assertEquals("A", assertSingleToken("'\\x41'", TokenType.STRING_LITERAL).getLiteral());
            assertEquals("\u00e9", assertSingleToken("'\\u00e9'", TokenType.STRING_LITERAL).getLiteral());
        }

        @Test
        @DisplayName("原始字符串保留反斜杠")
        void testRawString() {
            assertEquals("a\\nb", assertSingleToken("r'a\\nb'", TokenType.STRING_LITERAL).getLiteral());
        }

        @Test
        @DisplayName("三引号字符串跨行")
        void testTripleQuoted() {
            List<Token> result = tokens("x = \"\"\"line1\nline2\"\"\"\ny = 1");
            assertEquals(TokenType.STRING_LITERAL, result.get(2).getType());
            assertEquals("line1\nline2", result.get(2).getLiteral());
            Token y = result.get(3);
            assertEquals("y", y.getLexeme());
            assertEquals(3, y.getLine());
        }

        @Test
        @DisplayName("字节串与 f-string")
        void testPrefixes() {
            assertEquals("data", assertSingleToken("b'data'", TokenType.BYTES_LITERAL).getLiteral());
            assertEquals("{name}!", assertSingleToken("f'{name}!'", TokenType.FSTRING_LITERAL).getLiteral());
        }

        @Test
        @DisplayName("未闭合字符串")
        void testUnterminated() {
            Token t = tokens("'abc").get(0);
            assertEquals(TokenType.ERROR, t.getType());
            assertEquals("unterminated string literal", t.getLiteral());
        }
    }

    // ============ 缩进与换行 ============

    @Nested
    @DisplayName("缩进与换行")
    class LayoutTests {

        @Test
        @DisplayName("代码块产生 INDENT 和 DEDENT")
        void testIndentDedent() {
            List<TokenType> result = types("if x:\n    y = 1\nz = 2\n");
            assertEquals(Arrays.asList(
                    TokenType.KW_IF, TokenType.IDENTIFIER, TokenType.COLON, TokenType.NEWLINE,
                    TokenType.INDENT, TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.INT_LITERAL, TokenType.NEWLINE,
                    TokenType.DEDENT, TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.INT_LITERAL, TokenType.NEWLINE,
                    TokenType.EOF), result);
        }

        @Test
        @DisplayName("文件结尾补齐 DEDENT")
        void testTrailingDedent() {
            List<TokenType> result = types("def f():\n    return 1");
            assertEquals(TokenType.EOF, result.get(result.size() - 1));
            assertEquals(TokenType.DEDENT, result.get(result.size() - 2));
            assertEquals(TokenType.NEWLINE, result.get(result.size() - 3));
        }

        @Test
        @DisplayName("括号内换行不产生 NEWLINE")
        void testImplicitJoin() {
            List<TokenType> result = types("x = [1,\n     2]\n");
            assertEquals(1, result.stream().filter(t -> t == TokenType.NEWLINE).count());
            assertFalse(result.contains(TokenType.INDENT));
        }

        @Test
        @DisplayName("反斜杠续行")
        void testBackslashContinuation() {
            List<TokenType> result = types("x = 1 + \\\n    2\n");
            assertEquals(1, result.stream().filter(t -> t == TokenType.NEWLINE).count());
            assertFalse(result.contains(TokenType.INDENT));
        }

        @Test
        @DisplayName("空行和纯注释行不产生 token")
        void testBlankAndCommentLines() {
            List<TokenType> result = types("x = 1\n\n    # comment\n\ny = 2\n");
            assertFalse(result.contains(TokenType.INDENT));
            assertEquals(2, result.stream().filter(t -> t == TokenType.NEWLINE).count());
        }

        @Test
        @DisplayName("缩进不匹配")
        void testBadDedent() {
            List<Token> result = scan("if x:\n        y\n    z\n");
            Token error = result.stream().filter(t -> t.getType() == TokenType.ERROR).findFirst().orElse(null);
            assertNotNull(error);
            assertEquals("unindent does not match any outer indentation level", error.getLiteral());
        }

        @Test
        @DisplayName("空源码只有 EOF")
        void testEmptySource() {
            assertEquals(Arrays.asList(TokenType.EOF), types(""));
            assertEquals(Arrays.asList(TokenType.EOF), types("# only a comment\n"));
        }
    }

    // ============ 位置 ============

    @Nested
    @DisplayName("位置信息")
    class PositionTests {

        @Test
        @DisplayName("行号从 1 开始，列号从 0 开始")
        void testLineAndColumn() {
            List<Token> result = tokens("a = 1\n  \nbb = 2");
            Token a = result.get(0);
            assertEquals(1, a.getLine());
            assertEquals(0, a.getColumn());

            Token one = result.get(2);
            assertEquals(4, one.getColumn());

            Token bb = result.get(3);
            assertEquals("bb", bb.getLexeme());
            assertEquals(3, bb.getLine());
            assertEquals(0, bb.getColumn());
        }
    }
}
