package com.typelens.compiler.parser;

import com.typelens.compiler.ast.SourceLocation;
import com.typelens.compiler.ast.expr.Expression;
import com.typelens.compiler.ast.expr.FormattedString;
import com.typelens.compiler.ast.expr.Literal;
import com.typelens.compiler.lexer.Lexer;
import com.typelens.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;

import static com.typelens.compiler.lexer.TokenType.*;

/**
 * 字符串字面量解析辅助类：相邻字符串拼接与 f-string 替换字段
 */
class LiteralHelper {

    final Parser parser;

    LiteralHelper(Parser parser) {
        this.parser = parser;
    }

    /**
     * 解析一个或多个相邻的字符串字面量
     */
    Expression parseStrings() {
        SourceLocation loc = parser.location();
        StringBuilder text = new StringBuilder();
        List<Expression> values = new ArrayList<Expression>();
        boolean formatted = false;
        boolean sawBytes = false;
        boolean sawText = false;

        while (parser.checkAny(STRING_LITERAL, BYTES_LITERAL, FSTRING_LITERAL)) {
            Token token = parser.advance();
            if (token.getType() == BYTES_LITERAL) {
                sawBytes = true;
            } else {
                sawText = true;
            }
            if (sawBytes && sawText) {
                throw new ParseException("cannot mix bytes and nonbytes literals", token);
            }
            String content = String.valueOf(token.getLiteral());
            if (token.getType() == FSTRING_LITERAL) {
                formatted = true;
                parseReplacementFields(token, content, values);
            }
            text.append(content);
        }

        if (formatted) {
            return new FormattedString(loc, text.toString(), values);
        }
        return new Literal(loc, sawBytes ? Literal.LiteralKind.BYTES : Literal.LiteralKind.STRING, text.toString());
    }

    // ============ f-string ============

    private void parseReplacementFields(Token token, String content, List<Expression> out) {
        int i = 0;
        while (i < content.length()) {
            char c = content.charAt(i);
            if (c == '{') {
                if (i + 1 < content.length() && content.charAt(i + 1) == '{') {
                    i += 2;
                    continue;
                }
                i = parseReplacementField(token, content, i, out);
            } else if (c == '}') {
                if (i + 1 < content.length() && content.charAt(i + 1) == '}') {
                    i += 2;
                    continue;
                }
                throw new ParseException("f-string: single '}' is not allowed", token);
            } else {
                i++;
            }
        }
    }

    /**
     * 解析 openIndex 处开始的替换字段，返回闭合 '}' 之后的位置
     */
    private int parseReplacementField(Token token, String content, int openIndex, List<Expression> out) {
        int exprStart = openIndex + 1;
        int i = exprStart;
        int depth = 0;
        int exprEnd = -1;
        while (i < content.length()) {
            char c = content.charAt(i);
            if (c == '\'' || c == '"') {
                i = skipQuoted(token, content, i);
                continue;
            }
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || (c == '}' && depth > 0)) {
                depth--;
            } else if (depth == 0) {
                char next = i + 1 < content.length() ? content.charAt(i + 1) : '\0';
                if (c == '}' || c == ':' || (c == '!' && next != '=')) {
                    exprEnd = i;
                    break;
                }
                if (c == '=' && next != '=' && !isComparisonChar(content.charAt(i - 1))) {
                    exprEnd = i;
                    break;
                }
            }
            i++;
        }
        if (exprEnd < 0) {
            throw new ParseException("f-string: expecting '}'", token);
        }

        String exprText = content.substring(exprStart, exprEnd);
        if (exprText.trim().isEmpty()) {
            throw new ParseException("f-string: empty expression not allowed", token);
        }
        out.add(parseEmbeddedExpression(token, content, exprStart, exprText));

        i = exprEnd;
        if (content.charAt(i) == '=') {
            i++;
        }
        if (i < content.length() && content.charAt(i) == '!') {
            i += 2;  // !r / !s / !a
        }
        if (i < content.length() && content.charAt(i) == ':') {
            i++;
            // 格式说明符中可以嵌套替换字段
            while (i < content.length() && content.charAt(i) != '}') {
                if (content.charAt(i) == '{') {
                    i = parseReplacementField(token, content, i, out);
                } else {
                    i++;
                }
            }
        }
        if (i >= content.length() || content.charAt(i) != '}') {
            throw new ParseException("f-string: expecting '}'", token);
        }
        return i + 1;
    }

    private static boolean isComparisonChar(char c) {
        return c == '=' || c == '!' || c == '<' || c == '>';
    }

    private static int skipQuoted(Token token, String content, int start) {
        char quote = content.charAt(start);
        int i = start + 1;
        while (i < content.length() && content.charAt(i) != quote) {
            i++;
        }
        if (i >= content.length()) {
            throw new ParseException("f-string: unterminated string", token);
        }
        return i + 1;
    }

    /**
     * 以独立的表达式模式词法分析器解析替换字段，位置映射回原文件
     */
    private Expression parseEmbeddedExpression(Token token, String content, int exprStart, String exprText) {
        int line = token.getLine();
        int column = token.getColumn() + contentOffset(token.getLexeme());
        for (int k = 0; k < exprStart; k++) {
            if (content.charAt(k) == '\n') {
                line++;
                column = 0;
            } else {
                column++;
            }
        }
        Lexer lexer = Lexer.forExpression(exprText, parser.fileName, line, column);
        Parser sub = new Parser(lexer.scanTokens(), parser.fileName);
        return sub.parseStandaloneExpression();
    }

    /** 词法单元文本中内容起始位置：前缀长度 + 引号长度 */
    private static int contentOffset(String lexeme) {
        int prefix = 0;
        while (prefix < lexeme.length() && Character.isLetter(lexeme.charAt(prefix))) {
            prefix++;
        }
        char quote = lexeme.charAt(prefix);
        boolean triple = lexeme.length() >= prefix + 6
                && lexeme.charAt(prefix + 1) == quote && lexeme.charAt(prefix + 2) == quote;
        return prefix + (triple ? 3 : 1);
    }
}
