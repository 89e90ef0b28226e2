package com.typelens.compiler.lexer;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 词法分析器
 *
 * <p>按缩进语法生成 INDENT / DEDENT，括号内的换行与反斜杠续行不产生 NEWLINE。
 * 表达式模式（f-string 内嵌表达式）下不做缩进处理。</p>
 */
public class Lexer {
    private static final int TAB_SIZE = 8;

    private final String source;
    private final String fileName;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line;
    private int column;

    // 当前 token 起始位置（多行字符串需要）
    private int tokenLine;
    private int tokenColumn;

    private final Deque<Integer> indentStack = new ArrayDeque<>();
    private final boolean expressionMode;
    private final int baseBracketDepth;
    private int bracketDepth;
    private boolean atLineStart = true;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();

        // 声明
        map.put("def", TokenType.KW_DEF);
        map.put("class", TokenType.KW_CLASS);
        map.put("lambda", TokenType.KW_LAMBDA);
        map.put("import", TokenType.KW_IMPORT);
        map.put("from", TokenType.KW_FROM);
        map.put("as", TokenType.KW_AS);
        map.put("global", TokenType.KW_GLOBAL);
        map.put("nonlocal", TokenType.KW_NONLOCAL);
        map.put("del", TokenType.KW_DEL);
        map.put("async", TokenType.KW_ASYNC);
        map.put("await", TokenType.KW_AWAIT);

        // 控制流
        map.put("if", TokenType.KW_IF);
        map.put("elif", TokenType.KW_ELIF);
        map.put("else", TokenType.KW_ELSE);
        map.put("for", TokenType.KW_FOR);
        map.put("while", TokenType.KW_WHILE);
        map.put("break", TokenType.KW_BREAK);
        map.put("continue", TokenType.KW_CONTINUE);
        map.put("return", TokenType.KW_RETURN);
        map.put("yield", TokenType.KW_YIELD);
        map.put("pass", TokenType.KW_PASS);
        map.put("raise", TokenType.KW_RAISE);
        map.put("try", TokenType.KW_TRY);
        map.put("except", TokenType.KW_EXCEPT);
        map.put("finally", TokenType.KW_FINALLY);
        map.put("with", TokenType.KW_WITH);
        map.put("assert", TokenType.KW_ASSERT);

        // 运算
        map.put("and", TokenType.KW_AND);
        map.put("or", TokenType.KW_OR);
        map.put("not", TokenType.KW_NOT);
        map.put("in", TokenType.KW_IN);
        map.put("is", TokenType.KW_IS);
        map.put("True", TokenType.KW_TRUE);
        map.put("False", TokenType.KW_FALSE);
        map.put("None", TokenType.KW_NONE);

        KEYWORDS = Collections.unmodifiableMap(map);
    }

    /** 获取所有关键词集合 */
    public static Set<String> getKeywords() {
        return KEYWORDS.keySet();
    }

    public Lexer(String source, String fileName) {
        this(source, fileName, 1, 0, false);
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    private Lexer(String source, String fileName, int startLine, int startColumn, boolean expressionMode) {
        this.source = source != null ? source : "";
        this.fileName = fileName;
        this.line = startLine;
        this.column = startColumn;
        this.expressionMode = expressionMode;
        this.baseBracketDepth = expressionMode ? 1 : 0;
        this.bracketDepth = baseBracketDepth;
        this.atLineStart = !expressionMode;
        this.indentStack.push(0);
    }

    /**
     * 创建表达式模式词法分析器（用于 f-string 替换字段）
     *
     * @param startLine   表达式在原文件中的起始行
     * @param startColumn 表达式在原文件中的起始列偏移
     */
    public static Lexer forExpression(String source, String fileName, int startLine, int startColumn) {
        return new Lexer(source, fileName, startLine, startColumn, true);
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * 执行词法分析，返回 Token 列表
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            if (atLineStart && bracketDepth == 0) {
                handleIndentation();
                if (isAtEnd()) break;
            }
            start = current;
            tokenLine = line;
            tokenColumn = column;
            scanToken();
        }

        tokenLine = line;
        tokenColumn = column;
        start = current;
        if (!expressionMode) {
            if (!tokens.isEmpty() && !lastTokenIs(TokenType.NEWLINE) && !lastTokenIs(TokenType.DEDENT)) {
                addToken(TokenType.NEWLINE);
            }
            while (indentStack.peek() > 0) {
                indentStack.pop();
                addToken(TokenType.DEDENT);
            }
        }
        tokens.add(new Token(TokenType.EOF, "", null, line, column, current));
        return tokens;
    }

    /**
     * 处理逻辑行首缩进：空行和纯注释行不产生任何 token
     */
    private void handleIndentation() {
        while (!isAtEnd()) {
            int indent = 0;
            while (!isAtEnd()) {
                char c = peek();
                if (c == ' ') {
                    indent++;
                } else if (c == '\t') {
                    indent = (indent / TAB_SIZE + 1) * TAB_SIZE;
                } else if (c == '\f') {
                    indent = 0;
                } else {
                    break;
                }
                advance();
            }
            if (isAtEnd()) {
                return;
            }
            char c = peek();
            if (c == '#') {
                while (!isAtEnd() && peek() != '\n') advance();
            }
            if (!isAtEnd() && peek() == '\r') {
                advance();
            }
            if (!isAtEnd() && peek() == '\n') {
                advance();
                newLine();
                continue;
            }
            if (isAtEnd()) {
                return;
            }

            start = current;
            tokenLine = line;
            tokenColumn = column;
            int top = indentStack.peek();
            if (indent > top) {
                indentStack.push(indent);
                addToken(TokenType.INDENT);
            } else if (indent < top) {
                while (indentStack.peek() > indent) {
                    indentStack.pop();
                    addToken(TokenType.DEDENT);
                }
                if (indentStack.peek() != indent) {
                    error("unindent does not match any outer indentation level");
                }
            }
            atLineStart = false;
            return;
        }
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(':
            case '[':
            case '{':
                bracketDepth++;
                addToken(c == '(' ? TokenType.LPAREN : c == '[' ? TokenType.LBRACKET : TokenType.LBRACE);
                break;
            case ')':
            case ']':
            case '}':
                if (bracketDepth > baseBracketDepth) bracketDepth--;
                addToken(c == ')' ? TokenType.RPAREN : c == ']' ? TokenType.RBRACKET : TokenType.RBRACE);
                break;
            case ',': addToken(TokenType.COMMA); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '~': addToken(TokenType.TILDE); break;

            case '.':
                if (isDigit(peek())) {
                    number();
                } else if (peek() == '.' && peekNext() == '.') {
                    advance();
                    advance();
                    addToken(TokenType.ELLIPSIS);
                } else {
                    addToken(TokenType.DOT);
                }
                break;

            case ':':
                addToken(match('=') ? TokenType.WALRUS : TokenType.COLON);
                break;

            case '+':
                addToken(match('=') ? TokenType.PLUS_ASSIGN : TokenType.PLUS);
                break;

            case '-':
                if (match('=')) addToken(TokenType.MINUS_ASSIGN);
                else if (match('>')) addToken(TokenType.ARROW);
                else addToken(TokenType.MINUS);
                break;

            case '*':
                if (match('*')) {
                    addToken(match('=') ? TokenType.DOUBLE_STAR_ASSIGN : TokenType.DOUBLE_STAR);
                } else {
                    addToken(match('=') ? TokenType.STAR_ASSIGN : TokenType.STAR);
                }
                break;

            case '/':
                if (match('/')) {
                    addToken(match('=') ? TokenType.DOUBLE_SLASH_ASSIGN : TokenType.DOUBLE_SLASH);
                } else {
                    addToken(match('=') ? TokenType.SLASH_ASSIGN : TokenType.SLASH);
                }
                break;

            case '%': addToken(match('=') ? TokenType.PERCENT_ASSIGN : TokenType.PERCENT); break;
            case '@': addToken(match('=') ? TokenType.AT_ASSIGN : TokenType.AT); break;
            case '|': addToken(match('=') ? TokenType.PIPE_ASSIGN : TokenType.PIPE); break;
            case '^': addToken(match('=') ? TokenType.CARET_ASSIGN : TokenType.CARET); break;
            case '&': addToken(match('=') ? TokenType.AMPERSAND_ASSIGN : TokenType.AMPERSAND); break;

            case '<':
                if (match('<')) {
                    addToken(match('=') ? TokenType.LSHIFT_ASSIGN : TokenType.LSHIFT);
                } else {
                    addToken(match('=') ? TokenType.LE : TokenType.LT);
                }
                break;

            case '>':
                if (match('>')) {
                    addToken(match('=') ? TokenType.RSHIFT_ASSIGN : TokenType.RSHIFT);
                } else {
                    addToken(match('=') ? TokenType.GE : TokenType.GT);
                }
                break;

            case '=':
                addToken(match('=') ? TokenType.EQ : TokenType.ASSIGN);
                break;

            case '!':
                if (match('=')) {
                    addToken(TokenType.NE);
                } else {
                    error("Unexpected character '!'");
                }
                break;

            case '#':
                // 单行注释
                while (peek() != '\n' && !isAtEnd()) advance();
                break;

            case '\\':
                // 反斜杠续行
                if (peek() == '\r') advance();
                if (peek() == '\n') {
                    advance();
                    newLine();
                } else {
                    error("unexpected character after line continuation character");
                }
                break;

            // 空白字符
            case ' ':
            case '\r':
            case '\t':
            case '\f':
                break;

            case '\n':
                if (bracketDepth == 0) {
                    if (!tokens.isEmpty() && !lastTokenIs(TokenType.NEWLINE)) {
                        addToken(TokenType.NEWLINE);
                    }
                    atLineStart = true;
                }
                newLine();
                break;

            case '"':
            case '\'':
                string("", c);
                break;

            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    error("invalid character '" + c + "'");
                }
                break;
        }
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        column++;
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        column++;
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private void newLine() {
        line++;
        column = 0;
    }

    private boolean lastTokenIs(TokenType type) {
        return !tokens.isEmpty() && tokens.get(tokens.size() - 1).getType() == type;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_' ||
               Character.isLetter(c);
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c) || Character.isDigit(c);
    }

    // === Token 构建 ===

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String lexeme = source.substring(start, current);
        tokens.add(new Token(type, lexeme, literal, tokenLine, tokenColumn, start));
    }

    // === 复杂 Token 扫描 ===

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);
        if ((peek() == '"' || peek() == '\'') && isStringPrefix(text)) {
            string(text, advance());
            return;
        }

        TokenType type = KEYWORDS.get(text);
        if (type == null) type = TokenType.IDENTIFIER;
        addToken(type);
    }

    private static boolean isStringPrefix(String text) {
        if (text.isEmpty() || text.length() > 2) return false;
        switch (text.toLowerCase()) {
            case "r": case "u": case "b": case "f":
            case "br": case "rb": case "fr": case "rf":
                return true;
            default:
                return false;
        }
    }

    /**
     * 扫描字符串字面量，起始引号已被消费
     */
    private void string(String prefix, char quote) {
        String lower = prefix.toLowerCase();
        boolean raw = lower.indexOf('r') >= 0;
        boolean bytes = lower.indexOf('b') >= 0;
        boolean formatted = lower.indexOf('f') >= 0;

        boolean triple = false;
        if (peek() == quote && peekNext() == quote) {
            advance();
            advance();
            triple = true;
        }

        StringBuilder value = new StringBuilder();
        int contentStart = current;
        while (true) {
            if (isAtEnd()) {
                error(triple ? "unterminated triple-quoted string literal" : "unterminated string literal");
                return;
            }
            char c = peek();
            if (c == quote) {
                if (!triple) {
                    break;
                }
                if (current + 2 < source.length()
                        && source.charAt(current + 1) == quote
                        && source.charAt(current + 2) == quote) {
                    break;
                }
                value.append(advance());
                continue;
            }
            if (c == '\n') {
                if (!triple) {
                    error("unterminated string literal");
                    return;
                }
                value.append(advance());
                newLine();
                continue;
            }
            if (c == '\\') {
                advance();
                if (isAtEnd()) {
                    continue;
                }
                if (raw || formatted) {
                    char next = advance();
                    value.append('\\').append(next);
                    if (next == '\n') newLine();
                } else {
                    escapeSequence(value);
                }
                continue;
            }
            value.append(advance());
        }

        String content = source.substring(contentStart, current);
        // 闭合引号
        advance();
        if (triple) {
            advance();
            advance();
        }

        if (formatted) {
            addToken(TokenType.FSTRING_LITERAL, content);
        } else if (bytes) {
            addToken(TokenType.BYTES_LITERAL, value.toString());
        } else {
            addToken(TokenType.STRING_LITERAL, value.toString());
        }
    }

    private void escapeSequence(StringBuilder value) {
        char c = advance();
        switch (c) {
            case '\n': newLine(); break;      // 字符串内续行
            case '\\': value.append('\\'); break;
            case '\'': value.append('\''); break;
            case '"': value.append('"'); break;
            case 'n': value.append('\n'); break;
            case 't': value.append('\t'); break;
            case 'r': value.append('\r'); break;
            case 'a': value.append('\u0007'); break;
            case 'b': value.append('\b'); break;
            case 'f': value.append('\f'); break;
            case 'v': value.append('\u000B'); break;
            case 'x': value.append(hexEscape(2, c)); break;
            case 'u': value.append(hexEscape(4, c)); break;
            case 'U': value.append(hexEscape(8, c)); break;
            default:
                if (c >= '0' && c <= '7') {
                    int code = c - '0';
                    for (int i = 0; i < 2 && peek() >= '0' && peek() <= '7'; i++) {
                        code = code * 8 + (advance() - '0');
                    }
                    value.append((char) code);
                } else {
                    // 未知转义保持原样（含 \N{...}）
                    value.append('\\').append(c);
                }
                break;
        }
    }

    private String hexEscape(int digits, char kind) {
        StringBuilder hex = new StringBuilder();
        for (int i = 0; i < digits && isHexDigit(peek()); i++) {
            hex.append(advance());
        }
        if (hex.length() != digits) {
            error("truncated \\" + kind + " escape");
            return "";
        }
        return new String(Character.toChars(Integer.parseUnsignedInt(hex.toString(), 16)));
    }

    /** 移除数字中的下划线分隔符 */
    private static String stripUnderscores(String text) {
        return text.indexOf('_') >= 0 ? text.replace("_", "") : text;
    }

    /** 消耗数字字符和下划线分隔符 */
    private void advanceDigits() {
        while (isDigit(peek()) || (peek() == '_' && isDigit(peekNext()))) advance();
    }

    private void number() {
        char first = source.charAt(start);
        if (first == '0' && !isAtEnd()) {
            char next = Character.toLowerCase(peek());
            if (next == 'x') {
                radixNumber(16);
                return;
            } else if (next == 'o') {
                radixNumber(8);
                return;
            } else if (next == 'b') {
                radixNumber(2);
                return;
            }
        }

        boolean isFloat = first == '.';
        advanceDigits();

        // 小数部分
        if (!isFloat && peek() == '.' && !(peekNext() == '.')) {
            isFloat = true;
            advance();
            advanceDigits();
        }

        // 指数部分
        if (peek() == 'e' || peek() == 'E') {
            char after = peekNext();
            if (isDigit(after) || ((after == '+' || after == '-')
                    && current + 2 < source.length() && isDigit(source.charAt(current + 2)))) {
                isFloat = true;
                advance();
                if (peek() == '+' || peek() == '-') advance();
                advanceDigits();
            }
        }

        String text = stripUnderscores(source.substring(start, current));
        if (peek() == 'j' || peek() == 'J') {
            advance();
            addToken(TokenType.IMAGINARY_LITERAL, parseDouble(text));
        } else if (isFloat) {
            addToken(TokenType.FLOAT_LITERAL, parseDouble(text));
        } else {
            addToken(TokenType.INT_LITERAL, parseInteger(text, 10));
        }
    }

    private void radixNumber(int radix) {
        advance(); // 消费进制字母
        while (isRadixDigit(peek(), radix) || peek() == '_') advance();

        String text = stripUnderscores(source.substring(start + 2, current));
        if (text.isEmpty()) {
            error("invalid " + (radix == 16 ? "hexadecimal" : radix == 8 ? "octal" : "binary") + " literal");
            return;
        }
        addToken(TokenType.INT_LITERAL, parseInteger(text, radix));
    }

    private static boolean isRadixDigit(char c, int radix) {
        if (radix == 16) return isHexDigit(c);
        if (radix == 8) return c >= '0' && c <= '7';
        return c == '0' || c == '1';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) ||
               (c >= 'a' && c <= 'f') ||
               (c >= 'A' && c <= 'F');
    }

    private Number parseInteger(String text, int radix) {
        try {
            return Long.parseLong(text, radix);
        } catch (NumberFormatException e) {
            return new BigInteger(text, radix);
        }
    }

    private Double parseDouble(String text) {
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            error("invalid decimal literal: " + text);
            return 0.0;
        }
    }

    private void error(String message) {
        addToken(TokenType.ERROR, message);
    }
}
