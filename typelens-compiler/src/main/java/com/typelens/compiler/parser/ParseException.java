package com.typelens.compiler.parser;

import com.typelens.compiler.lexer.Token;

/**
 * 解析异常（源码无法分词或解析时抛出，不产生部分结果）
 */
public class ParseException extends RuntimeException {
    private final Token token;
    private final String expected;

    public ParseException(String message, Token token) {
        super(message);
        this.token = token;
        this.expected = null;
    }

    public ParseException(String message, Token token, String expected) {
        super(message);
        this.token = token;
        this.expected = expected;
    }

    public Token getToken() {
        return token;
    }

    public String getExpected() {
        return expected;
    }

    /** 出错行号（无 token 时为 0） */
    public int getLine() {
        return token != null ? token.getLine() : 0;
    }

    /** 出错列偏移（无 token 时为 0） */
    public int getColumn() {
        return token != null ? token.getColumn() : 0;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        if (token != null) {
            sb.append(" at line ").append(token.getLine());
            sb.append(", column ").append(token.getColumn());
            if (!token.getLexeme().isEmpty()) {
                sb.append(" (found '").append(token.getLexeme()).append("')");
            }
        }
        if (expected != null) {
            sb.append(", expected: ").append(expected);
        }
        return sb.toString();
    }
}
