package com.typelens.compiler.parser;

import com.typelens.compiler.ast.SourceLocation;
import com.typelens.compiler.ast.decl.Module;
import com.typelens.compiler.ast.expr.Expression;
import com.typelens.compiler.ast.stmt.Statement;
import com.typelens.compiler.lexer.Lexer;
import com.typelens.compiler.lexer.Token;
import com.typelens.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.typelens.compiler.lexer.TokenType.*;

/**
 * 语法分析器（递归下降）
 *
 * <p>词法分析一次性完成，解析在 token 列表上进行，回溯通过 {@link #mark()} / {@link #reset(int)} 实现。
 * 遇到 ERROR token 立即以词法错误信息抛出 {@link ParseException}。</p>
 */
@SuppressWarnings("this-escape")
public class Parser {

    final String fileName;
    private final List<Token> tokens;
    private int position;
    Token current;
    Token previous;

    // === Helper 实例 ===
    final LiteralHelper literalHelper = new LiteralHelper(this);
    final DeclParser declParser = new DeclParser(this);
    final StmtParser stmtParser = new StmtParser(this);
    final ExprParser exprParser = new ExprParser(this);

    public Parser(Lexer lexer) {
        this(lexer.scanTokens(), lexer.getFileName());
    }

    Parser(List<Token> tokens, String fileName) {
        if (tokens.isEmpty()) {
            throw new IllegalArgumentException("token list must end with EOF");
        }
        this.tokens = tokens;
        this.fileName = fileName;
        this.position = 0;
        this.current = tokens.get(0);
        failOnErrorToken();
    }

    // ============ 基础方法 ============

    /**
     * 前进到下一个 token，返回被消费的 token
     */
    Token advance() {
        previous = current;
        if (position < tokens.size() - 1) {
            position++;
        }
        current = tokens.get(position);
        failOnErrorToken();
        return previous;
    }

    private void failOnErrorToken() {
        if (current.getType() == ERROR) {
            throw new ParseException(String.valueOf(current.getLiteral()), current);
        }
    }

    /**
     * 查看下一个 token（不消费当前）
     */
    Token peek() {
        return tokens.get(Math.min(position + 1, tokens.size() - 1));
    }

    /**
     * 标记当前位置，用于回溯
     */
    int mark() {
        return position;
    }

    /**
     * 回溯到标记的位置
     */
    void reset(int mark) {
        position = mark;
        current = tokens.get(position);
        previous = position > 0 ? tokens.get(position - 1) : null;
    }

    /**
     * 检查当前 token 类型
     */
    boolean check(TokenType type) {
        return current.getType() == type;
    }

    /**
     * 检查当前 token 是否为给定类型之一
     */
    boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) return true;
        }
        return false;
    }

    /**
     * 向前看一个 token（不消费当前）
     */
    boolean checkAhead(TokenType type) {
        return peek().getType() == type;
    }

    /**
     * 如果当前 token 匹配，则前进
     */
    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * 如果当前 token 匹配任一类型，则前进
     */
    boolean matchAny(TokenType... types) {
        for (TokenType type : types) {
            if (match(type)) return true;
        }
        return false;
    }

    /**
     * 期望特定 token，否则报错
     */
    Token expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw new ParseException(message, current, type.name());
    }

    /**
     * 当前 token 处的语法错误
     */
    ParseException error(String message) {
        return new ParseException(message, current);
    }

    /**
     * 创建源码位置
     */
    SourceLocation location() {
        return locationOf(current);
    }

    /**
     * 从之前的 token 创建位置
     */
    SourceLocation previousLocation() {
        return locationOf(previous);
    }

    SourceLocation locationOf(Token token) {
        return new SourceLocation(fileName, token.getLine(), token.getColumn(),
                token.getOffset(), token.getLexeme().length());
    }

    /**
     * 是否到达文件末尾
     */
    boolean isAtEnd() {
        return check(EOF);
    }

    /**
     * 当前 token 能否开始一个表达式（用于判断逗号结尾的列表）
     */
    boolean canStartExpression() {
        switch (current.getType()) {
            case IDENTIFIER:
            case INT_LITERAL: case FLOAT_LITERAL: case IMAGINARY_LITERAL:
            case STRING_LITERAL: case BYTES_LITERAL: case FSTRING_LITERAL:
            case LPAREN: case LBRACKET: case LBRACE:
            case MINUS: case PLUS: case TILDE: case STAR:
            case KW_NOT: case KW_LAMBDA: case KW_AWAIT:
            case KW_TRUE: case KW_FALSE: case KW_NONE:
            case ELLIPSIS:
                return true;
            default:
                return false;
        }
    }

    // ============ 程序解析 ============

    /**
     * 解析整个模块
     */
    public Module parse() {
        SourceLocation loc = new SourceLocation(fileName, 1, 0, 0, 0);
        List<Statement> body = new ArrayList<Statement>();
        while (!isAtEnd()) {
            if (match(NEWLINE)) continue;
            if (check(INDENT)) {
                throw error("unexpected indent");
            }
            if (check(DEDENT)) {
                throw error("unindent does not match any outer indentation level");
            }
            body.addAll(parseStatement());
        }
        return new Module(loc, body);
    }

    /**
     * 解析单个独立表达式（f-string 替换字段），必须消费全部 token
     */
    Expression parseStandaloneExpression() {
        if (isAtEnd()) {
            throw error("f-string: empty expression not allowed");
        }
        Expression expr = exprParser.parseYieldOrStarExpressions();
        if (!isAtEnd()) {
            throw error("f-string: invalid syntax");
        }
        return expr;
    }

    // ============ 语句解析委托 ============

    List<Statement> parseStatement() { return stmtParser.parseStatement(); }
    List<Statement> parseBlock() { return stmtParser.parseBlock(); }

    // ============ 表达式解析委托 ============

    Expression parseExpression() { return exprParser.parseExpression(); }
    Expression parseNamedExpression() { return exprParser.parseNamedExpression(); }
    Expression parseStarExpressions() { return exprParser.parseStarExpressions(); }
}
