package com.typelens.compiler.parser;

import com.typelens.compiler.ast.ExprContext;
import com.typelens.compiler.ast.SourceLocation;
import com.typelens.compiler.ast.expr.*;
import com.typelens.compiler.ast.stmt.*;
import com.typelens.compiler.lexer.Token;
import com.typelens.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.typelens.compiler.lexer.TokenType.*;

/**
 * 语句解析辅助类
 *
 * <p>一条逻辑行可以包含多条以分号分隔的简单语句，因此语句解析返回列表。</p>
 */
class StmtParser {

    final Parser parser;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    List<Statement> parseStatement() {
        Statement compound = parseCompoundStatement();
        if (compound != null) {
            return Collections.singletonList(compound);
        }
        return parseSimpleStatements();
    }

    /**
     * 代码块：冒号后跟缩进块，或同一行上的简单语句
     */
    List<Statement> parseBlock() {
        parser.expect(COLON, "expected ':'");
        if (!parser.match(NEWLINE)) {
            return parseSimpleStatements();
        }
        parser.expect(INDENT, "expected an indented block");
        List<Statement> body = new ArrayList<Statement>();
        while (!parser.match(DEDENT)) {
            if (parser.isAtEnd()) break;
            if (parser.match(NEWLINE)) continue;
            if (parser.check(INDENT)) {
                throw parser.error("unexpected indent");
            }
            body.addAll(parseStatement());
        }
        return body;
    }

    // ============ 复合语句 ============

    private Statement parseCompoundStatement() {
        switch (parser.current.getType()) {
            case AT:
                return parser.declParser.parseDecorated();
            case KW_DEF:
                return parser.declParser.parseFunctionDef(Collections.<Expression>emptyList());
            case KW_CLASS:
                return parser.declParser.parseClassDef(Collections.<Expression>emptyList());
            case KW_IF:
                return parseIf();
            case KW_WHILE:
                return parseWhile();
            case KW_FOR:
                return parseFor();
            case KW_TRY:
                return parseTry();
            case KW_WITH:
                return parseWith();
            case KW_ASYNC:
                if (parser.checkAhead(KW_DEF)) {
                    return parser.declParser.parseFunctionDef(Collections.<Expression>emptyList());
                }
                if (parser.checkAhead(KW_FOR)) {
                    return parseFor();
                }
                if (parser.checkAhead(KW_WITH)) {
                    return parseWith();
                }
                throw parser.error("invalid syntax");
            default:
                return null;
        }
    }

    private IfStmt parseIf() {
        SourceLocation loc = parser.location();
        parser.advance();  // if / elif
        Expression condition = parser.parseNamedExpression();
        List<Statement> body = parseBlock();
        List<Statement> orElse;
        if (parser.check(KW_ELIF)) {
            orElse = Collections.<Statement>singletonList(parseIf());
        } else if (parser.match(KW_ELSE)) {
            orElse = parseBlock();
        } else {
            orElse = Collections.emptyList();
        }
        return new IfStmt(loc, condition, body, orElse);
    }

    private WhileStmt parseWhile() {
        SourceLocation loc = parser.location();
        parser.advance();
        Expression condition = parser.parseNamedExpression();
        List<Statement> body = parseBlock();
        List<Statement> orElse = parser.match(KW_ELSE) ? parseBlock() : Collections.<Statement>emptyList();
        return new WhileStmt(loc, condition, body, orElse);
    }

    private ForStmt parseFor() {
        SourceLocation loc = parser.location();
        boolean isAsync = parser.match(KW_ASYNC);
        parser.expect(KW_FOR, "Expected 'for'");
        Expression target = parser.exprParser.parseTargetList();
        markStore(target);
        parser.expect(KW_IN, "Expected 'in' after for-loop target");
        Expression iterable = parser.parseStarExpressions();
        List<Statement> body = parseBlock();
        List<Statement> orElse = parser.match(KW_ELSE) ? parseBlock() : Collections.<Statement>emptyList();
        return new ForStmt(loc, target, iterable, body, orElse, isAsync);
    }

    private TryStmt parseTry() {
        SourceLocation loc = parser.location();
        parser.advance();
        List<Statement> body = parseBlock();

        List<ExceptHandler> handlers = new ArrayList<ExceptHandler>();
        while (parser.check(KW_EXCEPT)) {
            SourceLocation handlerLoc = parser.location();
            parser.advance();
            parser.match(STAR);  // except*
            Expression type = null;
            String name = null;
            if (!parser.check(COLON)) {
                type = parser.parseExpression();
                if (parser.check(COMMA)) {
                    type = continueTuple(type);
                }
                if (parser.match(KW_AS)) {
                    name = parser.expect(IDENTIFIER, "Expected name after 'as'").getLexeme();
                }
            }
            handlers.add(new ExceptHandler(handlerLoc, type, name, parseBlock()));
        }

        List<Statement> orElse = Collections.emptyList();
        if (!handlers.isEmpty() && parser.match(KW_ELSE)) {
            orElse = parseBlock();
        }
        List<Statement> finallyBody = Collections.emptyList();
        if (parser.match(KW_FINALLY)) {
            finallyBody = parseBlock();
        } else if (handlers.isEmpty()) {
            throw parser.error("expected 'except' or 'finally' block");
        }
        return new TryStmt(loc, body, handlers, orElse, finallyBody);
    }

    // except A, B: 形式的未加括号元组
    private Expression continueTuple(Expression first) {
        List<Expression> elements = new ArrayList<Expression>();
        elements.add(first);
        while (parser.match(COMMA)) {
            elements.add(parser.parseExpression());
        }
        return new CollectionLiteral(first.getLocation(), CollectionLiteral.CollectionKind.TUPLE, elements);
    }

    private WithStmt parseWith() {
        SourceLocation loc = parser.location();
        boolean isAsync = parser.match(KW_ASYNC);
        parser.expect(KW_WITH, "Expected 'with'");

        List<WithItem> items = null;
        if (parser.check(LPAREN)) {
            // with (a as b, c as d): 形式需要回溯判断
            int mark = parser.mark();
            try {
                parser.advance();
                List<WithItem> grouped = parseWithItems(RPAREN);
                parser.expect(RPAREN, "Expected ')'");
                if (parser.check(COLON)) {
                    items = grouped;
                } else {
                    parser.reset(mark);
                }
            } catch (ParseException e) {
                parser.reset(mark);
            }
        }
        if (items == null) {
            items = parseWithItems(COLON);
        }
        List<Statement> body = parseBlock();
        return new WithStmt(loc, items, body, isAsync);
    }

    private List<WithItem> parseWithItems(TokenType terminator) {
        List<WithItem> items = new ArrayList<WithItem>();
        do {
            if (parser.check(terminator)) break;
            SourceLocation loc = parser.location();
            Expression contextExpr = parser.parseExpression();
            Expression target = null;
            if (parser.match(KW_AS)) {
                target = parser.exprParser.parseTargetElement();
                markStore(target);
            }
            items.add(new WithItem(loc, contextExpr, target));
        } while (parser.match(COMMA));
        if (items.isEmpty()) {
            throw parser.error("invalid syntax");
        }
        return items;
    }

    // ============ 简单语句 ============

    private List<Statement> parseSimpleStatements() {
        List<Statement> statements = new ArrayList<Statement>();
        statements.add(parseSimpleStatement());
        while (parser.match(SEMICOLON)) {
            if (parser.check(NEWLINE) || parser.isAtEnd()) break;
            statements.add(parseSimpleStatement());
        }
        if (!parser.match(NEWLINE) && !parser.isAtEnd()) {
            throw parser.error("invalid syntax");
        }
        return statements;
    }

    private Statement parseSimpleStatement() {
        SourceLocation loc = parser.location();
        switch (parser.current.getType()) {
            case KW_PASS:
                parser.advance();
                return new PassStmt(loc);
            case KW_BREAK:
                parser.advance();
                return new BreakStmt(loc);
            case KW_CONTINUE:
                parser.advance();
                return new ContinueStmt(loc);
            case KW_RETURN: {
                parser.advance();
                Expression value = parser.canStartExpression() ? parser.parseStarExpressions() : null;
                return new ReturnStmt(loc, value);
            }
            case KW_RAISE: {
                parser.advance();
                Expression exception = null;
                Expression cause = null;
                if (parser.canStartExpression()) {
                    exception = parser.parseExpression();
                    if (parser.match(KW_FROM)) {
                        cause = parser.parseExpression();
                    }
                }
                return new RaiseStmt(loc, exception, cause);
            }
            case KW_GLOBAL:
            case KW_NONLOCAL: {
                boolean nonlocal = parser.advance().getType() == KW_NONLOCAL;
                List<String> names = new ArrayList<String>();
                do {
                    names.add(parser.expect(IDENTIFIER, "Expected name").getLexeme());
                } while (parser.match(COMMA));
                return new GlobalStmt(loc, names, nonlocal);
            }
            case KW_DEL: {
                parser.advance();
                List<Expression> targets = new ArrayList<Expression>();
                do {
                    if (!parser.canStartExpression()) break;
                    Expression target = parser.exprParser.parseTargetElement();
                    markDel(target);
                    targets.add(target);
                } while (parser.match(COMMA));
                if (targets.isEmpty()) {
                    throw parser.error("invalid syntax");
                }
                return new DeleteStmt(loc, targets);
            }
            case KW_ASSERT: {
                parser.advance();
                Expression test = parser.parseExpression();
                Expression message = parser.match(COMMA) ? parser.parseExpression() : null;
                return new AssertStmt(loc, test, message);
            }
            case KW_IMPORT:
                return parser.declParser.parseImport();
            case KW_FROM:
                return parser.declParser.parseImportFrom();
            default:
                return parseExpressionStatement(loc);
        }
    }

    /**
     * 表达式语句、赋值、增强赋值与带注解赋值
     */
    private Statement parseExpressionStatement(SourceLocation loc) {
        boolean parenthesized = parser.check(LPAREN);
        Expression first = parser.exprParser.parseYieldOrStarExpressions();

        if (parser.match(COLON)) {
            if (!isSingleTarget(first)) {
                throw parser.error("only single target (not tuple) can be annotated");
            }
            Expression annotation = parser.parseExpression();
            Expression value = parser.match(ASSIGN) ? parser.exprParser.parseYieldOrStarExpressions() : null;
            markStore(first);
            boolean simple = first instanceof Identifier && !parenthesized;
            return new AnnAssignStmt(loc, first, annotation, value, simple);
        }

        if (parser.current.getType().isAugmentedAssign()) {
            Token op = parser.advance();
            if (!isSingleTarget(first)) {
                throw new ParseException("illegal expression for augmented assignment", op);
            }
            Expression value = parser.exprParser.parseYieldOrStarExpressions();
            markStore(first);
            return new AugAssignStmt(loc, first, augmentedOperator(op), value);
        }

        if (parser.check(ASSIGN)) {
            List<Expression> chain = new ArrayList<Expression>();
            chain.add(first);
            while (parser.match(ASSIGN)) {
                chain.add(parser.exprParser.parseYieldOrStarExpressions());
            }
            Expression value = chain.remove(chain.size() - 1);
            for (Expression target : chain) {
                markStore(target);
            }
            return new AssignStmt(loc, chain, value);
        }

        return new ExpressionStmt(loc, first);
    }

    private static boolean isSingleTarget(Expression expr) {
        return expr instanceof Identifier || expr instanceof MemberExpr || expr instanceof IndexExpr;
    }

    private static BinaryExpr.BinaryOp augmentedOperator(Token op) {
        switch (op.getType()) {
            case PLUS_ASSIGN: return BinaryExpr.BinaryOp.ADD;
            case MINUS_ASSIGN: return BinaryExpr.BinaryOp.SUB;
            case STAR_ASSIGN: return BinaryExpr.BinaryOp.MUL;
            case SLASH_ASSIGN: return BinaryExpr.BinaryOp.DIV;
            case DOUBLE_SLASH_ASSIGN: return BinaryExpr.BinaryOp.FLOOR_DIV;
            case PERCENT_ASSIGN: return BinaryExpr.BinaryOp.MOD;
            case DOUBLE_STAR_ASSIGN: return BinaryExpr.BinaryOp.POW;
            case AT_ASSIGN: return BinaryExpr.BinaryOp.MAT_MUL;
            case PIPE_ASSIGN: return BinaryExpr.BinaryOp.BIT_OR;
            case CARET_ASSIGN: return BinaryExpr.BinaryOp.BIT_XOR;
            case AMPERSAND_ASSIGN: return BinaryExpr.BinaryOp.BIT_AND;
            case LSHIFT_ASSIGN: return BinaryExpr.BinaryOp.LSHIFT;
            case RSHIFT_ASSIGN: return BinaryExpr.BinaryOp.RSHIFT;
            default: throw new ParseException("Unexpected assignment operator", op);
        }
    }

    // ============ 目标上下文 ============

    /**
     * 将赋值目标标记为 STORE 上下文；不可赋值的表达式报错
     */
    void markStore(Expression target) {
        markContext(target, ExprContext.STORE, "assign to");
    }

    void markDel(Expression target) {
        markContext(target, ExprContext.DEL, "delete");
    }

    private void markContext(Expression target, ExprContext context, String verb) {
        if (target instanceof Identifier) {
            ((Identifier) target).setContext(context);
        } else if (target instanceof MemberExpr) {
            ((MemberExpr) target).setContext(context);
        } else if (target instanceof IndexExpr) {
            ((IndexExpr) target).setContext(context);
        } else if (target instanceof StarredExpr && context == ExprContext.STORE) {
            StarredExpr starred = (StarredExpr) target;
            starred.setContext(context);
            markContext(starred.getValue(), context, verb);
        } else if (target instanceof CollectionLiteral
                && ((CollectionLiteral) target).getCollectionKind() != CollectionLiteral.CollectionKind.SET) {
            CollectionLiteral collection = (CollectionLiteral) target;
            collection.setContext(context);
            for (Expression element : collection.getElements()) {
                markContext(element, context, verb);
            }
        } else {
            throw new ParseException("cannot " + verb + " " + describe(target), parser.previous);
        }
    }

    private static String describe(Expression expr) {
        if (expr instanceof Literal) return "literal";
        if (expr instanceof CallExpr) return "function call";
        if (expr instanceof ComprehensionExpr) return "comprehension";
        if (expr instanceof LambdaExpr) return "lambda";
        if (expr instanceof CompareExpr) return "comparison";
        if (expr instanceof YieldExpr) return "yield expression";
        return "expression";
    }
}
