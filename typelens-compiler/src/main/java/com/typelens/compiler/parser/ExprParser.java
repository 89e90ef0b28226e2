package com.typelens.compiler.parser;

import com.typelens.compiler.ast.SourceLocation;
import com.typelens.compiler.ast.decl.Parameter;
import com.typelens.compiler.ast.expr.*;
import com.typelens.compiler.lexer.Token;
import com.typelens.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.typelens.compiler.lexer.TokenType.*;

/**
 * 表达式解析辅助类
 *
 * <p>优先级由低到高：lambda / 条件表达式、or、and、not、比较链、|、^、&amp;、移位、
 * 加减、乘除、一元、**、await、后缀（调用 / 成员 / 下标）、原子。
 * 二元节点的位置取左操作数的位置。</p>
 */
class ExprParser {

    /** 括号最大嵌套层数，与 CPython 解析器一致 */
    static final int MAX_NESTING = 200;

    final Parser parser;

    private int nesting;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    // ============ 列表级入口 ============

    /**
     * star_expressions：逗号分隔时构成元组
     */
    Expression parseStarExpressions() {
        Expression first = parseStarExpression();
        if (!parser.check(COMMA)) {
            return first;
        }
        List<Expression> elements = new ArrayList<Expression>();
        elements.add(first);
        while (parser.match(COMMA)) {
            if (!parser.canStartExpression()) break;
            elements.add(parseStarExpression());
        }
        return new CollectionLiteral(first.getLocation(), CollectionLiteral.CollectionKind.TUPLE, elements);
    }

    /**
     * yield 表达式或 star_expressions（赋值右侧、return 值）
     */
    Expression parseYieldOrStarExpressions() {
        if (parser.check(KW_YIELD)) {
            return parseYield();
        }
        return parseStarExpressions();
    }

    private Expression parseStarExpression() {
        if (parser.check(STAR)) {
            SourceLocation loc = parser.location();
            parser.advance();
            return new StarredExpr(loc, parseBitwiseOr());
        }
        return parseExpression();
    }

    private Expression parseStarNamedExpression() {
        if (parser.check(STAR)) {
            SourceLocation loc = parser.location();
            parser.advance();
            return new StarredExpr(loc, parseBitwiseOr());
        }
        return parseNamedExpression();
    }

    Expression parseYield() {
        SourceLocation loc = parser.location();
        parser.expect(KW_YIELD, "Expected 'yield'");
        if (parser.match(KW_FROM)) {
            return new YieldExpr(loc, parseExpression(), true);
        }
        Expression value = parser.canStartExpression() ? parseStarExpressions() : null;
        return new YieldExpr(loc, value, false);
    }

    /**
     * 赋值目标列表（for 循环与推导式），在 'in' 之前停止
     */
    Expression parseTargetList() {
        Expression first = parseTargetElement();
        if (!parser.check(COMMA)) {
            return first;
        }
        List<Expression> elements = new ArrayList<Expression>();
        elements.add(first);
        while (parser.match(COMMA)) {
            if (!parser.canStartExpression()) break;
            elements.add(parseTargetElement());
        }
        return new CollectionLiteral(first.getLocation(), CollectionLiteral.CollectionKind.TUPLE, elements);
    }

    Expression parseTargetElement() {
        if (parser.check(STAR)) {
            SourceLocation loc = parser.location();
            parser.advance();
            return new StarredExpr(loc, parseBitwiseOr());
        }
        return parseBitwiseOr();
    }

    // ============ 表达式 ============

    /**
     * 命名表达式：name := value
     */
    Expression parseNamedExpression() {
        if (parser.check(IDENTIFIER) && parser.checkAhead(WALRUS)) {
            Token name = parser.advance();
            SourceLocation loc = parser.locationOf(name);
            parser.advance();  // :=
            Expression value = parseExpression();
            return new NamedExpr(loc, new Identifier(loc, name.getLexeme()), value);
        }
        return parseExpression();
    }

    Expression parseExpression() {
        if (parser.check(KW_LAMBDA)) {
            return parseLambda();
        }
        Expression body = parseDisjunction();
        if (parser.match(KW_IF)) {
            Expression condition = parseDisjunction();
            parser.expect(KW_ELSE, "expected 'else' after 'if' expression");
            Expression orElse = parseExpression();
            return new ConditionalExpr(body.getLocation(), condition, body, orElse);
        }
        return body;
    }

    private Expression parseLambda() {
        SourceLocation loc = parser.location();
        parser.advance();  // lambda
        List<Parameter> params = parser.declParser.parseParameters(COLON, false);
        parser.expect(COLON, "Expected ':' after lambda parameters");
        Expression body = parseExpression();
        return new LambdaExpr(loc, params, body);
    }

    // 逻辑或 or（同一运算符展平为一个节点）
    private Expression parseDisjunction() {
        Expression first = parseConjunction();
        if (!parser.check(KW_OR)) {
            return first;
        }
        List<Expression> values = new ArrayList<Expression>();
        values.add(first);
        while (parser.match(KW_OR)) {
            values.add(parseConjunction());
        }
        return new BoolOpExpr(first.getLocation(), BoolOpExpr.BoolOp.OR, values);
    }

    // 逻辑与 and
    private Expression parseConjunction() {
        Expression first = parseInversion();
        if (!parser.check(KW_AND)) {
            return first;
        }
        List<Expression> values = new ArrayList<Expression>();
        values.add(first);
        while (parser.match(KW_AND)) {
            values.add(parseInversion());
        }
        return new BoolOpExpr(first.getLocation(), BoolOpExpr.BoolOp.AND, values);
    }

    // 逻辑非 not
    private Expression parseInversion() {
        if (parser.check(KW_NOT)) {
            SourceLocation loc = parser.location();
            parser.advance();
            return new UnaryExpr(loc, UnaryExpr.UnaryOp.NOT, parseInversion());
        }
        return parseComparison();
    }

    // 比较链
    private Expression parseComparison() {
        Expression left = parseBitwiseOr();
        List<CompareExpr.CompareOp> operators = new ArrayList<CompareExpr.CompareOp>();
        List<Expression> comparators = new ArrayList<Expression>();
        while (true) {
            CompareExpr.CompareOp op = matchCompareOp();
            if (op == null) break;
            operators.add(op);
            comparators.add(parseBitwiseOr());
        }
        if (operators.isEmpty()) {
            return left;
        }
        return new CompareExpr(left.getLocation(), left, operators, comparators);
    }

    private CompareExpr.CompareOp matchCompareOp() {
        switch (parser.current.getType()) {
            case EQ: parser.advance(); return CompareExpr.CompareOp.EQ;
            case NE: parser.advance(); return CompareExpr.CompareOp.NE;
            case LT: parser.advance(); return CompareExpr.CompareOp.LT;
            case LE: parser.advance(); return CompareExpr.CompareOp.LE;
            case GT: parser.advance(); return CompareExpr.CompareOp.GT;
            case GE: parser.advance(); return CompareExpr.CompareOp.GE;
            case KW_IN: parser.advance(); return CompareExpr.CompareOp.IN;
            case KW_NOT:
                if (parser.checkAhead(KW_IN)) {
                    parser.advance();
                    parser.advance();
                    return CompareExpr.CompareOp.NOT_IN;
                }
                return null;
            case KW_IS:
                parser.advance();
                return parser.match(KW_NOT) ? CompareExpr.CompareOp.IS_NOT : CompareExpr.CompareOp.IS;
            default:
                return null;
        }
    }

    // 按位或 |
    Expression parseBitwiseOr() {
        Expression left = parseBitwiseXor();
        while (parser.match(PIPE)) {
            left = new BinaryExpr(left.getLocation(), left, BinaryExpr.BinaryOp.BIT_OR, parseBitwiseXor());
        }
        return left;
    }

    // 按位异或 ^
    private Expression parseBitwiseXor() {
        Expression left = parseBitwiseAnd();
        while (parser.match(CARET)) {
            left = new BinaryExpr(left.getLocation(), left, BinaryExpr.BinaryOp.BIT_XOR, parseBitwiseAnd());
        }
        return left;
    }

    // 按位与 &
    private Expression parseBitwiseAnd() {
        Expression left = parseShift();
        while (parser.match(AMPERSAND)) {
            left = new BinaryExpr(left.getLocation(), left, BinaryExpr.BinaryOp.BIT_AND, parseShift());
        }
        return left;
    }

    // 移位 << >>
    private Expression parseShift() {
        Expression left = parseSum();
        while (parser.checkAny(LSHIFT, RSHIFT)) {
            BinaryExpr.BinaryOp op = parser.advance().getType() == LSHIFT
                    ? BinaryExpr.BinaryOp.LSHIFT : BinaryExpr.BinaryOp.RSHIFT;
            left = new BinaryExpr(left.getLocation(), left, op, parseSum());
        }
        return left;
    }

    // 加减 + -
    private Expression parseSum() {
        Expression left = parseTerm();
        while (parser.checkAny(PLUS, MINUS)) {
            BinaryExpr.BinaryOp op = parser.advance().getType() == PLUS
                    ? BinaryExpr.BinaryOp.ADD : BinaryExpr.BinaryOp.SUB;
            left = new BinaryExpr(left.getLocation(), left, op, parseTerm());
        }
        return left;
    }

    // 乘除 * / // % @
    private Expression parseTerm() {
        Expression left = parseFactor();
        while (true) {
            BinaryExpr.BinaryOp op;
            switch (parser.current.getType()) {
                case STAR: op = BinaryExpr.BinaryOp.MUL; break;
                case SLASH: op = BinaryExpr.BinaryOp.DIV; break;
                case DOUBLE_SLASH: op = BinaryExpr.BinaryOp.FLOOR_DIV; break;
                case PERCENT: op = BinaryExpr.BinaryOp.MOD; break;
                case AT: op = BinaryExpr.BinaryOp.MAT_MUL; break;
                default: return left;
            }
            parser.advance();
            left = new BinaryExpr(left.getLocation(), left, op, parseFactor());
        }
    }

    // 一元 + - ~
    private Expression parseFactor() {
        UnaryExpr.UnaryOp op;
        switch (parser.current.getType()) {
            case PLUS: op = UnaryExpr.UnaryOp.POS; break;
            case MINUS: op = UnaryExpr.UnaryOp.NEG; break;
            case TILDE: op = UnaryExpr.UnaryOp.INVERT; break;
            default: return parsePower();
        }
        SourceLocation loc = parser.location();
        parser.advance();
        return new UnaryExpr(loc, op, parseFactor());
    }

    // 幂 **（右结合，右侧为一元表达式）
    private Expression parsePower() {
        Expression base = parseAwaitPrimary();
        if (parser.match(DOUBLE_STAR)) {
            return new BinaryExpr(base.getLocation(), base, BinaryExpr.BinaryOp.POW, parseFactor());
        }
        return base;
    }

    private Expression parseAwaitPrimary() {
        if (parser.check(KW_AWAIT)) {
            SourceLocation loc = parser.location();
            parser.advance();
            return new AwaitExpr(loc, parsePrimary());
        }
        return parsePrimary();
    }

    // ============ 后缀 ============

    private Expression parsePrimary() {
        Expression expr = parseAtom();
        while (true) {
            if (parser.match(DOT)) {
                String member = parser.expect(IDENTIFIER, "Expected attribute name after '.'").getLexeme();
                expr = new MemberExpr(expr.getLocation(), expr, member);
            } else if (parser.match(LPAREN)) {
                List<Expression> args = new ArrayList<Expression>();
                List<KeywordArgument> keywords = new ArrayList<KeywordArgument>();
                parseArgumentList(args, keywords);
                expr = new CallExpr(expr.getLocation(), expr, args, keywords);
            } else if (parser.match(LBRACKET)) {
                Expression index = parseSlices();
                parser.expect(RBRACKET, "Expected ']'");
                expr = new IndexExpr(expr.getLocation(), expr, index);
            } else {
                return expr;
            }
        }
    }

    /**
     * 解析调用参数（左括号已消费，消费到右括号为止）
     */
    void parseArgumentList(List<Expression> args, List<KeywordArgument> keywords) {
        while (!parser.check(RPAREN)) {
            SourceLocation loc = parser.location();
            if (parser.match(STAR)) {
                args.add(new StarredExpr(loc, parseExpression()));
            } else if (parser.match(DOUBLE_STAR)) {
                keywords.add(new KeywordArgument(loc, null, parseExpression()));
            } else if (parser.check(IDENTIFIER) && parser.checkAhead(ASSIGN)) {
                String name = parser.advance().getLexeme();
                parser.advance();  // =
                keywords.add(new KeywordArgument(loc, name, parseExpression()));
            } else {
                Expression arg = parseNamedExpression();
                if (isComprehensionStart()) {
                    arg = new ComprehensionExpr(arg.getLocation(), ComprehensionExpr.ComprehensionKind.GENERATOR,
                            arg, null, parseComprehensionClauses());
                }
                if (!keywords.isEmpty() && !(arg instanceof StarredExpr)) {
                    throw parser.error("positional argument follows keyword argument");
                }
                args.add(arg);
            }
            if (!parser.match(COMMA)) break;
        }
        parser.expect(RPAREN, "Expected ')' after arguments");
    }

    // 下标：单个切片或逗号分隔的切片元组
    private Expression parseSlices() {
        Expression first = parseSlice();
        if (!parser.check(COMMA)) {
            return first;
        }
        List<Expression> elements = new ArrayList<Expression>();
        elements.add(first);
        while (parser.match(COMMA)) {
            if (parser.check(RBRACKET)) break;
            elements.add(parseSlice());
        }
        return new CollectionLiteral(first.getLocation(), CollectionLiteral.CollectionKind.TUPLE, elements);
    }

    private Expression parseSlice() {
        SourceLocation loc = parser.location();
        Expression lower = null;
        if (!parser.check(COLON)) {
            lower = parseStarNamedExpression();
            if (!parser.check(COLON)) {
                return lower;
            }
        }
        parser.advance();  // :
        Expression upper = parser.checkAny(COLON, RBRACKET, COMMA) ? null : parseExpression();
        Expression step = null;
        if (parser.match(COLON)) {
            step = parser.checkAny(RBRACKET, COMMA) ? null : parseExpression();
        }
        return new SliceExpr(lower != null ? lower.getLocation() : loc, lower, upper, step);
    }

    // ============ 原子 ============

    private Expression parseAtom() {
        SourceLocation loc = parser.location();
        Token token = parser.current;
        switch (token.getType()) {
            case IDENTIFIER:
                parser.advance();
                return new Identifier(loc, token.getLexeme());
            case KW_TRUE:
                parser.advance();
                return new Literal(loc, Literal.LiteralKind.BOOLEAN, Boolean.TRUE);
            case KW_FALSE:
                parser.advance();
                return new Literal(loc, Literal.LiteralKind.BOOLEAN, Boolean.FALSE);
            case KW_NONE:
                parser.advance();
                return new Literal(loc, Literal.LiteralKind.NONE, null);
            case ELLIPSIS:
                parser.advance();
                return new Literal(loc, Literal.LiteralKind.ELLIPSIS, null);
            case INT_LITERAL:
                parser.advance();
                return new Literal(loc, Literal.LiteralKind.INT, token.getLiteral());
            case FLOAT_LITERAL:
                parser.advance();
                return new Literal(loc, Literal.LiteralKind.FLOAT, token.getLiteral());
            case IMAGINARY_LITERAL:
                parser.advance();
                return new Literal(loc, Literal.LiteralKind.COMPLEX, token.getLiteral());
            case STRING_LITERAL:
            case BYTES_LITERAL:
            case FSTRING_LITERAL:
                return parser.literalHelper.parseStrings();
            case LPAREN:
            case LBRACKET:
            case LBRACE:
                return parseNested(token.getType());
            default:
                throw parser.error("invalid syntax");
        }
    }

    private Expression parseNested(TokenType open) {
        if (nesting >= MAX_NESTING) {
            throw parser.error("too many nested parentheses");
        }
        nesting++;
        try {
            switch (open) {
                case LPAREN: return parseParenthesized();
                case LBRACKET: return parseListDisplay();
                default: return parseBraceDisplay();
            }
        } finally {
            nesting--;
        }
    }

    // ( ... )：空元组、yield、生成器表达式、元组或带括号的表达式
    private Expression parseParenthesized() {
        SourceLocation loc = parser.location();
        parser.advance();  // (
        if (parser.match(RPAREN)) {
            return new CollectionLiteral(loc, CollectionLiteral.CollectionKind.TUPLE,
                    new ArrayList<Expression>());
        }
        if (parser.check(KW_YIELD)) {
            Expression yield = parseYield();
            parser.expect(RPAREN, "Expected ')'");
            return yield;
        }
        Expression first = parseStarNamedExpression();
        if (isComprehensionStart()) {
            List<ComprehensionClause> clauses = parseComprehensionClauses();
            parser.expect(RPAREN, "Expected ')' after generator expression");
            return new ComprehensionExpr(loc, ComprehensionExpr.ComprehensionKind.GENERATOR,
                    first, null, clauses);
        }
        if (parser.check(COMMA)) {
            List<Expression> elements = new ArrayList<Expression>();
            elements.add(first);
            while (parser.match(COMMA)) {
                if (parser.check(RPAREN)) break;
                elements.add(parseStarNamedExpression());
            }
            parser.expect(RPAREN, "Expected ')'");
            return new CollectionLiteral(loc, CollectionLiteral.CollectionKind.TUPLE, elements);
        }
        parser.expect(RPAREN, "Expected ')'");
        return first;
    }

    // [ ... ]：列表或列表推导式
    private Expression parseListDisplay() {
        SourceLocation loc = parser.location();
        parser.advance();  // [
        List<Expression> elements = new ArrayList<Expression>();
        if (parser.match(RBRACKET)) {
            return new CollectionLiteral(loc, CollectionLiteral.CollectionKind.LIST, elements);
        }
        Expression first = parseStarNamedExpression();
        if (isComprehensionStart()) {
            List<ComprehensionClause> clauses = parseComprehensionClauses();
            parser.expect(RBRACKET, "Expected ']' after list comprehension");
            return new ComprehensionExpr(loc, ComprehensionExpr.ComprehensionKind.LIST, first, null, clauses);
        }
        elements.add(first);
        while (parser.match(COMMA)) {
            if (parser.check(RBRACKET)) break;
            elements.add(parseStarNamedExpression());
        }
        parser.expect(RBRACKET, "Expected ']'");
        return new CollectionLiteral(loc, CollectionLiteral.CollectionKind.LIST, elements);
    }

    // { ... }：字典、集合及其推导式
    private Expression parseBraceDisplay() {
        SourceLocation loc = parser.location();
        parser.advance();  // {
        if (parser.match(RBRACE)) {
            return new DictLiteral(loc, new ArrayList<Expression>(), new ArrayList<Expression>());
        }
        if (parser.check(DOUBLE_STAR)) {
            return parseDictEntries(loc, null, null);
        }
        Expression first = parseStarNamedExpression();
        if (parser.match(COLON)) {
            Expression value = parseExpression();
            if (isComprehensionStart()) {
                List<ComprehensionClause> clauses = parseComprehensionClauses();
                parser.expect(RBRACE, "Expected '}' after dict comprehension");
                return new ComprehensionExpr(loc, ComprehensionExpr.ComprehensionKind.DICT, first, value, clauses);
            }
            return parseDictEntries(loc, first, value);
        }
        if (isComprehensionStart()) {
            List<ComprehensionClause> clauses = parseComprehensionClauses();
            parser.expect(RBRACE, "Expected '}' after set comprehension");
            return new ComprehensionExpr(loc, ComprehensionExpr.ComprehensionKind.SET, first, null, clauses);
        }
        List<Expression> elements = new ArrayList<Expression>();
        elements.add(first);
        while (parser.match(COMMA)) {
            if (parser.check(RBRACE)) break;
            elements.add(parseStarNamedExpression());
        }
        parser.expect(RBRACE, "Expected '}'");
        return new CollectionLiteral(loc, CollectionLiteral.CollectionKind.SET, elements);
    }

    /**
     * 解析剩余的字典条目。firstKey 为 null 且 firstValue 为 null 时从当前 token 开始解析第一项。
     */
    private Expression parseDictEntries(SourceLocation loc, Expression firstKey, Expression firstValue) {
        List<Expression> keys = new ArrayList<Expression>();
        List<Expression> values = new ArrayList<Expression>();
        boolean needEntry = true;
        if (firstValue != null) {
            keys.add(firstKey);
            values.add(firstValue);
            needEntry = parser.match(COMMA);
        }
        while (needEntry && !parser.check(RBRACE)) {
            if (parser.match(DOUBLE_STAR)) {
                keys.add(null);
                values.add(parseBitwiseOr());
            } else {
                keys.add(parseExpression());
                parser.expect(COLON, "Expected ':' in dict entry");
                values.add(parseExpression());
            }
            needEntry = parser.match(COMMA);
        }
        parser.expect(RBRACE, "Expected '}'");
        return new DictLiteral(loc, keys, values);
    }

    // ============ 推导式 ============

    boolean isComprehensionStart() {
        return parser.check(KW_FOR) || (parser.check(KW_ASYNC) && parser.checkAhead(KW_FOR));
    }

    List<ComprehensionClause> parseComprehensionClauses() {
        List<ComprehensionClause> clauses = new ArrayList<ComprehensionClause>();
        while (isComprehensionStart()) {
            SourceLocation loc = parser.location();
            boolean isAsync = parser.match(KW_ASYNC);
            parser.expect(KW_FOR, "Expected 'for'");
            Expression target = parseTargetList();
            parser.stmtParser.markStore(target);
            parser.expect(KW_IN, "Expected 'in' in comprehension");
            Expression iterable = parseDisjunction();
            List<Expression> conditions = new ArrayList<Expression>();
            while (parser.match(KW_IF)) {
                conditions.add(parseDisjunction());
            }
            clauses.add(new ComprehensionClause(loc, target, iterable,
                    conditions.isEmpty() ? Collections.<Expression>emptyList() : conditions, isAsync));
        }
        return clauses;
    }
}
