package com.typelens.compiler.parser;

import com.typelens.compiler.ast.SourceLocation;
import com.typelens.compiler.ast.decl.*;
import com.typelens.compiler.ast.expr.Expression;
import com.typelens.compiler.ast.expr.KeywordArgument;
import com.typelens.compiler.ast.stmt.Statement;
import com.typelens.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.typelens.compiler.lexer.TokenType.*;

/**
 * 声明解析辅助类（函数、类、参数、导入）
 */
class DeclParser {

    final Parser parser;

    DeclParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * 带装饰器的函数或类声明
     */
    Statement parseDecorated() {
        List<Expression> decorators = new ArrayList<Expression>();
        while (parser.match(AT)) {
            decorators.add(parser.parseNamedExpression());
            parser.expect(NEWLINE, "Expected newline after decorator");
        }
        if (parser.check(KW_DEF) || (parser.check(KW_ASYNC) && parser.checkAhead(KW_DEF))) {
            return parseFunctionDef(decorators);
        }
        if (parser.check(KW_CLASS)) {
            return parseClassDef(decorators);
        }
        throw parser.error("Expected 'def' or 'class' after decorator");
    }

    // ============ 函数 ============

    FunctionDef parseFunctionDef(List<Expression> decorators) {
        SourceLocation loc = parser.location();
        boolean isAsync = parser.match(KW_ASYNC);
        parser.expect(KW_DEF, "Expected 'def'");
        String name = parser.expect(IDENTIFIER, "Expected function name").getLexeme();
        parser.expect(LPAREN, "Expected '(' after function name");
        List<Parameter> params = parseParameters(RPAREN, true);
        parser.expect(RPAREN, "Expected ')' after parameters");
        Expression returns = parser.match(ARROW) ? parser.parseExpression() : null;
        List<Statement> body = parser.parseBlock();
        return new FunctionDef(loc, name, params, returns, body, decorators, isAsync);
    }

    /**
     * 参数列表（不消费结束符）
     *
     * @param closer            结束符：函数为 ')'，lambda 为 ':'
     * @param allowAnnotations 是否允许 name: type 注解（lambda 不允许）
     */
    List<Parameter> parseParameters(TokenType closer, boolean allowAnnotations) {
        List<Parameter> params = new ArrayList<Parameter>();
        boolean seenStar = false;
        boolean seenDefault = false;
        boolean seenSlash = false;
        while (!parser.check(closer)) {
            if (parser.match(SLASH)) {
                if (seenSlash || seenStar || params.isEmpty()) {
                    throw parser.error("invalid syntax");
                }
                seenSlash = true;
                for (Parameter p : params) {
                    p.markPositionalOnly();
                }
            } else if (parser.match(STAR)) {
                if (seenStar) {
                    throw parser.error("* argument may appear only once");
                }
                seenStar = true;
                if (parser.check(IDENTIFIER)) {
                    SourceLocation loc = parser.location();
                    String name = parser.advance().getLexeme();
                    Expression annotation = parseAnnotation(allowAnnotations);
                    params.add(new Parameter(loc, name, annotation, null, Parameter.ParamKind.VAR_POSITIONAL));
                } else if (parser.check(closer)) {
                    throw parser.error("named arguments must follow bare *");
                }
            } else if (parser.match(DOUBLE_STAR)) {
                SourceLocation loc = parser.location();
                String name = parser.expect(IDENTIFIER, "Expected parameter name after '**'").getLexeme();
                Expression annotation = parseAnnotation(allowAnnotations);
                params.add(new Parameter(loc, name, annotation, null, Parameter.ParamKind.VAR_KEYWORD));
                parser.match(COMMA);
                if (!parser.check(closer)) {
                    throw parser.error("arguments cannot follow var-keyword argument");
                }
                break;
            } else {
                SourceLocation loc = parser.location();
                String name = parser.expect(IDENTIFIER, "Expected parameter name").getLexeme();
                Expression annotation = parseAnnotation(allowAnnotations);
                Expression defaultValue = parser.match(ASSIGN) ? parser.parseExpression() : null;
                if (defaultValue != null) {
                    seenDefault = true;
                } else if (seenDefault && !seenStar) {
                    throw parser.error("parameter without a default follows parameter with a default");
                }
                Parameter.ParamKind kind = seenStar ? Parameter.ParamKind.KEYWORD_ONLY : Parameter.ParamKind.POSITIONAL;
                params.add(new Parameter(loc, name, annotation, defaultValue, kind));
            }
            if (!parser.match(COMMA)) break;
        }
        return params;
    }

    private Expression parseAnnotation(boolean allowAnnotations) {
        if (allowAnnotations && parser.match(COLON)) {
            return parser.parseExpression();
        }
        return null;
    }

    // ============ 类 ============

    ClassDef parseClassDef(List<Expression> decorators) {
        SourceLocation loc = parser.location();
        parser.expect(KW_CLASS, "Expected 'class'");
        String name = parser.expect(IDENTIFIER, "Expected class name").getLexeme();
        List<Expression> bases = new ArrayList<Expression>();
        List<KeywordArgument> keywords = new ArrayList<KeywordArgument>();
        if (parser.match(LPAREN)) {
            parser.exprParser.parseArgumentList(bases, keywords);
        }
        List<Statement> body = parser.parseBlock();
        return new ClassDef(loc, name, bases, keywords, body, decorators);
    }

    // ============ 导入 ============

    ImportDecl parseImport() {
        SourceLocation loc = parser.location();
        parser.expect(KW_IMPORT, "Expected 'import'");
        List<ImportAlias> names = new ArrayList<ImportAlias>();
        do {
            String name = parseDottedName();
            String alias = parser.match(KW_AS)
                    ? parser.expect(IDENTIFIER, "Expected alias name").getLexeme() : null;
            names.add(new ImportAlias(name, alias));
        } while (parser.match(COMMA));
        return new ImportDecl(loc, names);
    }

    ImportFromDecl parseImportFrom() {
        SourceLocation loc = parser.location();
        parser.expect(KW_FROM, "Expected 'from'");
        int level = 0;
        while (parser.checkAny(DOT, ELLIPSIS)) {
            level += parser.advance().getType() == ELLIPSIS ? 3 : 1;
        }
        String module = parser.check(IDENTIFIER) ? parseDottedName() : null;
        if (module == null && level == 0) {
            throw parser.error("Expected module name after 'from'");
        }
        parser.expect(KW_IMPORT, "Expected 'import'");

        List<ImportAlias> names = new ArrayList<ImportAlias>();
        if (parser.match(STAR)) {
            names.add(new ImportAlias("*", null));
        } else {
            boolean grouped = parser.match(LPAREN);
            do {
                if (grouped && parser.check(RPAREN)) break;
                String name = parser.expect(IDENTIFIER, "Expected name to import").getLexeme();
                String alias = parser.match(KW_AS)
                        ? parser.expect(IDENTIFIER, "Expected alias name").getLexeme() : null;
                names.add(new ImportAlias(name, alias));
            } while (parser.match(COMMA));
            if (grouped) {
                parser.expect(RPAREN, "Expected ')'");
            }
            if (names.isEmpty()) {
                throw parser.error("Expected name to import");
            }
        }
        return new ImportFromDecl(loc, module, level, names);
    }

    private String parseDottedName() {
        StringBuilder sb = new StringBuilder();
        sb.append(parser.expect(IDENTIFIER, "Expected module name").getLexeme());
        while (parser.match(DOT)) {
            sb.append('.').append(parser.expect(IDENTIFIER, "Expected name after '.'").getLexeme());
        }
        return sb.toString();
    }
}
