package com.typelens.compiler.ast;

import com.typelens.compiler.ast.decl.*;
import com.typelens.compiler.ast.decl.Module;
import com.typelens.compiler.ast.expr.*;
import com.typelens.compiler.ast.stmt.*;

import java.util.List;

/**
 * 把表达式子树还原为单行源码文本（注解、装饰器名、基类名）
 *
 * <p>语句节点只输出节点种类名。</p>
 */
public final class SourcePrinter implements AstVisitor<String, Void> {

    private static final SourcePrinter INSTANCE = new SourcePrinter();

    private SourcePrinter() {}

    public static String print(AstNode node) {
        return node == null ? null : node.accept(INSTANCE, null);
    }

    /**
     * 点分名称：Name → id，Attribute → a.b.c，Call → 被调用者的点分名称
     */
    public static String dottedName(Expression expr) {
        if (expr instanceof CallExpr) {
            return dottedName(((CallExpr) expr).getCallee());
        }
        return print(expr);
    }

    private String p(AstNode node) {
        return node == null ? "" : node.accept(this, null);
    }

    /** 复合表达式作为运算数时加括号 */
    private String operand(Expression e) {
        String text = p(e);
        if (e instanceof BinaryExpr || e instanceof BoolOpExpr || e instanceof CompareExpr
                || e instanceof ConditionalExpr || e instanceof LambdaExpr || e instanceof NamedExpr
                || (e instanceof CollectionLiteral
                    && ((CollectionLiteral) e).getCollectionKind() == CollectionLiteral.CollectionKind.TUPLE)) {
            return "(" + text + ")";
        }
        return text;
    }

    private String join(List<? extends AstNode> nodes) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < nodes.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(p(nodes.get(i)));
        }
        return sb.toString();
    }

    private String kindName(AstNode node) {
        return node.getKind().getDisplayName();
    }

    // ============ 声明 / 语句 ============

    @Override
    public String visitModule(Module node, Void ctx) { return kindName(node); }

    @Override
    public String visitFunctionDef(FunctionDef node, Void ctx) { return kindName(node); }

    @Override
    public String visitClassDef(ClassDef node, Void ctx) { return kindName(node); }

    @Override
    public String visitParameter(Parameter node, Void ctx) {
        StringBuilder sb = new StringBuilder();
        switch (node.getParamKind()) {
            case VAR_POSITIONAL: sb.append('*'); break;
            case VAR_KEYWORD: sb.append("**"); break;
            default: break;
        }
        sb.append(node.getName());
        if (node.hasAnnotation()) sb.append(": ").append(p(node.getAnnotation()));
        if (node.hasDefaultValue()) {
            sb.append(node.hasAnnotation() ? " = " : "=").append(p(node.getDefaultValue()));
        }
        return sb.toString();
    }

    @Override
    public String visitImportDecl(ImportDecl node, Void ctx) { return kindName(node); }

    @Override
    public String visitImportFromDecl(ImportFromDecl node, Void ctx) { return kindName(node); }

    @Override
    public String visitExpressionStmt(ExpressionStmt node, Void ctx) { return kindName(node); }

    @Override
    public String visitAssignStmt(AssignStmt node, Void ctx) { return kindName(node); }

    @Override
    public String visitAugAssignStmt(AugAssignStmt node, Void ctx) { return kindName(node); }

    @Override
    public String visitAnnAssignStmt(AnnAssignStmt node, Void ctx) { return kindName(node); }

    @Override
    public String visitReturnStmt(ReturnStmt node, Void ctx) { return kindName(node); }

    @Override
    public String visitDeleteStmt(DeleteStmt node, Void ctx) { return kindName(node); }

    @Override
    public String visitPassStmt(PassStmt node, Void ctx) { return kindName(node); }

    @Override
    public String visitBreakStmt(BreakStmt node, Void ctx) { return kindName(node); }

    @Override
    public String visitContinueStmt(ContinueStmt node, Void ctx) { return kindName(node); }

    @Override
    public String visitRaiseStmt(RaiseStmt node, Void ctx) { return kindName(node); }

    @Override
    public String visitGlobalStmt(GlobalStmt node, Void ctx) { return kindName(node); }

    @Override
    public String visitAssertStmt(AssertStmt node, Void ctx) { return kindName(node); }

    @Override
    public String visitIfStmt(IfStmt node, Void ctx) { return kindName(node); }

    @Override
    public String visitWhileStmt(WhileStmt node, Void ctx) { return kindName(node); }

    @Override
    public String visitForStmt(ForStmt node, Void ctx) { return kindName(node); }

    @Override
    public String visitTryStmt(TryStmt node, Void ctx) { return kindName(node); }

    @Override
    public String visitExceptHandler(ExceptHandler node, Void ctx) { return kindName(node); }

    @Override
    public String visitWithStmt(WithStmt node, Void ctx) { return kindName(node); }

    @Override
    public String visitWithItem(WithItem node, Void ctx) { return kindName(node); }

    // ============ 表达式 ============

    @Override
    public String visitLiteral(Literal node, Void ctx) {
        return node.getSourceText();
    }

    @Override
    public String visitFormattedString(FormattedString node, Void ctx) {
        return "f'" + node.getRawText() + "'";
    }

    @Override
    public String visitIdentifier(Identifier node, Void ctx) {
        return node.getName();
    }

    @Override
    public String visitCollectionLiteral(CollectionLiteral node, Void ctx) {
        String inner = join(node.getElements());
        switch (node.getCollectionKind()) {
            case LIST: return "[" + inner + "]";
            case SET: return "{" + inner + "}";
            case TUPLE:
            default:
                return node.getElements().size() == 1 ? "(" + inner + ",)" : "(" + inner + ")";
        }
    }

    @Override
    public String visitDictLiteral(DictLiteral node, Void ctx) {
        StringBuilder sb = new StringBuilder("{");
        for (int i = 0; i < node.size(); i++) {
            if (i > 0) sb.append(", ");
            Expression key = node.getKeys().get(i);
            if (key == null) {
                sb.append("**").append(p(node.getValues().get(i)));
            } else {
                sb.append(p(key)).append(": ").append(p(node.getValues().get(i)));
            }
        }
        return sb.append('}').toString();
    }

    @Override
    public String visitCallExpr(CallExpr node, Void ctx) {
        StringBuilder sb = new StringBuilder(operand(node.getCallee())).append('(');
        sb.append(join(node.getArgs()));
        if (!node.getArgs().isEmpty() && !node.getKeywords().isEmpty()) sb.append(", ");
        sb.append(join(node.getKeywords()));
        return sb.append(')').toString();
    }

    @Override
    public String visitKeywordArgument(KeywordArgument node, Void ctx) {
        return node.isDoubleStar() ? "**" + p(node.getValue()) : node.getName() + "=" + p(node.getValue());
    }

    @Override
    public String visitBinaryExpr(BinaryExpr node, Void ctx) {
        return operand(node.getLeft()) + " " + node.getOperator().getSymbol() + " " + operand(node.getRight());
    }

    @Override
    public String visitUnaryExpr(UnaryExpr node, Void ctx) {
        switch (node.getOperator()) {
            case NOT: return "not " + operand(node.getOperand());
            case NEG: return "-" + operand(node.getOperand());
            case POS: return "+" + operand(node.getOperand());
            case INVERT:
            default:
                return "~" + operand(node.getOperand());
        }
    }

    @Override
    public String visitCompareExpr(CompareExpr node, Void ctx) {
        StringBuilder sb = new StringBuilder(operand(node.getLeft()));
        for (int i = 0; i < node.getOperators().size(); i++) {
            sb.append(' ').append(node.getOperators().get(i).getSymbol()).append(' ')
              .append(operand(node.getComparators().get(i)));
        }
        return sb.toString();
    }

    @Override
    public String visitBoolOpExpr(BoolOpExpr node, Void ctx) {
        String separator = node.getOperator() == BoolOpExpr.BoolOp.AND ? " and " : " or ";
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < node.getValues().size(); i++) {
            if (i > 0) sb.append(separator);
            sb.append(operand(node.getValues().get(i)));
        }
        return sb.toString();
    }

    @Override
    public String visitComprehensionExpr(ComprehensionExpr node, Void ctx) {
        StringBuilder body = new StringBuilder(p(node.getElement()));
        if (node.getValue() != null) body.append(": ").append(p(node.getValue()));
        for (ComprehensionClause clause : node.getClauses()) {
            body.append(' ').append(p(clause));
        }
        switch (node.getComprehensionKind()) {
            case LIST: return "[" + body + "]";
            case GENERATOR: return "(" + body + ")";
            case SET:
            case DICT:
            default:
                return "{" + body + "}";
        }
    }

    @Override
    public String visitComprehensionClause(ComprehensionClause node, Void ctx) {
        StringBuilder sb = new StringBuilder(node.isAsync() ? "async for " : "for ");
        Expression target = node.getTarget();
        String targetText = p(target);
        if (target instanceof CollectionLiteral && targetText.startsWith("(")) {
            targetText = targetText.substring(1, targetText.length() - 1);
        }
        sb.append(targetText).append(" in ").append(operand(node.getIterable()));
        for (Expression condition : node.getConditions()) {
            sb.append(" if ").append(operand(condition));
        }
        return sb.toString();
    }

    @Override
    public String visitConditionalExpr(ConditionalExpr node, Void ctx) {
        return operand(node.getThenExpr()) + " if " + operand(node.getCondition()) + " else " + operand(node.getElseExpr());
    }

    @Override
    public String visitLambdaExpr(LambdaExpr node, Void ctx) {
        String params = join(node.getParams());
        return params.isEmpty() ? "lambda: " + p(node.getBody()) : "lambda " + params + ": " + p(node.getBody());
    }

    @Override
    public String visitMemberExpr(MemberExpr node, Void ctx) {
        return operand(node.getTarget()) + "." + node.getMember();
    }

    @Override
    public String visitIndexExpr(IndexExpr node, Void ctx) {
        Expression index = node.getIndex();
        String indexText;
        if (index instanceof CollectionLiteral
                && ((CollectionLiteral) index).getCollectionKind() == CollectionLiteral.CollectionKind.TUPLE
                && !((CollectionLiteral) index).isEmpty()) {
            indexText = join(((CollectionLiteral) index).getElements());
        } else {
            indexText = p(index);
        }
        return operand(node.getTarget()) + "[" + indexText + "]";
    }

    @Override
    public String visitSliceExpr(SliceExpr node, Void ctx) {
        String text = p(node.getLower()) + ":" + p(node.getUpper());
        if (node.getStep() != null) text += ":" + p(node.getStep());
        return text;
    }

    @Override
    public String visitStarredExpr(StarredExpr node, Void ctx) {
        return "*" + operand(node.getValue());
    }

    @Override
    public String visitNamedExpr(NamedExpr node, Void ctx) {
        return p(node.getTarget()) + " := " + operand(node.getValue());
    }

    @Override
    public String visitAwaitExpr(AwaitExpr node, Void ctx) {
        return "await " + operand(node.getValue());
    }

    @Override
    public String visitYieldExpr(YieldExpr node, Void ctx) {
        String keyword = node.isDelegate() ? "yield from" : "yield";
        return node.getValue() == null ? keyword : keyword + " " + p(node.getValue());
    }
}
