package com.typelens.compiler.ast;

import com.typelens.compiler.ast.decl.*;
import com.typelens.compiler.ast.decl.Module;
import com.typelens.compiler.ast.expr.*;
import com.typelens.compiler.ast.stmt.*;

import java.util.List;

/**
 * 递归遍历全部子节点的访问者基类
 *
 * <p>子类覆盖感兴趣的节点，并在需要继续下探时调用 super。
 * 子节点按源码中出现的先后顺序访问（装饰器先于函数体）。</p>
 */
public abstract class AstScanner<C> implements AstVisitor<Void, C> {

    protected void scan(AstNode node, C ctx) {
        if (node != null) {
            node.accept(this, ctx);
        }
    }

    protected void scanAll(List<? extends AstNode> nodes, C ctx) {
        if (nodes == null) return;
        for (AstNode node : nodes) {
            scan(node, ctx);
        }
    }

    // ============ 声明 ============

    @Override
    public Void visitModule(Module node, C ctx) {
        scanAll(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitFunctionDef(FunctionDef node, C ctx) {
        scanAll(node.getDecorators(), ctx);
        scanAll(node.getParams(), ctx);
        scan(node.getReturns(), ctx);
        scanAll(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitClassDef(ClassDef node, C ctx) {
        scanAll(node.getDecorators(), ctx);
        scanAll(node.getBases(), ctx);
        scanAll(node.getKeywords(), ctx);
        scanAll(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitParameter(Parameter node, C ctx) {
        scan(node.getAnnotation(), ctx);
        scan(node.getDefaultValue(), ctx);
        return null;
    }

    @Override
    public Void visitImportDecl(ImportDecl node, C ctx) {
        return null;
    }

    @Override
    public Void visitImportFromDecl(ImportFromDecl node, C ctx) {
        return null;
    }

    // ============ 语句 ============

    @Override
    public Void visitExpressionStmt(ExpressionStmt node, C ctx) {
        scan(node.getExpression(), ctx);
        return null;
    }

    @Override
    public Void visitAssignStmt(AssignStmt node, C ctx) {
        scanAll(node.getTargets(), ctx);
        scan(node.getValue(), ctx);
        return null;
    }

    @Override
    public Void visitAugAssignStmt(AugAssignStmt node, C ctx) {
        scan(node.getTarget(), ctx);
        scan(node.getValue(), ctx);
        return null;
    }

    @Override
    public Void visitAnnAssignStmt(AnnAssignStmt node, C ctx) {
        scan(node.getTarget(), ctx);
        scan(node.getAnnotation(), ctx);
        scan(node.getValue(), ctx);
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node, C ctx) {
        scan(node.getValue(), ctx);
        return null;
    }

    @Override
    public Void visitDeleteStmt(DeleteStmt node, C ctx) {
        scanAll(node.getTargets(), ctx);
        return null;
    }

    @Override
    public Void visitPassStmt(PassStmt node, C ctx) {
        return null;
    }

    @Override
    public Void visitBreakStmt(BreakStmt node, C ctx) {
        return null;
    }

    @Override
    public Void visitContinueStmt(ContinueStmt node, C ctx) {
        return null;
    }

    @Override
    public Void visitRaiseStmt(RaiseStmt node, C ctx) {
        scan(node.getException(), ctx);
        scan(node.getCause(), ctx);
        return null;
    }

    @Override
    public Void visitGlobalStmt(GlobalStmt node, C ctx) {
        return null;
    }

    @Override
    public Void visitAssertStmt(AssertStmt node, C ctx) {
        scan(node.getTest(), ctx);
        scan(node.getMessage(), ctx);
        return null;
    }

    @Override
    public Void visitIfStmt(IfStmt node, C ctx) {
        scan(node.getCondition(), ctx);
        scanAll(node.getBody(), ctx);
        scanAll(node.getOrElse(), ctx);
        return null;
    }

    @Override
    public Void visitWhileStmt(WhileStmt node, C ctx) {
        scan(node.getCondition(), ctx);
        scanAll(node.getBody(), ctx);
        scanAll(node.getOrElse(), ctx);
        return null;
    }

    @Override
    public Void visitForStmt(ForStmt node, C ctx) {
        scan(node.getTarget(), ctx);
        scan(node.getIterable(), ctx);
        scanAll(node.getBody(), ctx);
        scanAll(node.getOrElse(), ctx);
        return null;
    }

    @Override
    public Void visitTryStmt(TryStmt node, C ctx) {
        scanAll(node.getBody(), ctx);
        scanAll(node.getHandlers(), ctx);
        scanAll(node.getOrElse(), ctx);
        scanAll(node.getFinallyBody(), ctx);
        return null;
    }

    @Override
    public Void visitExceptHandler(ExceptHandler node, C ctx) {
        scan(node.getExceptionType(), ctx);
        scanAll(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitWithStmt(WithStmt node, C ctx) {
        scanAll(node.getItems(), ctx);
        scanAll(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitWithItem(WithItem node, C ctx) {
        scan(node.getContextExpr(), ctx);
        scan(node.getTarget(), ctx);
        return null;
    }

    // ============ 表达式 ============

    @Override
    public Void visitLiteral(Literal node, C ctx) {
        return null;
    }

    @Override
    public Void visitFormattedString(FormattedString node, C ctx) {
        scanAll(node.getValues(), ctx);
        return null;
    }

    @Override
    public Void visitIdentifier(Identifier node, C ctx) {
        return null;
    }

    @Override
    public Void visitCollectionLiteral(CollectionLiteral node, C ctx) {
        scanAll(node.getElements(), ctx);
        return null;
    }

    @Override
    public Void visitDictLiteral(DictLiteral node, C ctx) {
        for (int i = 0; i < node.size(); i++) {
            scan(node.getKeys().get(i), ctx);
            scan(node.getValues().get(i), ctx);
        }
        return null;
    }

    @Override
    public Void visitCallExpr(CallExpr node, C ctx) {
        scan(node.getCallee(), ctx);
        scanAll(node.getArgs(), ctx);
        scanAll(node.getKeywords(), ctx);
        return null;
    }

    @Override
    public Void visitKeywordArgument(KeywordArgument node, C ctx) {
        scan(node.getValue(), ctx);
        return null;
    }

    @Override
    public Void visitBinaryExpr(BinaryExpr node, C ctx) {
        scan(node.getLeft(), ctx);
        scan(node.getRight(), ctx);
        return null;
    }

    @Override
    public Void visitUnaryExpr(UnaryExpr node, C ctx) {
        scan(node.getOperand(), ctx);
        return null;
    }

    @Override
    public Void visitCompareExpr(CompareExpr node, C ctx) {
        scan(node.getLeft(), ctx);
        scanAll(node.getComparators(), ctx);
        return null;
    }

    @Override
    public Void visitBoolOpExpr(BoolOpExpr node, C ctx) {
        scanAll(node.getValues(), ctx);
        return null;
    }

    @Override
    public Void visitComprehensionExpr(ComprehensionExpr node, C ctx) {
        scan(node.getElement(), ctx);
        scan(node.getValue(), ctx);
        scanAll(node.getClauses(), ctx);
        return null;
    }

    @Override
    public Void visitComprehensionClause(ComprehensionClause node, C ctx) {
        scan(node.getTarget(), ctx);
        scan(node.getIterable(), ctx);
        scanAll(node.getConditions(), ctx);
        return null;
    }

    @Override
    public Void visitConditionalExpr(ConditionalExpr node, C ctx) {
        scan(node.getCondition(), ctx);
        scan(node.getThenExpr(), ctx);
        scan(node.getElseExpr(), ctx);
        return null;
    }

    @Override
    public Void visitLambdaExpr(LambdaExpr node, C ctx) {
        scanAll(node.getParams(), ctx);
        scan(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitMemberExpr(MemberExpr node, C ctx) {
        scan(node.getTarget(), ctx);
        return null;
    }

    @Override
    public Void visitIndexExpr(IndexExpr node, C ctx) {
        scan(node.getTarget(), ctx);
        scan(node.getIndex(), ctx);
        return null;
    }

    @Override
    public Void visitSliceExpr(SliceExpr node, C ctx) {
        scan(node.getLower(), ctx);
        scan(node.getUpper(), ctx);
        scan(node.getStep(), ctx);
        return null;
    }

    @Override
    public Void visitStarredExpr(StarredExpr node, C ctx) {
        scan(node.getValue(), ctx);
        return null;
    }

    @Override
    public Void visitNamedExpr(NamedExpr node, C ctx) {
        scan(node.getTarget(), ctx);
        scan(node.getValue(), ctx);
        return null;
    }

    @Override
    public Void visitAwaitExpr(AwaitExpr node, C ctx) {
        scan(node.getValue(), ctx);
        return null;
    }

    @Override
    public Void visitYieldExpr(YieldExpr node, C ctx) {
        scan(node.getValue(), ctx);
        return null;
    }
}
