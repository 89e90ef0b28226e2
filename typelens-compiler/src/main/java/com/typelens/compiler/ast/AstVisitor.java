package com.typelens.compiler.ast;

import com.typelens.compiler.ast.decl.*;
import com.typelens.compiler.ast.decl.Module;
import com.typelens.compiler.ast.expr.*;
import com.typelens.compiler.ast.stmt.*;

/**
 * AST 访问者接口
 *
 * <p>方法不提供默认实现：新增节点种类时，所有访问者都必须显式处理。
 * 只关心少数节点的遍历器继承 {@link AstScanner}。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 声明 ============

    R visitModule(Module node, C ctx);

    R visitFunctionDef(FunctionDef node, C ctx);

    R visitClassDef(ClassDef node, C ctx);

    R visitParameter(Parameter node, C ctx);

    R visitImportDecl(ImportDecl node, C ctx);

    R visitImportFromDecl(ImportFromDecl node, C ctx);

    // ============ 语句 ============

    R visitExpressionStmt(ExpressionStmt node, C ctx);

    R visitAssignStmt(AssignStmt node, C ctx);

    R visitAugAssignStmt(AugAssignStmt node, C ctx);

    R visitAnnAssignStmt(AnnAssignStmt node, C ctx);

    R visitReturnStmt(ReturnStmt node, C ctx);

    R visitDeleteStmt(DeleteStmt node, C ctx);

    R visitPassStmt(PassStmt node, C ctx);

    R visitBreakStmt(BreakStmt node, C ctx);

    R visitContinueStmt(ContinueStmt node, C ctx);

    R visitRaiseStmt(RaiseStmt node, C ctx);

    R visitGlobalStmt(GlobalStmt node, C ctx);

    R visitAssertStmt(AssertStmt node, C ctx);

    R visitIfStmt(IfStmt node, C ctx);

    R visitWhileStmt(WhileStmt node, C ctx);

    R visitForStmt(ForStmt node, C ctx);

    R visitTryStmt(TryStmt node, C ctx);

    R visitExceptHandler(ExceptHandler node, C ctx);

    R visitWithStmt(WithStmt node, C ctx);

    R visitWithItem(WithItem node, C ctx);

    // ============ 表达式 ============

    R visitLiteral(Literal node, C ctx);

    R visitFormattedString(FormattedString node, C ctx);

    R visitIdentifier(Identifier node, C ctx);

    R visitCollectionLiteral(CollectionLiteral node, C ctx);

    R visitDictLiteral(DictLiteral node, C ctx);

    R visitCallExpr(CallExpr node, C ctx);

    R visitKeywordArgument(KeywordArgument node, C ctx);

    R visitBinaryExpr(BinaryExpr node, C ctx);

    R visitUnaryExpr(UnaryExpr node, C ctx);

    R visitCompareExpr(CompareExpr node, C ctx);

    R visitBoolOpExpr(BoolOpExpr node, C ctx);

    R visitComprehensionExpr(ComprehensionExpr node, C ctx);

    R visitComprehensionClause(ComprehensionClause node, C ctx);

    R visitConditionalExpr(ConditionalExpr node, C ctx);

    R visitLambdaExpr(LambdaExpr node, C ctx);

    R visitMemberExpr(MemberExpr node, C ctx);

    R visitIndexExpr(IndexExpr node, C ctx);

    R visitSliceExpr(SliceExpr node, C ctx);

    R visitStarredExpr(StarredExpr node, C ctx);

    R visitNamedExpr(NamedExpr node, C ctx);

    R visitAwaitExpr(AwaitExpr node, C ctx);

    R visitYieldExpr(YieldExpr node, C ctx);
}
