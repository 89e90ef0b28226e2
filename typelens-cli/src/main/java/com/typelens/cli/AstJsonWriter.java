package com.typelens.cli;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.typelens.compiler.ast.AstNode;
import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.ExprContext;
import com.typelens.compiler.ast.decl.*;
import com.typelens.compiler.ast.decl.Module;
import com.typelens.compiler.ast.expr.*;
import com.typelens.compiler.ast.stmt.*;

import java.util.List;

/**
 * 语法树 → 可视化 JSON
 *
 * <p>每个节点输出 id（"node_" + 先序编号）、node_type、lineno、col_offset 以及各自的字段。</p>
 */
public final class AstJsonWriter implements AstVisitor<JsonObject, Void> {

    private static final AstJsonWriter INSTANCE = new AstJsonWriter();

    private AstJsonWriter() {}

    public static JsonObject toJson(AstNode root) {
        return INSTANCE.node(root);
    }

    // ============ 辅助 ============

    private JsonObject node(AstNode node) {
        return node == null ? null : node.accept(this, null);
    }

    private JsonElement child(AstNode node) {
        return node == null ? JsonNull.INSTANCE : node.accept(this, null);
    }

    private JsonArray children(List<? extends AstNode> nodes) {
        JsonArray array = new JsonArray();
        for (AstNode n : nodes) {
            array.add(child(n));
        }
        return array;
    }

    private static JsonArray strings(List<String> values) {
        JsonArray array = new JsonArray();
        for (String v : values) {
            array.add(v);
        }
        return array;
    }

    private static JsonObject header(AstNode node) {
        JsonObject obj = new JsonObject();
        obj.addProperty("id", "node_" + node.getId());
        obj.addProperty("node_type", node.getKind().getDisplayName());
        obj.addProperty("lineno", node.getLine());
        obj.addProperty("col_offset", node.getColumn());
        return obj;
    }

    private static JsonPrimitive ctx(ExprContext context) {
        return new JsonPrimitive(context.getDisplayName());
    }

    private static void addNullable(JsonObject obj, String key, String value) {
        if (value == null) obj.add(key, JsonNull.INSTANCE);
        else obj.addProperty(key, value);
    }

    // ============ 声明 ============

    @Override
    public JsonObject visitModule(Module node, Void c) {
        JsonObject obj = header(node);
        obj.add("body", children(node.getBody()));
        return obj;
    }

    @Override
    public JsonObject visitFunctionDef(FunctionDef node, Void c) {
        JsonObject obj = header(node);
        obj.addProperty("name", node.getName());
        obj.add("args", children(node.getParams()));
        obj.add("body", children(node.getBody()));
        obj.add("decorator_list", children(node.getDecorators()));
        obj.add("returns", child(node.getReturns()));
        return obj;
    }

    @Override
    public JsonObject visitClassDef(ClassDef node, Void c) {
        JsonObject obj = header(node);
        obj.addProperty("name", node.getName());
        obj.add("bases", children(node.getBases()));
        obj.add("keywords", children(node.getKeywords()));
        obj.add("body", children(node.getBody()));
        obj.add("decorator_list", children(node.getDecorators()));
        return obj;
    }

    @Override
    public JsonObject visitParameter(Parameter node, Void c) {
        JsonObject obj = header(node);
        obj.addProperty("arg", node.getName());
        obj.addProperty("kind", node.getParamKind().name().toLowerCase());
        obj.add("annotation", child(node.getAnnotation()));
        obj.add("default", child(node.getDefaultValue()));
        return obj;
    }

    @Override
    public JsonObject visitImportDecl(ImportDecl node, Void c) {
        JsonObject obj = header(node);
        obj.add("names", aliases(node.getNames()));
        return obj;
    }

    @Override
    public JsonObject visitImportFromDecl(ImportFromDecl node, Void c) {
        JsonObject obj = header(node);
        addNullable(obj, "module", node.getModule());
        obj.add("names", aliases(node.getNames()));
        obj.addProperty("level", node.getLevel());
        return obj;
    }

    /** 导入别名不是独立节点，只输出名称 */
    private static JsonArray aliases(List<ImportAlias> names) {
        JsonArray array = new JsonArray();
        for (ImportAlias alias : names) {
            JsonObject a = new JsonObject();
            a.addProperty("name", alias.getName());
            addNullable(a, "asname", alias.getAsName());
            array.add(a);
        }
        return array;
    }

    // ============ 语句 ============

    @Override
    public JsonObject visitExpressionStmt(ExpressionStmt node, Void c) {
        JsonObject obj = header(node);
        obj.add("value", child(node.getExpression()));
        return obj;
    }

    @Override
    public JsonObject visitAssignStmt(AssignStmt node, Void c) {
        JsonObject obj = header(node);
        obj.add("targets", children(node.getTargets()));
        obj.add("value", child(node.getValue()));
        return obj;
    }

    @Override
    public JsonObject visitAugAssignStmt(AugAssignStmt node, Void c) {
        JsonObject obj = header(node);
        obj.add("target", child(node.getTarget()));
        obj.addProperty("op", node.getOperator().getDisplayName());
        obj.add("value", child(node.getValue()));
        return obj;
    }

    @Override
    public JsonObject visitAnnAssignStmt(AnnAssignStmt node, Void c) {
        JsonObject obj = header(node);
        obj.add("target", child(node.getTarget()));
        obj.add("annotation", child(node.getAnnotation()));
        obj.add("value", child(node.getValue()));
        obj.addProperty("simple", node.isSimple() ? 1 : 0);
        return obj;
    }

    @Override
    public JsonObject visitReturnStmt(ReturnStmt node, Void c) {
        JsonObject obj = header(node);
        obj.add("value", child(node.getValue()));
        return obj;
    }

    @Override
    public JsonObject visitDeleteStmt(DeleteStmt node, Void c) {
        JsonObject obj = header(node);
        obj.add("targets", children(node.getTargets()));
        return obj;
    }

    @Override
    public JsonObject visitPassStmt(PassStmt node, Void c) { return header(node); }

    @Override
    public JsonObject visitBreakStmt(BreakStmt node, Void c) { return header(node); }

    @Override
    public JsonObject visitContinueStmt(ContinueStmt node, Void c) { return header(node); }

    @Override
    public JsonObject visitRaiseStmt(RaiseStmt node, Void c) {
        JsonObject obj = header(node);
        obj.add("exc", child(node.getException()));
        obj.add("cause", child(node.getCause()));
        return obj;
    }

    @Override
    public JsonObject visitGlobalStmt(GlobalStmt node, Void c) {
        JsonObject obj = header(node);
        obj.add("names", strings(node.getNames()));
        return obj;
    }

    @Override
    public JsonObject visitAssertStmt(AssertStmt node, Void c) {
        JsonObject obj = header(node);
        obj.add("test", child(node.getTest()));
        obj.add("msg", child(node.getMessage()));
        return obj;
    }

    @Override
    public JsonObject visitIfStmt(IfStmt node, Void c) {
        JsonObject obj = header(node);
        obj.add("test", child(node.getCondition()));
        obj.add("body", children(node.getBody()));
        obj.add("orelse", children(node.getOrElse()));
        return obj;
    }

    @Override
    public JsonObject visitWhileStmt(WhileStmt node, Void c) {
        JsonObject obj = header(node);
        obj.add("test", child(node.getCondition()));
        obj.add("body", children(node.getBody()));
        obj.add("orelse", children(node.getOrElse()));
        return obj;
    }

    @Override
    public JsonObject visitForStmt(ForStmt node, Void c) {
        JsonObject obj = header(node);
        obj.add("target", child(node.getTarget()));
        obj.add("iter", child(node.getIterable()));
        obj.add("body", children(node.getBody()));
        obj.add("orelse", children(node.getOrElse()));
        return obj;
    }

    @Override
    public JsonObject visitTryStmt(TryStmt node, Void c) {
        JsonObject obj = header(node);
        obj.add("body", children(node.getBody()));
        obj.add("handlers", children(node.getHandlers()));
        obj.add("orelse", children(node.getOrElse()));
        obj.add("finalbody", children(node.getFinallyBody()));
        return obj;
    }

    @Override
    public JsonObject visitExceptHandler(ExceptHandler node, Void c) {
        JsonObject obj = header(node);
        obj.add("type", child(node.getExceptionType()));
        addNullable(obj, "name", node.getName());
        obj.add("body", children(node.getBody()));
        return obj;
    }

    @Override
    public JsonObject visitWithStmt(WithStmt node, Void c) {
        JsonObject obj = header(node);
        obj.add("items", children(node.getItems()));
        obj.add("body", children(node.getBody()));
        return obj;
    }

    @Override
    public JsonObject visitWithItem(WithItem node, Void c) {
        JsonObject obj = header(node);
        obj.add("context_expr", child(node.getContextExpr()));
        obj.add("optional_vars", child(node.getTarget()));
        return obj;
    }

    // ============ 表达式 ============

    @Override
    public JsonObject visitLiteral(Literal node, Void c) {
        JsonObject obj = header(node);
        Object value = node.getValue();
        switch (node.getLiteralKind()) {
            case NONE:
                obj.add("value", JsonNull.INSTANCE);
                break;
            case ELLIPSIS:
                obj.addProperty("value", "...");
                break;
            case BOOLEAN:
                obj.addProperty("value", (Boolean) value);
                break;
            case INT:
            case FLOAT:
                if (value instanceof Number) {
                    obj.addProperty("value", (Number) value);
                } else {
                    obj.addProperty("value", String.valueOf(value));
                }
                break;
            case COMPLEX:
            case BYTES:
                obj.addProperty("value", node.getSourceText());
                break;
            case STRING:
            default:
                obj.addProperty("value", String.valueOf(value));
                break;
        }
        obj.addProperty("kind", node.getLiteralKind().name().toLowerCase());
        return obj;
    }

    @Override
    public JsonObject visitFormattedString(FormattedString node, Void c) {
        JsonObject obj = header(node);
        obj.addProperty("raw", node.getRawText());
        obj.add("values", children(node.getValues()));
        return obj;
    }

    @Override
    public JsonObject visitIdentifier(Identifier node, Void c) {
        JsonObject obj = header(node);
        obj.addProperty("name", node.getName());
        obj.add("ctx", ctx(node.getContext()));
        return obj;
    }

    @Override
    public JsonObject visitCollectionLiteral(CollectionLiteral node, Void c) {
        JsonObject obj = header(node);
        obj.add("elts", children(node.getElements()));
        if (node.getCollectionKind() != CollectionLiteral.CollectionKind.SET) {
            obj.add("ctx", ctx(node.getContext()));
        }
        return obj;
    }

    @Override
    public JsonObject visitDictLiteral(DictLiteral node, Void c) {
        JsonObject obj = header(node);
        obj.add("keys", children(node.getKeys()));
        obj.add("values", children(node.getValues()));
        return obj;
    }

    @Override
    public JsonObject visitCallExpr(CallExpr node, Void c) {
        JsonObject obj = header(node);
        obj.add("func", child(node.getCallee()));
        obj.add("args", children(node.getArgs()));
        obj.add("keywords", children(node.getKeywords()));
        return obj;
    }

    @Override
    public JsonObject visitKeywordArgument(KeywordArgument node, Void c) {
        JsonObject obj = header(node);
        addNullable(obj, "arg", node.isDoubleStar() ? null : node.getName());
        obj.add("value", child(node.getValue()));
        return obj;
    }

    @Override
    public JsonObject visitBinaryExpr(BinaryExpr node, Void c) {
        JsonObject obj = header(node);
        obj.add("left", child(node.getLeft()));
        obj.addProperty("op", node.getOperator().getDisplayName());
        obj.add("right", child(node.getRight()));
        return obj;
    }

    @Override
    public JsonObject visitUnaryExpr(UnaryExpr node, Void c) {
        JsonObject obj = header(node);
        obj.addProperty("op", node.getOperator().getDisplayName());
        obj.add("operand", child(node.getOperand()));
        return obj;
    }

    @Override
    public JsonObject visitCompareExpr(CompareExpr node, Void c) {
        JsonObject obj = header(node);
        obj.add("left", child(node.getLeft()));
        JsonArray ops = new JsonArray();
        for (CompareExpr.CompareOp op : node.getOperators()) {
            ops.add(op.getDisplayName());
        }
        obj.add("ops", ops);
        obj.add("comparators", children(node.getComparators()));
        return obj;
    }

    @Override
    public JsonObject visitBoolOpExpr(BoolOpExpr node, Void c) {
        JsonObject obj = header(node);
        obj.addProperty("op", node.getOperator().getDisplayName());
        obj.add("values", children(node.getValues()));
        return obj;
    }

    @Override
    public JsonObject visitComprehensionExpr(ComprehensionExpr node, Void c) {
        JsonObject obj = header(node);
        if (node.getComprehensionKind() == ComprehensionExpr.ComprehensionKind.DICT) {
            obj.add("key", child(node.getElement()));
            obj.add("value", child(node.getValue()));
        } else {
            obj.add("elt", child(node.getElement()));
        }
        obj.add("generators", children(node.getClauses()));
        return obj;
    }

    @Override
    public JsonObject visitComprehensionClause(ComprehensionClause node, Void c) {
        JsonObject obj = header(node);
        obj.add("target", child(node.getTarget()));
        obj.add("iter", child(node.getIterable()));
        obj.add("ifs", children(node.getConditions()));
        obj.addProperty("is_async", node.isAsync() ? 1 : 0);
        return obj;
    }

    @Override
    public JsonObject visitConditionalExpr(ConditionalExpr node, Void c) {
        JsonObject obj = header(node);
        obj.add("test", child(node.getCondition()));
        obj.add("body", child(node.getThenExpr()));
        obj.add("orelse", child(node.getElseExpr()));
        return obj;
    }

    @Override
    public JsonObject visitLambdaExpr(LambdaExpr node, Void c) {
        JsonObject obj = header(node);
        obj.add("args", children(node.getParams()));
        obj.add("body", child(node.getBody()));
        return obj;
    }

    @Override
    public JsonObject visitMemberExpr(MemberExpr node, Void c) {
        JsonObject obj = header(node);
        obj.add("value", child(node.getTarget()));
        obj.addProperty("attr", node.getMember());
        obj.add("ctx", ctx(node.getContext()));
        return obj;
    }

    @Override
    public JsonObject visitIndexExpr(IndexExpr node, Void c) {
        JsonObject obj = header(node);
        obj.add("value", child(node.getTarget()));
        obj.add("slice", child(node.getIndex()));
        obj.add("ctx", ctx(node.getContext()));
        return obj;
    }

    @Override
    public JsonObject visitSliceExpr(SliceExpr node, Void c) {
        JsonObject obj = header(node);
        obj.add("lower", child(node.getLower()));
        obj.add("upper", child(node.getUpper()));
        obj.add("step", child(node.getStep()));
        return obj;
    }

    @Override
    public JsonObject visitStarredExpr(StarredExpr node, Void c) {
        JsonObject obj = header(node);
        obj.add("value", child(node.getValue()));
        obj.add("ctx", ctx(node.getContext()));
        return obj;
    }

    @Override
    public JsonObject visitNamedExpr(NamedExpr node, Void c) {
        JsonObject obj = header(node);
        obj.add("target", child(node.getTarget()));
        obj.add("value", child(node.getValue()));
        return obj;
    }

    @Override
    public JsonObject visitAwaitExpr(AwaitExpr node, Void c) {
        JsonObject obj = header(node);
        obj.add("value", child(node.getValue()));
        return obj;
    }

    @Override
    public JsonObject visitYieldExpr(YieldExpr node, Void c) {
        JsonObject obj = header(node);
        obj.add("value", child(node.getValue()));
        return obj;
    }
}
