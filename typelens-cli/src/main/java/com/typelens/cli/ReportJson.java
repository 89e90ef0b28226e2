package com.typelens.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.typelens.compiler.AnalysisReport;
import com.typelens.compiler.AnnotationReport;
import com.typelens.compiler.analysis.*;
import com.typelens.compiler.analysis.types.PyType;
import com.typelens.compiler.annotate.TypeInfo;

import java.util.List;
import java.util.Map;

/**
 * 报告 → JSON（字段名沿用下划线风格）
 */
public final class ReportJson {

    private ReportJson() {}

    public static Gson gson(boolean pretty) {
        GsonBuilder builder = new GsonBuilder().serializeNulls().disableHtmlEscaping();
        if (pretty) builder.setPrettyPrinting();
        return builder.create();
    }

    // ============ 报告 ============

    public static JsonObject analysis(AnalysisReport report) {
        JsonObject obj = new JsonObject();
        obj.addProperty("success", report.isSuccess());
        obj.add("ast", report.getTree() != null ? AstJsonWriter.toJson(report.getTree()) : JsonNull.INSTANCE);
        obj.add("symbol_table", report.getSymbolTable() != null ? symbolTable(report.getSymbolTable()) : JsonNull.INSTANCE);
        obj.add("undeclared_variables", undeclared(report.getUndeclaredReferences()));
        addNullable(obj, "error", report.getError());
        addNullable(obj, "code_hash", report.getCodeHash());
        obj.add("code_patterns", strings(report.getCodePatterns()));
        return obj;
    }

    public static JsonObject annotation(AnnotationReport report) {
        JsonObject obj = new JsonObject();
        obj.addProperty("success", report.isSuccess());
        obj.addProperty("original_code", report.getOriginalCode());
        obj.addProperty("annotated_code", report.getAnnotatedCode());
        obj.add("type_info", report.getTypeInfo() != null ? typeInfo(report.getTypeInfo()) : JsonNull.INSTANCE);
        obj.addProperty("annotations_count", report.getAnnotationCount());
        addNullable(obj, "error", report.getError());
        addNullable(obj, "code_hash", report.getCodeHash());
        return obj;
    }

    // ============ 符号表 ============

    public static JsonObject symbolTable(SymbolTable table) {
        JsonObject obj = new JsonObject();

        JsonObject global = new JsonObject();
        for (ScopeEntry entry : table.getGlobalScope().getEntries().values()) {
            JsonObject e = new JsonObject();
            e.addProperty("type", entry.getKind().getDisplayName());
            e.addProperty("lineno", entry.getLine());
            global.add(entry.getName(), e);
        }
        obj.add("global_scope", global);

        JsonObject functions = new JsonObject();
        for (FunctionSymbol fn : table.getFunctions().values()) {
            functions.add(fn.getName(), function(fn));
        }
        obj.add("functions", functions);

        JsonObject classes = new JsonObject();
        for (ClassSymbol cls : table.getClasses().values()) {
            classes.add(cls.getName(), classSymbol(cls));
        }
        obj.add("classes", classes);

        JsonObject variables = new JsonObject();
        for (VariableSymbol v : table.getVariables().values()) {
            JsonObject e = new JsonObject();
            e.addProperty("name", v.getName());
            e.addProperty("lineno", v.getLine());
            addNullable(e, "annotation", v.getAnnotation());
            addNullable(e, "inferred_type", display(v.getInferredType()));
            e.addProperty("scope", v.getScopeDepth());
            variables.add(v.getName(), e);
        }
        obj.add("variables", variables);

        JsonObject imports = new JsonObject();
        for (ImportSymbol imp : table.getImports().values()) {
            JsonObject e = new JsonObject();
            addNullable(e, "module", imp.getModule());
            addNullable(e, "name", imp.getOriginalName());
            addNullable(e, "asname", imp.getAlias());
            e.addProperty("lineno", imp.getLine());
            e.addProperty("type", imp.getImportKind().getDisplayName());
            e.addProperty("level", imp.getLevel());
            imports.add(imp.getName(), e);
        }
        obj.add("imports", imports);

        obj.addProperty("scopes_count", table.getScopeCount());
        return obj;
    }

    private static JsonObject function(FunctionSymbol fn) {
        JsonObject e = new JsonObject();
        e.addProperty("name", fn.getName());
        e.addProperty("lineno", fn.getLine());
        e.add("args", strings(fn.getParameterNames()));
        JsonObject annotations = new JsonObject();
        for (FunctionSymbol.ParameterInfo p : fn.getParameters()) {
            if (p.getAnnotation() != null) annotations.addProperty(p.getName(), p.getAnnotation());
        }
        e.add("arg_annotations", annotations);
        String inferred = display(fn.getInferredReturnType());
        addNullable(e, "returns", fn.getReturnAnnotation() != null ? fn.getReturnAnnotation() : inferred);
        e.add("decorators", strings(fn.getDecorators()));
        e.addProperty("scope", fn.getScopeDepth());
        addNullable(e, "inferred_return_type", inferred);
        e.addProperty("is_async", fn.isAsync());
        e.addProperty("is_generator", fn.isGenerator());
        addNullable(e, "owner_class", fn.getOwnerClass());
        return e;
    }

    private static JsonObject classSymbol(ClassSymbol cls) {
        JsonObject e = new JsonObject();
        e.addProperty("name", cls.getName());
        e.addProperty("lineno", cls.getLine());
        e.add("bases", strings(cls.getBases()));
        e.add("decorators", strings(cls.getDecorators()));
        e.add("methods", strings(cls.getMethods()));
        JsonObject attributes = new JsonObject();
        for (Map.Entry<String, PyType> attr : cls.getAttributes().entrySet()) {
            attributes.addProperty(attr.getKey(), display(attr.getValue()));
        }
        e.add("attributes", attributes);
        return e;
    }

    public static JsonArray undeclared(List<UndeclaredReference> references) {
        JsonArray array = new JsonArray();
        for (UndeclaredReference ref : references) {
            JsonObject e = new JsonObject();
            e.addProperty("name", ref.getName());
            e.addProperty("lineno", ref.getLine());
            e.addProperty("col_offset", ref.getColumn());
            e.addProperty("context", ref.getContext());
            addNullable(e, "function", ref.getFunction());
            array.add(e);
        }
        return array;
    }

    // ============ 类型信息 ============

    public static JsonObject typeInfo(TypeInfo info) {
        JsonObject obj = new JsonObject();
        JsonObject variables = new JsonObject();
        for (Map.Entry<String, TypeInfo.VariableType> e : info.getVariables().entrySet()) {
            JsonObject v = new JsonObject();
            v.addProperty("type", e.getValue().getType());
            v.addProperty("line", e.getValue().getLine());
            v.addProperty("source", e.getValue().getSource().getDisplayName());
            variables.add(e.getKey(), v);
        }
        obj.add("variables", variables);

        JsonObject functions = new JsonObject();
        for (Map.Entry<String, TypeInfo.FunctionType> e : info.getFunctions().entrySet()) {
            JsonObject f = new JsonObject();
            JsonObject params = new JsonObject();
            for (Map.Entry<String, String> p : e.getValue().getParams().entrySet()) {
                params.addProperty(p.getKey(), p.getValue());
            }
            f.add("params", params);
            f.addProperty("return", e.getValue().getReturnType());
            f.addProperty("line", e.getValue().getLine());
            functions.add(e.getKey(), f);
        }
        obj.add("functions", functions);
        return obj;
    }

    // ============ 辅助 ============

    private static String display(PyType type) {
        return type == null ? null : type.toDisplayString();
    }

    private static JsonArray strings(List<String> values) {
        JsonArray array = new JsonArray();
        for (String v : values) {
            array.add(v);
        }
        return array;
    }

    private static void addNullable(JsonObject obj, String key, String value) {
        if (value == null) obj.add(key, JsonNull.INSTANCE);
        else obj.addProperty(key, value);
    }
}
