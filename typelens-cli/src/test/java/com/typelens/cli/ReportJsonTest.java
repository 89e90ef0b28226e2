package com.typelens.cli;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.typelens.compiler.AnalysisReport;
import com.typelens.compiler.AnnotationReport;
import com.typelens.compiler.CodeAnalyzer;
import com.typelens.compiler.parser.TreeBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * 报告与语法树 JSON 结构测试
 */
@DisplayName("ReportJson 测试")
class ReportJsonTest {

    private static final String PROGRAM =
            "import os\n" +
            "from typing import List as L\n" +
            "\n" +
            "class Box:\n" +
            "    def __init__(self, size):\n" +
            "        self.size = size\n" +
            "\n" +
            "def area(w, h=2):\n" +
            "    return w * h\n" +
            "\n" +
            "box = Box(3)\n";

    private final CodeAnalyzer analyzer = new CodeAnalyzer();

    @Nested
    @DisplayName("分析报告")
    class AnalysisTests {

        @Test
        @DisplayName("顶层字段")
        void topLevelKeys() {
            JsonObject json = ReportJson.analysis(analyzer.analyze(PROGRAM));
            assertThat(json.keySet()).containsExactly(
                    "success", "ast", "symbol_table", "undeclared_variables", "error", "code_hash", "code_patterns");
            assertThat(json.get("success").getAsBoolean()).isTrue();
            assertThat(json.getAsJsonArray("code_patterns").toString())
                    .contains("\"assignment_box_Box(3)\"", "\"function_call_Box\"");
        }

        @Test
        @DisplayName("符号表")
        void symbolTable() {
            JsonObject table = ReportJson.analysis(analyzer.analyze(PROGRAM)).getAsJsonObject("symbol_table");

            JsonObject global = table.getAsJsonObject("global_scope");
            assertThat(global.getAsJsonObject("os").get("type").getAsString()).isEqualTo("import");
            assertThat(global.getAsJsonObject("Box").get("type").getAsString()).isEqualTo("class");
            assertThat(global.getAsJsonObject("area").get("type").getAsString()).isEqualTo("function");
            assertThat(global.getAsJsonObject("box").get("lineno").getAsInt()).isEqualTo(11);

            JsonObject area = table.getAsJsonObject("functions").getAsJsonObject("area");
            assertThat(area.getAsJsonArray("args")).hasSize(2);
            assertThat(area.getAsJsonArray("args").get(1).getAsString()).isEqualTo("h");
            assertThat(area.get("is_async").getAsBoolean()).isFalse();
            assertThat(area.get("owner_class").isJsonNull()).isTrue();

            JsonObject init = table.getAsJsonObject("functions").getAsJsonObject("__init__");
            assertThat(init.get("owner_class").getAsString()).isEqualTo("Box");

            JsonArray methods = table.getAsJsonObject("classes").getAsJsonObject("Box").getAsJsonArray("methods");
            assertThat(methods).hasSize(1);
            assertThat(methods.get(0).getAsString()).isEqualTo("__init__");

            assertThat(table.getAsJsonObject("variables").getAsJsonObject("box")
                    .get("inferred_type").getAsString()).isEqualTo("Box");
            assertThat(table.get("scopes_count").getAsInt()).isEqualTo(4);
        }

        @Test
        @DisplayName("导入")
        void imports() {
            JsonObject imports = ReportJson.analysis(analyzer.analyze(PROGRAM))
                    .getAsJsonObject("symbol_table").getAsJsonObject("imports");

            JsonObject os = imports.getAsJsonObject("os");
            assertThat(os.get("module").getAsString()).isEqualTo("os");
            assertThat(os.get("asname").isJsonNull()).isTrue();
            assertThat(os.get("type").getAsString()).isEqualTo("import");

            JsonObject list = imports.getAsJsonObject("L");
            assertThat(list.get("module").getAsString()).isEqualTo("typing");
            assertThat(list.get("name").getAsString()).isEqualTo("List");
            assertThat(list.get("asname").getAsString()).isEqualTo("L");
            assertThat(list.get("type").getAsString()).isEqualTo("from_import");
            assertThat(list.get("level").getAsInt()).isZero();
        }

        @Test
        @DisplayName("失败报告")
        void failure() {
            AnalysisReport report = analyzer.analyze("x = = 1\n");
            JsonObject json = ReportJson.analysis(report);
            assertThat(json.get("success").getAsBoolean()).isFalse();
            assertThat(json.get("ast").isJsonNull()).isTrue();
            assertThat(json.get("symbol_table").isJsonNull()).isTrue();
            assertThat(json.get("error").getAsString()).startsWith("Syntax error: ");
        }
    }

    @Nested
    @DisplayName("注解报告")
    class AnnotationTests {

        @Test
        @DisplayName("类型信息")
        void typeInfo() {
            AnnotationReport report = analyzer.annotate(PROGRAM);
            JsonObject json = ReportJson.annotation(report);
            assertThat(json.keySet()).containsExactly("success", "original_code", "annotated_code",
                    "type_info", "annotations_count", "error", "code_hash");
            assertThat(json.get("annotations_count").getAsInt()).isEqualTo(report.getAnnotationCount());

            JsonObject area = json.getAsJsonObject("type_info").getAsJsonObject("functions").getAsJsonObject("area");
            assertThat(area.getAsJsonObject("params").get("h").getAsString()).isEqualTo("int");
            assertThat(area.get("line").getAsInt()).isEqualTo(8);

            JsonObject init = json.getAsJsonObject("type_info").getAsJsonObject("functions").getAsJsonObject("__init__");
            assertThat(init.getAsJsonObject("params").has("self")).isFalse();
            assertThat(init.get("return").getAsString()).isEqualTo("None");
        }
    }

    @Nested
    @DisplayName("语法树")
    class AstTests {

        @Test
        @DisplayName("节点头部与名称")
        void nameAndConstant() {
            JsonObject module = AstJsonWriter.toJson(new TreeBuilder().build("x = 1\ny = None\n"));
            assertThat(module.get("node_type").getAsString()).isEqualTo("Module");

            JsonObject assign = module.getAsJsonArray("body").get(0).getAsJsonObject();
            assertThat(assign.get("id").getAsString()).isEqualTo("node_1");
            assertThat(assign.get("lineno").getAsInt()).isEqualTo(1);

            JsonObject target = assign.getAsJsonArray("targets").get(0).getAsJsonObject();
            assertThat(target.get("node_type").getAsString()).isEqualTo("Name");
            assertThat(target.get("name").getAsString()).isEqualTo("x");
            assertThat(target.get("ctx").getAsString()).isEqualTo("Store");
            assertThat(target.get("col_offset").getAsInt()).isZero();

            JsonObject value = assign.getAsJsonObject("value");
            assertThat(value.get("node_type").getAsString()).isEqualTo("Constant");
            assertThat(value.get("value").getAsInt()).isEqualTo(1);
            assertThat(value.get("kind").getAsString()).isEqualTo("int");

            JsonObject none = module.getAsJsonArray("body").get(1).getAsJsonObject().getAsJsonObject("value");
            assertThat(none.get("value").isJsonNull()).isTrue();
            assertThat(none.get("kind").getAsString()).isEqualTo("none");
        }

        @Test
        @DisplayName("函数定义")
        void functionDef() {
            JsonObject module = AstJsonWriter.toJson(new TreeBuilder().build("def f(a, *rest):\n    pass\n"));
            JsonObject def = module.getAsJsonArray("body").get(0).getAsJsonObject();
            assertThat(def.get("node_type").getAsString()).isEqualTo("FunctionDef");
            assertThat(def.get("name").getAsString()).isEqualTo("f");
            JsonArray args = def.getAsJsonArray("args");
            assertThat(args).hasSize(2);
            assertThat(args.get(1).getAsJsonObject().get("arg").getAsString()).isEqualTo("rest");
            assertThat(args.get(1).getAsJsonObject().get("kind").getAsString()).isEqualTo("var_positional");
            assertThat(def.get("returns").isJsonNull()).isTrue();
        }
    }
}
