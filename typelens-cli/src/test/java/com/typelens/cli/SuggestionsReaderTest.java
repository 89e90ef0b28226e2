package com.typelens.cli;

import com.google.gson.JsonParseException;
import com.typelens.compiler.annotate.TypeSuggestions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SuggestionsReader 测试")
class SuggestionsReaderTest {

    @Test
    @DisplayName("读取变量与函数建议")
    void readsAllSections() {
        TypeSuggestions s = SuggestionsReader.read(
                "{\"inferences\": {\"payload\": \"dict\"}," +
                " \"function_suggestions\": {\"fetch\": {\"params\": {\"url\": \"str\"}, \"return\": \"bytes\"}}}");

        assertThat(s.getInference("payload")).isEqualTo("dict");
        assertThat(s.getParamSuggestion("fetch", "url")).isEqualTo("str");
        assertThat(s.getReturnSuggestion("fetch")).isEqualTo("bytes");
        assertThat(s.getInference("missing")).isNull();
    }

    @Test
    @DisplayName("忽略非字符串条目")
    void ignoresNonStrings() {
        TypeSuggestions s = SuggestionsReader.read(
                "{\"inferences\": {\"a\": 1, \"b\": null, \"c\": \"  \"}," +
                " \"function_suggestions\": {\"f\": \"str\", \"g\": {\"return\": [\"int\"]}}}");

        assertThat(s.getInferences()).isEmpty();
        assertThat(s.getReturnSuggestion("f")).isNull();
        assertThat(s.getReturnSuggestion("g")).isNull();
    }

    @Test
    @DisplayName("空对象")
    void emptyObject() {
        assertThat(SuggestionsReader.read("{}").isEmpty()).isTrue();
    }

    @Test
    @DisplayName("顶层不是对象")
    void rejectsNonObject() {
        assertThatThrownBy(() -> SuggestionsReader.read("[\"int\"]"))
                .isInstanceOf(JsonParseException.class)
                .hasMessageContaining("JSON object");
    }

    @Test
    @DisplayName("无效 JSON")
    void rejectsMalformed() {
        assertThatThrownBy(() -> SuggestionsReader.read("{\"inferences\": "))
                .isInstanceOf(JsonParseException.class);
    }
}
