package com.typelens.cli;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.typelens.compiler.annotate.TypeSuggestions;

import java.util.Map;

/**
 * 读取外部类型建议 JSON：
 * {@code {"inferences": {name: type}, "function_suggestions": {name: {"params": {p: type}, "return": type}}}}
 *
 * <p>非字符串的条目被忽略；顶层不是对象时抛出 {@link JsonParseException}。</p>
 */
public final class SuggestionsReader {

    private SuggestionsReader() {}

    public static TypeSuggestions read(String json) {
        JsonElement root = JsonParser.parseString(json);
        if (!root.isJsonObject()) {
            throw new JsonParseException("suggestions must be a JSON object");
        }
        JsonObject obj = root.getAsJsonObject();
        TypeSuggestions.Builder builder = TypeSuggestions.builder();

        JsonObject inferences = object(obj, "inferences");
        if (inferences != null) {
            for (Map.Entry<String, JsonElement> e : inferences.entrySet()) {
                builder.inference(e.getKey(), string(e.getValue()));
            }
        }

        JsonObject functions = object(obj, "function_suggestions");
        if (functions != null) {
            for (Map.Entry<String, JsonElement> e : functions.entrySet()) {
                if (!e.getValue().isJsonObject()) continue;
                JsonObject fn = e.getValue().getAsJsonObject();
                JsonObject params = object(fn, "params");
                if (params != null) {
                    for (Map.Entry<String, JsonElement> p : params.entrySet()) {
                        builder.param(e.getKey(), p.getKey(), string(p.getValue()));
                    }
                }
                builder.returnType(e.getKey(), string(fn.get("return")));
            }
        }
        return builder.build();
    }

    private static JsonObject object(JsonObject parent, String key) {
        JsonElement e = parent.get(key);
        return e != null && e.isJsonObject() ? e.getAsJsonObject() : null;
    }

    private static String string(JsonElement e) {
        if (e == null || !e.isJsonPrimitive() || !e.getAsJsonPrimitive().isString()) return null;
        return e.getAsString();
    }
}
