package com.typelens.compiler.annotate;

import com.typelens.compiler.analysis.BuiltinRegistry;
import com.typelens.compiler.analysis.FunctionSymbol;
import com.typelens.compiler.analysis.SymbolTable;
import com.typelens.compiler.analysis.TypeUnifier;
import com.typelens.compiler.analysis.VariableSymbol;
import com.typelens.compiler.analysis.types.DeferredPyType;
import com.typelens.compiler.analysis.types.PyType;
import com.typelens.compiler.analysis.types.PyTypes;
import com.typelens.compiler.ast.decl.Parameter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 注解合成器：为每个函数和变量选定类型，并逐行改写源码。
 *
 * <p>只改写单行声明：没有 {@code ->}、参数列表内没有 {@code :} 的 def 行，
 * 以及由单目标语句绑定、形如 {@code name = ...} 且不含 {@code ;} 的变量行。
 * 已有注解的行保持不变，因此对输出再次执行结果相同。</p>
 */
public final class AnnotationSynthesizer {

    public AnnotationOutcome annotate(String source, SymbolTable table, TypeSuggestions suggestions) {
        TypeSuggestions s = suggestions != null ? suggestions : TypeSuggestions.EMPTY;
        TypeInfo info = collect(table, s);
        return new AnnotationOutcome(rewrite(source, table, info), info);
    }

    // ============ 类型收集 ============

    /** 为每个变量和函数选定类型 */
    public TypeInfo collect(SymbolTable table, TypeSuggestions suggestions) {
        Map<String, TypeInfo.VariableType> variables = new LinkedHashMap<String, TypeInfo.VariableType>();
        for (VariableSymbol v : table.getVariables().values()) {
            variables.put(v.getName(), variableType(v, suggestions));
        }
        Map<String, TypeInfo.FunctionType> functions = new LinkedHashMap<String, TypeInfo.FunctionType>();
        for (FunctionSymbol fn : table.getFunctions().values()) {
            functions.put(fn.getName(), functionType(fn, suggestions));
        }
        return new TypeInfo(variables, functions);
    }

    /** 注解 > 推断（确定类型）> 建议 > Any */
    private static TypeInfo.VariableType variableType(VariableSymbol v, TypeSuggestions suggestions) {
        if (v.hasAnnotation()) {
            return new TypeInfo.VariableType(TypeNormalizer.normalize(v.getAnnotation()), v.getLine(),
                    TypeInfo.Source.ANNOTATION);
        }
        if (isUsable(v.getInferredType())) {
            return new TypeInfo.VariableType(TypeNormalizer.normalize(v.getInferredType()), v.getLine(),
                    TypeInfo.Source.INFERRED);
        }
        String suggested = suggestions.getInference(v.getName());
        if (suggested != null) {
            return new TypeInfo.VariableType(TypeNormalizer.normalize(suggested), v.getLine(),
                    TypeInfo.Source.SUGGESTION);
        }
        return new TypeInfo.VariableType(TypeNormalizer.ANY, v.getLine(), TypeInfo.Source.FALLBACK);
    }

    private static TypeInfo.FunctionType functionType(FunctionSymbol fn, TypeSuggestions suggestions) {
        Map<String, String> params = new LinkedHashMap<String, String>();
        List<FunctionSymbol.ParameterInfo> infos = fn.getParameters();
        for (int i = 0; i < infos.size(); i++) {
            FunctionSymbol.ParameterInfo p = infos.get(i);
            if (i == 0 && isReceiver(fn, p)) continue;
            params.put(p.getName(), parameterType(fn, p, suggestions));
        }
        return new TypeInfo.FunctionType(params, returnType(fn, suggestions), fn.getLine());
    }

    private static boolean isReceiver(FunctionSymbol fn, FunctionSymbol.ParameterInfo first) {
        return fn.isMethod() && !fn.isStaticMethod() && !isVariadic(first.getKind());
    }

    private static boolean isVariadic(Parameter.ParamKind kind) {
        return kind == Parameter.ParamKind.VAR_POSITIONAL || kind == Parameter.ParamKind.VAR_KEYWORD;
    }

    /**
     * 注解 > 默认值类型 > 命名启发式 > 建议 > Any。
     * 默认值为 None 时按其余规则取类型 T 并写作 {@code T | None}。
     */
    private static String parameterType(FunctionSymbol fn, FunctionSymbol.ParameterInfo p, TypeSuggestions suggestions) {
        if (p.getAnnotation() != null) {
            return TypeNormalizer.normalize(p.getAnnotation());
        }
        PyType defaultType = p.getDefaultType();
        boolean defaultsToNone = PyTypes.NONE.equals(defaultType);
        if (isUsable(defaultType) && !defaultsToNone) {
            return TypeNormalizer.normalize(defaultType);
        }
        String chosen = null;
        if (!isVariadic(p.getKind())) {
            PyType guess = BuiltinRegistry.guessTypeFromName(p.getName());
            if (guess != null) chosen = guess.toDisplayString();
        }
        if (chosen == null) {
            chosen = suggestions.getParamSuggestion(fn.getName(), p.getName());
        }
        String normalized = TypeNormalizer.normalize(chosen);
        if (defaultsToNone && !TypeNormalizer.ANY.equals(normalized) && !normalized.contains("None")) {
            return normalized + " | None";
        }
        return normalized;
    }

    /** 注解 > 推断 > 建议 > 从不返回值时 None，否则 Any */
    private static String returnType(FunctionSymbol fn, TypeSuggestions suggestions) {
        if (fn.getReturnAnnotation() != null) {
            return TypeNormalizer.normalize(fn.getReturnAnnotation());
        }
        if (isUsable(fn.getInferredReturnType())) {
            return TypeNormalizer.normalize(fn.getInferredReturnType());
        }
        String suggested = suggestions.getReturnSuggestion(fn.getName());
        if (suggested != null) {
            return TypeNormalizer.normalize(suggested);
        }
        return fn.hasValueReturn() || fn.isGenerator() ? TypeNormalizer.ANY : "None";
    }

    /** 确定、且不含延迟占位的类型 */
    private static boolean isUsable(PyType type) {
        return TypeUnifier.isConcrete(type) && !type.toDisplayString().contains(DeferredPyType.PREFIX);
    }

    // ============ 逐行改写 ============

    private static final Pattern DEF_PREFIX = Pattern.compile("^(\\s*(?:async\\s+)?def\\s+)(\\w+)(\\s*\\()");

    String rewrite(String source, SymbolTable table, TypeInfo info) {
        String[] lines = source.split("\n", -1);

        for (FunctionSymbol fn : table.getFunctions().values()) {
            int index = fn.getLine() - 1;
            if (index < 0 || index >= lines.length) continue;
            TypeInfo.FunctionType type = info.getFunction(fn.getName());
            if (type == null) continue;
            String rewritten = annotateFunctionLine(lines[index], fn.getName(), type);
            if (rewritten != null) {
                lines[index] = rewritten;
            }
        }

        for (VariableSymbol v : table.getVariables().values()) {
            int index = v.getLine() - 1;
            if (index < 0 || index >= lines.length || !v.isSimpleTarget() || v.hasAnnotation()) continue;
            TypeInfo.VariableType type = info.getVariable(v.getName());
            if (type == null) continue;
            String rewritten = annotateVariableLine(lines[index], v.getName(), type.getType());
            if (rewritten != null) {
                lines[index] = rewritten;
            }
        }
        return String.join("\n", lines);
    }

    /**
     * 改写 def 行，不满足条件时返回 null
     */
    static String annotateFunctionLine(String line, String name, TypeInfo.FunctionType type) {
        if (line.contains("->")) return null;
        Matcher m = DEF_PREFIX.matcher(line);
        if (!m.find() || !m.group(2).equals(name)) return null;
        int open = m.end();
        int close = matchingParen(line, open);
        if (close < 0) return null;
        String paramsText = line.substring(open, close);
        if (containsTopLevel(paramsText, ':')) return null;

        String after = line.substring(close + 1);
        Matcher tail = Pattern.compile("^\\s*:(.*)$").matcher(after);
        if (!tail.matches()) return null;

        List<String> rendered = new ArrayList<String>();
        for (String raw : splitTopLevel(paramsText)) {
            rendered.add(annotateParameter(raw.trim(), type.getParams()));
        }
        String params = String.join(", ", rendered);
        if (paramsText.trim().isEmpty()) {
            params = "";
        }
        return line.substring(0, open) + params + ") -> " + type.getReturnType() + ":" + tail.group(1);
    }

    private static String annotateParameter(String raw, Map<String, String> params) {
        if (raw.isEmpty() || raw.startsWith("*") || "/".equals(raw)) {
            return raw;
        }
        int eq = indexOfTopLevel(raw, '=');
        if (eq >= 0) {
            String name = raw.substring(0, eq).trim();
            String defaultText = raw.substring(eq + 1).trim();
            String t = params.get(name);
            return t != null ? name + ": " + t + " = " + defaultText : raw;
        }
        String t = params.get(raw);
        return t != null ? raw + ": " + t : raw;
    }

    /**
     * 改写变量赋值行，不满足条件时返回 null
     */
    static String annotateVariableLine(String line, String name, String type) {
        if (line.contains(";") || line.contains(name + ":")) return null;
        Matcher m = Pattern.compile("^(\\s*)(" + Pattern.quote(name) + ")(\\s*=(?!=).*)$").matcher(line);
        if (!m.matches()) return null;
        return m.group(1) + m.group(2) + ": " + type + m.group(3);
    }

    // ============ 括号与引号感知的扫描 ============

    /** openIndex 为 '(' 之后的位置，返回匹配的 ')' 下标 */
    private static int matchingParen(String text, int openIndex) {
        int depth = 0;
        char quote = 0;
        for (int i = openIndex; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') i++;
                else if (c == quote) quote = 0;
                continue;
            }
            if (c == '\'' || c == '"') quote = c;
            else if (c == '(' || c == '[' || c == '{') depth++;
            else if (c == ')' || c == ']' || c == '}') {
                if (depth == 0) return c == ')' ? i : -1;
                depth--;
            } else if (c == '#') {
                return -1;
            }
        }
        return -1;
    }

    private static List<String> splitTopLevel(String text) {
        List<String> parts = new ArrayList<String>();
        int depth = 0;
        char quote = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') i++;
                else if (c == quote) quote = 0;
                continue;
            }
            if (c == '\'' || c == '"') quote = c;
            else if (c == '(' || c == '[' || c == '{') depth++;
            else if (c == ')' || c == ']' || c == '}') depth--;
            else if (c == ',' && depth == 0) {
                parts.add(text.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(text.substring(start));
        return parts;
    }

    private static int indexOfTopLevel(String text, char target) {
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') i++;
                else if (c == quote) quote = 0;
                continue;
            }
            if (c == '\'' || c == '"') quote = c;
            else if (c == '(' || c == '[' || c == '{') depth++;
            else if (c == ')' || c == ']' || c == '}') depth--;
            else if (c == target && depth == 0) return i;
        }
        return -1;
    }

    private static boolean containsTopLevel(String text, char target) {
        return indexOfTopLevel(text, target) >= 0;
    }
}
