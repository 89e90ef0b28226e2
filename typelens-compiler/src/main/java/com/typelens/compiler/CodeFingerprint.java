package com.typelens.compiler;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 源码指纹：内容哈希与代码模式提取
 */
public final class CodeFingerprint {

    private static final Pattern ASSIGNMENT = Pattern.compile("(\\w+)\\s*=\\s*([^=\\n]+)");
    private static final Pattern CALL = Pattern.compile("(\\w+)\\s*\\([^)]*\\)");

    private CodeFingerprint() {}

    /** 源码文本的 MD5（小写十六进制） */
    public static String hash(String source) {
        try {
            MessageDigest md = MessageDigest.getInstance("MD5");
            byte[] digest = md.digest(source.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(digest.length * 2);
            for (byte b : digest) {
                sb.append(Character.forDigit((b >> 4) & 0xF, 16));
                sb.append(Character.forDigit(b & 0xF, 16));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            // 每个 JRE 都必须提供 MD5
            throw new IllegalStateException("MD5 digest unavailable", e);
        }
    }

    /**
     * 提取代码模式：assignment_{变量}_{值}、function_call_{名称}、control_flow_{if|for|while}。
     * 结果按首次出现顺序去重。
     */
    public static List<String> extractPatterns(String source) {
        Set<String> patterns = new LinkedHashSet<String>();
        Matcher m = ASSIGNMENT.matcher(source);
        while (m.find()) {
            patterns.add("assignment_" + m.group(1) + "_" + m.group(2).trim());
        }
        m = CALL.matcher(source);
        while (m.find()) {
            patterns.add("function_call_" + m.group(1));
        }
        if (source.contains("if ")) patterns.add("control_flow_if");
        if (source.contains("for ")) patterns.add("control_flow_for");
        if (source.contains("while ")) patterns.add("control_flow_while");
        return new ArrayList<String>(patterns);
    }
}
