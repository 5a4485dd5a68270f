package com.qiyi.domprune.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 空白规整与按 token 截断的文本工具。
 * 空白按 Unicode White_Space 判定，nbsp 也算空白。
 */
public final class TextUtil {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private TextUtil() {
    }

    /**
     * 连续空白折叠为一个空格并去掉首尾空白；null 视为空串。
     */
    public static String cleanText(String text) {
        if (text == null) return "";
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    public static List<String> tokens(String text) {
        String cleaned = cleanText(text);
        if (cleaned.isEmpty()) return Collections.emptyList();
        List<String> out = new ArrayList<>();
        for (String t : cleaned.split(" ")) {
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    /**
     * 取前 limit 个 token，用单个空格拼接。
     */
    public static String firstTokens(String text, int limit) {
        List<String> tokens = tokens(text);
        if (tokens.size() > limit) {
            tokens = tokens.subList(0, Math.max(0, limit));
        }
        return String.join(" ", tokens);
    }
}
