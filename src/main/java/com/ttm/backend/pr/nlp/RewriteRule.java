package com.ttm.backend.pr.nlp;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 單一改寫規則：(name, pattern, replacement, guard)。
 * - pattern 對整個字串 replaceAll；replacement 可用 $1 等群組參照
 * - guard 為 null 表示無條件套用；guard 可讀取 weight（深蹲依重量判斷）
 */
public record RewriteRule(String name, Pattern pattern, String replacement, Guard guard) {

    @FunctionalInterface
    public interface Guard {
        boolean test(String text, Double weight);
    }

    public RewriteRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(replacement, "replacement");
    }

    public static RewriteRule of(String name, String regex, String replacement) {
        return new RewriteRule(name, Pattern.compile(regex), replacement, null);
    }

    /** 回傳帶條件的新規則（record 不可變） */
    public RewriteRule when(Guard g) {
        return new RewriteRule(name, pattern, replacement, g);
    }

    public String apply(String text, Double weight) {
        if (text == null || text.isEmpty()) return "";
        if (guard != null && !guard.test(text, weight)) return text;
        return pattern.matcher(text).replaceAll(replacement);
    }
}
