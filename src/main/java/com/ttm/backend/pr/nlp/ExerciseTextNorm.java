package com.ttm.backend.pr.nlp;

import java.text.Normalizer;
import java.text.Normalizer.Form;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 動作名稱前處理（Normalizer 第 1 步）：
 * 1) NFKC
 * 2) 拉丁字母去重音（pulldówn → pulldown）
 * 3) toLowerCase
 * 4) 刪除句點/逗號（d.b. → db），刪除括號註解
 * 5) 連字號 → 空白，壓縮空白
 */
public final class ExerciseTextNorm {
    private ExerciseTextNorm() {}

    private static final Pattern P_PAREN = Pattern.compile("\\([^)]*\\)");
    private static final Pattern P_DOTS_COMMAS = Pattern.compile("[.,]");
    private static final Pattern P_HYPHENS = Pattern.compile("[-‐‑‒–—]");
    private static final Pattern P_SPACES = Pattern.compile("\\s+");

    public static String clean(String s) {
        if (s == null || s.isEmpty()) return "";
        String nfkc = Normalizer.normalize(s, Form.NFKC);

        // 僅在前一個基底字元為拉丁字母時丟棄結合符號
        String decomposed = Normalizer.normalize(nfkc, Form.NFD);
        StringBuilder sb = new StringBuilder(decomposed.length());
        boolean prevBaseIsLatin = false;
        for (int i = 0; i < decomposed.length(); ) {
            final int cp = decomposed.codePointAt(i);
            final int type = Character.getType(cp);
            if (type == Character.NON_SPACING_MARK
                    || type == Character.COMBINING_SPACING_MARK
                    || type == Character.ENCLOSING_MARK) {
                if (!prevBaseIsLatin) sb.appendCodePoint(cp);
            } else {
                sb.appendCodePoint(cp);
                prevBaseIsLatin = isLatin(cp);
            }
            i += Character.charCount(cp);
        }

        String t = Normalizer.normalize(sb.toString(), Form.NFC).toLowerCase(Locale.ROOT);
        t = collapse(t);
        t = P_DOTS_COMMAS.matcher(t).replaceAll("");
        t = P_PAREN.matcher(t).replaceAll("");
        t = P_HYPHENS.matcher(t).replaceAll(" ");
        return collapse(t);
    }

    /** 教練註解行：NFKC 後以 * 開頭（全形 ＊ 也算） */
    public static boolean isComment(String s) {
        if (s == null) return false;
        return Normalizer.normalize(s, Form.NFKC).strip().startsWith(ExerciseNormalizer.COMMENT_PREFIX);
    }

    /** 壓縮連續空白並去頭尾 */
    public static String collapse(String s) {
        if (s == null) return "";
        return P_SPACES.matcher(s).replaceAll(" ").trim();
    }

    private static boolean isLatin(int codePoint) {
        Character.UnicodeBlock b = Character.UnicodeBlock.of(codePoint);
        return b == Character.UnicodeBlock.BASIC_LATIN
                || b == Character.UnicodeBlock.LATIN_1_SUPPLEMENT
                || b == Character.UnicodeBlock.LATIN_EXTENDED_A
                || b == Character.UnicodeBlock.LATIN_EXTENDED_B
                || b == Character.UnicodeBlock.LATIN_EXTENDED_ADDITIONAL;
    }
}
