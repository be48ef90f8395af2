package com.ttm.backend.pr.nlp;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * 動作名稱正規化：raw → canonical（例：db bench → dumbbell bench press）。
 * - 以 * 開頭（教練註解）→ 回傳空字串，代表「不是動作名稱」
 * - weight 只影響深蹲判斷（0 → bodyweight squat；> 15 → barbell back squat）
 * - 冪等：normalize(normalize(x, w), w) == normalize(x, w)
 * 純函式、無狀態，可多執行緒共用。
 */
@Slf4j
public final class ExerciseNormalizer {
    private ExerciseNormalizer() {}

    public static final String COMMENT_PREFIX = "*";

    /** 規則表跑到不再變動為止；上限避免規則互相改寫時無限循環 */
    static final int MAX_PASSES = 4;

    public static String normalize(String raw) {
        return normalize(raw, null);
    }

    public static String normalize(String raw, Double weight) {
        if (raw == null) return "";
        if (ExerciseTextNorm.isComment(raw)) return "";

        String s = collapseRepeats(ExerciseTextNorm.clean(raw));
        if (s.isEmpty()) return "";

        for (int pass = 0; pass < MAX_PASSES; pass++) {
            String next = runPipeline(s, weight);
            if (next.equals(s)) return next;
            s = next;
        }
        log.debug("normalize not converged after {} passes raw='{}' result='{}'", MAX_PASSES, raw, s);
        return s;
    }

    private static String runPipeline(String input, Double weight) {
        String s = input;
        for (RuleStage stage : ExerciseRules.PIPELINE) {
            String before = s;
            s = stage.apply(s, weight);
            if (log.isDebugEnabled() && !before.equals(s)) {
                log.debug("stage={} '{}' -> '{}'", stage.name(), before, s);
            }
        }
        return collapseRepeats(ExerciseTextNorm.collapse(s));
    }

    /** 去除連續重複字（tricep tricep extension → tricep extension）；數字不合併（tempo 3 1 1） */
    static String collapseRepeats(String s) {
        if (s == null || s.isBlank()) return "";
        String[] words = s.trim().split(" +");
        List<String> out = new ArrayList<>(words.length);
        for (String w : words) {
            if (out.isEmpty() || !out.get(out.size() - 1).equals(w) || isNumber(w)) out.add(w);
        }
        return String.join(" ", out);
    }

    private static boolean isNumber(String w) {
        for (int i = 0; i < w.length(); i++) {
            if (!Character.isDigit(w.charAt(i))) return false;
        }
        return !w.isEmpty();
    }
}
