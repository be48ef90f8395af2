package com.ttm.backend.pr.match;

import com.ttm.backend.pr.nlp.ExerciseNormalizer;
import com.ttm.backend.pr.nlp.Similarity;

import java.util.List;

/**
 * 把正規化後的動作名稱對到使用者課表（programExercises）。
 *
 * 規則：
 * - 完全相同 → (input, 100, false)，完全命中不算 fuzzy
 * - 最高分 ≥ threshold → 採用課表名稱，usedFuzzy = true
 * - 其餘 → 保留輸入原樣（課表外的訓練不丟棄），分數照回傳
 * - 同分 → 取課表中最早出現者（課表順序 = A→B→C→D→E 訓練順序）
 *
 * 課表由呼叫端提供、順序有意義；這裡不快取、不修改。
 */
public final class ProgramMatcher {

    public static final int DEFAULT_THRESHOLD = 85;
    public static final int DEFAULT_NEAR_MISS_FLOOR = 70;

    private final int threshold;
    private final int nearMissFloor;

    public ProgramMatcher() {
        this(DEFAULT_THRESHOLD, DEFAULT_NEAR_MISS_FLOOR);
    }

    public ProgramMatcher(int threshold, int nearMissFloor) {
        checkThreshold(threshold);
        if (nearMissFloor < 0 || nearMissFloor > threshold) {
            throw new IllegalArgumentException("nearMissFloor must be within 0..threshold: " + nearMissFloor);
        }
        this.threshold = threshold;
        this.nearMissFloor = nearMissFloor;
    }

    public int threshold() { return threshold; }

    public int nearMissFloor() { return nearMissFloor; }

    /** 先正規化（帶 weight 供深蹲判斷）再比對 */
    public MatchResult resolve(String rawName, Double weight, List<String> programExercises) {
        return match(ExerciseNormalizer.normalize(rawName, weight), programExercises);
    }

    public MatchResult match(String normalizedInput, List<String> programExercises) {
        return match(normalizedInput, programExercises, threshold);
    }

    public MatchResult match(String normalizedInput, List<String> programExercises, int threshold) {
        checkThreshold(threshold);
        if (normalizedInput == null || normalizedInput.isEmpty()) return MatchResult.empty();

        if (programExercises == null || programExercises.isEmpty()) {
            return new MatchResult(normalizedInput, 0, false, MatchBand.NO_CANDIDATES);
        }

        if (programExercises.contains(normalizedInput)) {
            return new MatchResult(normalizedInput, 100, false, MatchBand.EXACT);
        }

        String best = null;
        double bestRatio = -1d;
        for (String candidate : programExercises) {
            if (candidate == null) continue;
            double ratio = Similarity.ratio(normalizedInput, candidate);
            // 用未四捨五入的分數比；嚴格大於：同分時保留較早出現的
            if (ratio > bestRatio) {
                bestRatio = ratio;
                best = candidate;
            }
        }
        if (best == null) {
            return new MatchResult(normalizedInput, 0, false, MatchBand.NO_CANDIDATES);
        }

        // 回傳的 score 才四捨五入（84.85 → 85 但不算命中）
        int score = (int) Math.round(bestRatio);
        if (bestRatio >= threshold) {
            return new MatchResult(best, score, true, MatchBand.FUZZY);
        }
        MatchBand band = bestRatio >= nearMissFloor ? MatchBand.NEAR_MISS : MatchBand.UNRELATED;
        return new MatchResult(normalizedInput, score, false, band);
    }

    private static void checkThreshold(int threshold) {
        if (threshold < 0 || threshold > 100) {
            throw new IllegalArgumentException("threshold must be within 0..100: " + threshold);
        }
    }
}
