package com.ttm.backend.pr.model;

import com.ttm.backend.pr.match.MatchBand;

/**
 * 一筆解析成功的 PR。建立後不可變，交給外部儲存層。
 * estimatedOneRepMax 不在這裡四捨五入（顯示層才處理）。
 */
public record ParsedPr(
        String rawExercise,        // 使用者原文動作
        String canonicalExercise,  // 正規化 + 課表比對後名稱
        double weight,             // bw → 0
        int reps,
        double estimatedOneRepMax, // 徒手為 0.0
        int matchScore,
        boolean usedFuzzy,
        MatchBand matchBand        // 比對時的區間（log 用）
) {
    public boolean isBodyweight() {
        return weight == 0d;
    }
}
