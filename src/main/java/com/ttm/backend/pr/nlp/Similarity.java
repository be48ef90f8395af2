package com.ttm.backend.pr.nlp;

/**
 * 統一的字串相似度入口（0..100 整數分數）。
 * 兩邊都應該已經是 ExerciseNormalizer 的輸出，這裡不再正規化。
 */
public final class Similarity {
    private Similarity(){}

    /** 原始分數（0..100，含小數）；門檻與比大小都用這個 */
    public static double ratio(String s1, String s2) {
        return IndelRatio.ratio(s1, s2);
    }

    /** 顯示/回傳用整數分數 */
    public static int score(String s1, String s2) {
        return (int) Math.round(ratio(s1, s2));
    }
}
