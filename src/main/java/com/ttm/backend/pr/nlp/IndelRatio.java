package com.ttm.backend.pr.nlp;

/**
 * Indel 相似度：只允許插入/刪除的編輯距離，正規化到 0..1。
 * ratio = 2 * LCS / (len1 + len2)，對稱、區分大小寫。
 */
public final class IndelRatio {
    private IndelRatio() {}

    public static double similarity(String s1, String s2) {
        if (s1 == null || s2 == null) return 0d;
        int total = s1.length() + s2.length();
        if (total == 0) return 1d;
        if (s1.equals(s2)) return 1d;
        return (2d * lcsLength(s1, s2)) / total;
    }

    /** 同 similarity，但以 0..100 表示（不四捨五入） */
    public static double ratio(String s1, String s2) {
        if (s1 == null || s2 == null) return 0d;
        int total = s1.length() + s2.length();
        if (total == 0 || s1.equals(s2)) return 100d;
        return (200d * lcsLength(s1, s2)) / total;
    }

    /** 兩列滾動 DP，O(len1 * len2) 時間、O(len2) 空間 */
    static int lcsLength(String a, String b) {
        int n = a.length(), m = b.length();
        if (n == 0 || m == 0) return 0;
        int[] prev = new int[m + 1];
        int[] cur = new int[m + 1];
        for (int i = 1; i <= n; i++) {
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= m; j++) {
                if (ca == b.charAt(j - 1)) cur[j] = prev[j - 1] + 1;
                else cur[j] = Math.max(prev[j], cur[j - 1]);
            }
            int[] t = prev; prev = cur; cur = t;
        }
        return prev[m];
    }
}
