package com.ttm.backend.pr.match;

/** 比對結果落在哪個區間（只供觀測；輸出行為由 canonical / usedFuzzy 決定） */
public enum MatchBand {
    /** 正規化後為空（教練註解等） */
    EMPTY,
    /** 與課表完全相同 */
    EXACT,
    /** 分數 ≥ threshold，採用課表名稱 */
    FUZZY,
    /** nearMissFloor ≤ 分數 < threshold：差一點，保留原輸入 */
    NEAR_MISS,
    /** 分數 < nearMissFloor：課表外動作，保留原輸入 */
    UNRELATED,
    /** 沒有課表可比 */
    NO_CANDIDATES
}
