package com.ttm.backend.pr.service;

import com.ttm.backend.pr.match.MatchBand;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** PR 解析結果的 key=value log（方便 grep / log pipeline 統計命中率） */
@Slf4j
@Component
public class PrParseTelemetry {

    public void ok(Long userId, String canonical, int score, MatchBand band, boolean usedFuzzy, long latencyMs) {
        log.info("pr_parse status=OK userId={} exercise={} score={} band={} fuzzy={} latencyMs={}",
                n(userId), safe(canonical), score, band, usedFuzzy, latencyMs);
    }

    public void notFound(Long userId, int programSize, long latencyMs) {
        log.info("pr_parse status=NOT_FOUND userId={} programSize={} latencyMs={}",
                n(userId), programSize, latencyMs);
    }

    /** 分數落在 near-miss 區間：課表可能少了這個動作，或門檻太嚴 */
    public void nearMiss(Long userId, String raw, String kept, int score) {
        log.warn("pr_parse status=NEAR_MISS userId={} raw={} kept={} score={}",
                n(userId), safe(raw), safe(kept), score);
    }

    public void programFail(Long userId, int status, String code) {
        log.warn("pr_parse status=PROGRAM_FAIL userId={} httpStatus={} errorCode={}",
                n(userId), status, safe(code));
    }

    private static String safe(String s) { return (s == null || s.isBlank()) ? "UNKNOWN" : s; }
    private static Object n(Long v) { return v == null ? "NA" : v; }
}
