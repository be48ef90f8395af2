package com.ttm.backend.pr.service;

import java.util.List;

public enum ParseMode {
    /** 只接受「動作 重量/次數」 */
    STRICT(List.of(PrLinePattern.SLASH)),
    /** 相容舊訊息：x / * / - / 冒號 / 空白 / 次數在前 */
    PERMISSIVE(List.of(
            PrLinePattern.SEPARATOR,
            PrLinePattern.DASH,
            PrLinePattern.REVERSED,
            PrLinePattern.COLON,
            PrLinePattern.SPACED
    ));

    private final List<PrLinePattern> patterns;

    ParseMode(List<PrLinePattern> patterns) {
        this.patterns = patterns;
    }

    public List<PrLinePattern> patterns() {
        return patterns;
    }
}
