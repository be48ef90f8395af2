package com.ttm.backend.pr.service;

import com.ttm.backend.pr.match.ProgramMatcher;

/**
 * 解析器設定（不可變）。由 PrProperties 轉出，或測試直接用 defaults()。
 */
public record ParserSettings(
        ParseMode mode,
        int fuzzyThreshold,
        int nearMissFloor,
        double maxWeight,
        int minReps,
        int maxReps,
        OneRepMaxFormula formula
) {
    public ParserSettings {
        if (mode == null) mode = ParseMode.STRICT;
        if (formula == null) formula = OneRepMaxFormula.EPLEY;
        if (maxWeight < 0) throw new IllegalArgumentException("maxWeight must be >= 0");
        if (minReps < 1 || maxReps < minReps) {
            throw new IllegalArgumentException("reps bounds invalid: " + minReps + ".." + maxReps);
        }
    }

    public static ParserSettings defaults() {
        return new ParserSettings(
                ParseMode.STRICT,
                ProgramMatcher.DEFAULT_THRESHOLD,
                ProgramMatcher.DEFAULT_NEAR_MISS_FLOOR,
                1000d,
                3,
                50,
                OneRepMaxFormula.EPLEY
        );
    }

    public ParserSettings withMode(ParseMode m) {
        return new ParserSettings(m, fuzzyThreshold, nearMissFloor, maxWeight, minReps, maxReps, formula);
    }

    public ParserSettings withFormula(OneRepMaxFormula f) {
        return new ParserSettings(mode, fuzzyThreshold, nearMissFloor, maxWeight, minReps, maxReps, f);
    }
}
