package com.ttm.backend.pr.match;

public record MatchResult(String canonical, int score, boolean usedFuzzy, MatchBand band) {

    public static MatchResult empty() {
        return new MatchResult("", 0, false, MatchBand.EMPTY);
    }

    public boolean isEmpty() {
        return canonical == null || canonical.isEmpty();
    }
}
