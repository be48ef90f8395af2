package com.ttm.backend.pr.dto;

import com.ttm.backend.pr.model.ParsedPr;

public record PrDto(
        String rawExercise,
        String exercise,
        double weight,
        int reps,
        double estimatedOneRepMax,
        int matchScore,
        boolean usedFuzzy,
        boolean bodyweight
) {
    public static PrDto from(ParsedPr pr) {
        return new PrDto(
                pr.rawExercise(),
                pr.canonicalExercise(),
                pr.weight(),
                pr.reps(),
                pr.estimatedOneRepMax(),
                pr.matchScore(),
                pr.usedFuzzy(),
                pr.isBodyweight()
        );
    }
}
