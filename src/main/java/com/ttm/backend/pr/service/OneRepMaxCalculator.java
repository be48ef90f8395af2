package com.ttm.backend.pr.service;

/** 估算 1RM；徒手（weight == 0）不估，回 0.0，改由次數追蹤 */
public final class OneRepMaxCalculator {
    private OneRepMaxCalculator() {}

    public static double estimate(double weight, int reps) {
        return estimate(weight, reps, OneRepMaxFormula.EPLEY);
    }

    public static double estimate(double weight, int reps, OneRepMaxFormula formula) {
        if (weight == 0d) return 0d;
        OneRepMaxFormula f = formula == null ? OneRepMaxFormula.EPLEY : formula;
        return f.apply(weight, reps);
    }
}
