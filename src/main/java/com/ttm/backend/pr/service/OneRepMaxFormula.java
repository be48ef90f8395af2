package com.ttm.backend.pr.service;

/**
 * 1RM 估算公式。一個部署只用一種（app.pr.one-rep-max-formula），
 * 混用會讓進步統計前後不一致。
 */
public enum OneRepMaxFormula {

    /** Epley：w × (1 + reps / 30)（預設） */
    EPLEY {
        @Override
        double apply(double weight, int reps) {
            return weight * (1d + reps / 30d);
        }
    },

    /** 舊版：(w × reps × 0.0333) + w，高次數時與 EPLEY 略有差距 */
    LEGACY_LINEAR {
        @Override
        double apply(double weight, int reps) {
            return (weight * reps * 0.0333d) + weight;
        }
    };

    abstract double apply(double weight, int reps);
}
