package com.ttm.backend.pr.service;

import java.util.regex.Pattern;

/**
 * PR 行格式。STRICT 只接受 SLASH；PERMISSIVE 依序嘗試其餘五種。
 * 群組編號：exercise / weight / reps。
 */
public enum PrLinePattern {

    /** exercise 85/12、exercise BW/8（整行錨定） */
    SLASH("^(.+?)\\s+([0-9]+\\.?[0-9]*|bw)\\s*/\\s*([0-9]+)$", 1, 2, 3),

    /** exercise 225x10、exercise 225*10、exercise 85/12 後面可有其他字 */
    SEPARATOR("^(.+?)\\s+(" + Tokens.WEIGHT + ")\\s*[/*x×]\\s*(\\d+)", 1, 2, 3),

    /** exercise 225 - 10 */
    DASH("^(.+?)\\s+(" + Tokens.WEIGHT + ")\\s*-\\s*(\\d+)", 1, 2, 3),

    /** 10x225 exercise（次數在前） */
    REVERSED("^(\\d+)\\s*[x×]\\s*(" + Tokens.WEIGHT + ")\\s+(.+)", 3, 2, 1),

    /** exercise: 225/10 */
    COLON("^(.+?):\\s*(" + Tokens.WEIGHT + ")\\s*[/*x×]\\s*(\\d+)", 1, 2, 3),

    /** exercise 225 10（必須在行尾） */
    SPACED("^(.+?)\\s+(" + Tokens.WEIGHT + ")\\s+(\\d+)$", 1, 2, 3);

    private final Pattern pattern;
    private final int exerciseGroup;
    private final int weightGroup;
    private final int repsGroup;

    PrLinePattern(String regex, int exerciseGroup, int weightGroup, int repsGroup) {
        this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        this.exerciseGroup = exerciseGroup;
        this.weightGroup = weightGroup;
        this.repsGroup = repsGroup;
    }

    public Pattern pattern() { return pattern; }
    public int exerciseGroup() { return exerciseGroup; }
    public int weightGroup() { return weightGroup; }
    public int repsGroup() { return repsGroup; }

    private static final class Tokens {
        static final String WEIGHT = "\\d+(?:\\.\\d+)?|bw|bodyweight";
    }
}
