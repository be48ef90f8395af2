package com.ttm.backend.pr.config;

import com.ttm.backend.pr.service.OneRepMaxFormula;
import com.ttm.backend.pr.service.ParseMode;
import com.ttm.backend.pr.service.ParserSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * application.yml:
 * app.pr.*
 */
@ConfigurationProperties(prefix = "app.pr")
public class PrProperties {

    /** STRICT：只收「動作 重量/次數」；PERMISSIVE：相容 x / - / 冒號 / 次數在前 */
    private ParseMode parseMode = ParseMode.STRICT;

    /** 分數 ≥ 此值才採用課表名稱 */
    private int fuzzyThreshold = 85;

    /** 低於 threshold 時區分 near-miss / unrelated（只影響 log） */
    private int nearMissFloor = 70;

    private double maxWeight = 1000d;
    private int minReps = 3;
    private int maxReps = 50;

    /** 換公式會讓新舊 e1RM 不可比，上線後不要改 */
    private OneRepMaxFormula oneRepMaxFormula = OneRepMaxFormula.EPLEY;

    public ParserSettings toSettings() {
        return new ParserSettings(parseMode, fuzzyThreshold, nearMissFloor, maxWeight, minReps, maxReps, oneRepMaxFormula);
    }

    // ===== getters/setters =====
    public ParseMode getParseMode() { return parseMode; }
    public void setParseMode(ParseMode parseMode) { this.parseMode = parseMode; }

    public int getFuzzyThreshold() { return fuzzyThreshold; }
    public void setFuzzyThreshold(int fuzzyThreshold) { this.fuzzyThreshold = fuzzyThreshold; }

    public int getNearMissFloor() { return nearMissFloor; }
    public void setNearMissFloor(int nearMissFloor) { this.nearMissFloor = nearMissFloor; }

    public double getMaxWeight() { return maxWeight; }
    public void setMaxWeight(double maxWeight) { this.maxWeight = maxWeight; }

    public int getMinReps() { return minReps; }
    public void setMinReps(int minReps) { this.minReps = minReps; }

    public int getMaxReps() { return maxReps; }
    public void setMaxReps(int maxReps) { this.maxReps = maxReps; }

    public OneRepMaxFormula getOneRepMaxFormula() { return oneRepMaxFormula; }
    public void setOneRepMaxFormula(OneRepMaxFormula oneRepMaxFormula) { this.oneRepMaxFormula = oneRepMaxFormula; }
}
