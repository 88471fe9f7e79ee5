package com.silentrisk.vault.model.vault;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Cut points of the score-to-band table. Fixed for the lifetime of a deployment.
 * <p>
 * Scores are on a 0..{@value #MAX_RISK_SCORE} scale ({@value #SCORE_PRECISION} units per percent).
 * A score below {@code mediumFrom} is LOW, below {@code highFrom} is MEDIUM, otherwise HIGH.
 * When {@code criticalFrom} is set, scores at or above it are CRITICAL.
 */
@ToString
@EqualsAndHashCode
public final class BandThresholds {

    public static final int SCORE_PRECISION = 100;
    public static final int MAX_RISK_SCORE = 10_000;

    public static final BandThresholds DEFAULT = new BandThresholds(3_000, 7_000, null);

    private final int mediumFrom;
    private final int highFrom;
    private final Integer criticalFrom;

    public BandThresholds(int mediumFrom, int highFrom, Integer criticalFrom) {
        if (mediumFrom <= 0 || highFrom <= mediumFrom || highFrom > MAX_RISK_SCORE) {
            throw new IllegalArgumentException(String.format(
                    "Band cut points must satisfy 0 < medium < high <= %d: medium=%d, high=%d",
                    MAX_RISK_SCORE, mediumFrom, highFrom));
        }
        if (criticalFrom != null && (criticalFrom <= highFrom || criticalFrom > MAX_RISK_SCORE)) {
            throw new IllegalArgumentException(String.format(
                    "Critical cut point must be in (%d, %d]: %d", highFrom, MAX_RISK_SCORE, criticalFrom));
        }
        this.mediumFrom = mediumFrom;
        this.highFrom = highFrom;
        this.criticalFrom = criticalFrom;
    }

    public RiskBand classify(int score) {
        if (score < 0 || score > MAX_RISK_SCORE) {
            throw new IllegalArgumentException("Score out of range: " + score);
        }
        if (score < mediumFrom) {
            return RiskBand.LOW;
        }
        if (score < highFrom) {
            return RiskBand.MEDIUM;
        }
        if (criticalFrom != null && score >= criticalFrom) {
            return RiskBand.CRITICAL;
        }
        return RiskBand.HIGH;
    }

    public int getMediumFrom() {
        return mediumFrom;
    }

    public int getHighFrom() {
        return highFrom;
    }

    public Integer getCriticalFrom() {
        return criticalFrom;
    }

    public boolean hasCriticalTier() {
        return criticalFrom != null;
    }

}
