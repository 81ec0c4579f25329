package com.lungrisk.scoring.service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Converts probabilities to the percentages reported to callers.
 */
public final class RiskPercentages {

    /** Never report a certain outcome. */
    public static final double MAX_REPORTED_PROBABILITY = 0.9999;

    private RiskPercentages() {
    }

    public static BigDecimal toPercentage(double probability) {
        double capped = Math.min(Math.max(probability, 0.0), MAX_REPORTED_PROBABILITY);
        return BigDecimal.valueOf(capped * 100.0).setScale(2, RoundingMode.HALF_UP);
    }

    public static BigDecimal toPercentage(Double probability) {
        return probability == null ? null : toPercentage(probability.doubleValue());
    }
}
