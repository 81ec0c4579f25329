package com.lungrisk.common.model;

/**
 * Numeric guards for probabilities that feed odds or log arithmetic.
 */
public final class Probabilities {

    public static final double EPSILON = 1e-12;

    private Probabilities() {
    }

    /**
     * Clips into {@code [EPSILON, 1 - EPSILON]}; NaN maps to the lower bound.
     */
    public static double clip(double probability) {
        if (Double.isNaN(probability)) {
            return EPSILON;
        }
        return Math.min(Math.max(probability, EPSILON), 1.0 - EPSILON);
    }
}
