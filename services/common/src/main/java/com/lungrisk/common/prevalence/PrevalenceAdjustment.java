package com.lungrisk.common.prevalence;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of a prior correction. {@code adjustedProbability} is null when the
 * correction was skipped.
 */
@Getter
@Builder
@ToString
public class PrevalenceAdjustment {

    private final double rawProbability;
    private final Double adjustedProbability;
    private final boolean applied;
    private final Double trainingPrior;
    private final Double deploymentPrior;

    /**
     * The probability to report as the main result.
     */
    public double effectiveProbability() {
        return applied ? adjustedProbability : rawProbability;
    }
}
