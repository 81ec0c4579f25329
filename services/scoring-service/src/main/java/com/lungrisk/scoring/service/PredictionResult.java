package com.lungrisk.scoring.service;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

/**
 * Per-request scoring outcome. Not persisted.
 */
@Getter
@Builder
@ToString
public class PredictionResult {

    private final double rawProbability;

    /** Null when the prevalence correction was not applied. */
    private final Double adjustedProbability;

    private final boolean usedAdjustment;
    private final Double trainingPrior;
    private final Double deploymentPrior;

    /** Parsed, unscaled feature values in feature order. */
    private final Map<String, Object> inputsUsed;

    public double getEffectiveProbability() {
        return usedAdjustment ? adjustedProbability : rawProbability;
    }
}
