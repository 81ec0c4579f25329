package com.lungrisk.common.prevalence;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Process-level prior settings, fixed at startup.
 *
 * <p>A configured training override replaces the prior recorded in the model metadata
 * only when it is a valid prior; otherwise the recorded prior stays in force.
 * A per-request deployment prior beats the configured default; when neither exists,
 * no correction happens.
 */
@Getter
@Builder
@ToString
public class PrevalencePolicy {

    private final Double trainingOverride;
    private final Double deploymentDefault;

    public static PrevalencePolicy none() {
        return PrevalencePolicy.builder().build();
    }

    /**
     * Reads a prior from text. Blank means "not supplied" and yields null; unparseable
     * text yields NaN, which every prior check rejects.
     */
    public static Double parsePrior(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    public Double resolveTrainingPrior(Double bundlePrior) {
        return PrevalenceAdjuster.isValidPrior(trainingOverride) ? trainingOverride : bundlePrior;
    }

    public Double resolveDeploymentPrior(Double requestOverride) {
        return requestOverride != null ? requestOverride : deploymentDefault;
    }
}
