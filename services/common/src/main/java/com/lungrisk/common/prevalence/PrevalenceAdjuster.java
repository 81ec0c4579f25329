package com.lungrisk.common.prevalence;

import com.lungrisk.common.model.Probabilities;

/**
 * Re-expresses a probability computed under the training class prior as the
 * probability implied by a different deployment prior, by odds-ratio reweighting:
 *
 * <pre>
 *   adjustedOdds = p / (1 - p) * (piDeploy / (1 - piDeploy)) / (piTrain / (1 - piTrain))
 * </pre>
 *
 * Missing or out-of-range priors skip the correction rather than failing.
 */
public final class PrevalenceAdjuster {

    private PrevalenceAdjuster() {
    }

    public static boolean isValidPrior(Double prior) {
        return prior != null && prior > 0.0 && prior < 1.0;
    }

    /**
     * Returns {@code probability} unchanged when either prior is invalid; otherwise
     * the corrected probability, clipped to {@code [EPSILON, 1 - EPSILON]}.
     */
    public static double adjustPrior(double probability, Double piTrain, Double piDeploy) {
        if (!isValidPrior(piTrain) || !isValidPrior(piDeploy)) {
            return probability;
        }
        double p = Probabilities.clip(probability);
        double priorRatio = odds(piDeploy) / odds(piTrain);
        double adjustedOdds = odds(p) * priorRatio;
        return Probabilities.clip(adjustedOdds / (1.0 + adjustedOdds));
    }

    public static PrevalenceAdjustment adjust(double probability, Double piTrain, Double piDeploy) {
        boolean applicable = isValidPrior(piTrain) && isValidPrior(piDeploy);
        return PrevalenceAdjustment.builder()
            .rawProbability(probability)
            .adjustedProbability(applicable ? adjustPrior(probability, piTrain, piDeploy) : null)
            .applied(applicable)
            .trainingPrior(piTrain)
            .deploymentPrior(piDeploy)
            .build();
    }

    private static double odds(double p) {
        return p / (1.0 - p);
    }
}
