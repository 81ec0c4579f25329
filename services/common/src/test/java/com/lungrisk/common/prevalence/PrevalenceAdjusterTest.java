package com.lungrisk.common.prevalence;

import com.lungrisk.common.model.Probabilities;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("PrevalenceAdjuster")
class PrevalenceAdjusterTest {

    @ParameterizedTest
    @CsvSource({"0.3, 0.1", "0.01, 0.5", "0.75, 0.02", "0.999, 0.9"})
    void shouldBeIdentityWhenPriorsMatch(double p, double prior) {
        assertThat(PrevalenceAdjuster.adjustPrior(p, prior, prior)).isCloseTo(p, within(1e-9));
    }

    @Test
    void shouldIncreaseWithDeploymentPrior() {
        double previous = 0.0;
        for (double piDeploy = 0.01; piDeploy < 0.99; piDeploy += 0.07) {
            double adjusted = PrevalenceAdjuster.adjustPrior(0.4, 0.2, piDeploy);
            assertThat(adjusted).isGreaterThan(previous);
            previous = adjusted;
        }
    }

    @ParameterizedTest
    @CsvSource(value = {"0.0, 0.1", "1.0, 0.1", "-0.2, 0.1", "0.1, 0.0", "0.1, 1.0", "0.1, 1.5",
        "NULL, 0.1", "0.1, NULL"}, nullValues = "NULL")
    void shouldReturnInputForInvalidPriors(Double piTrain, Double piDeploy) {
        assertThat(PrevalenceAdjuster.adjustPrior(0.37, piTrain, piDeploy)).isEqualTo(0.37);
        assertThat(PrevalenceAdjuster.adjust(0.37, piTrain, piDeploy).isApplied()).isFalse();
    }

    @Test
    void shouldLeaveProbabilityUnchangedForEqualTenPercentPriors() {
        PrevalenceAdjustment adjustment = PrevalenceAdjuster.adjust(0.30, 0.10, 0.10);

        assertThat(adjustment.isApplied()).isTrue();
        assertThat(adjustment.getAdjustedProbability()).isCloseTo(0.30, within(1e-9));
    }

    @Test
    void shouldScaleOddsDownForLowDeploymentPrevalence() {
        double adjusted = PrevalenceAdjuster.adjustPrior(0.50, 0.30, 0.01);

        // odds 1.0 scaled by (0.01/0.99)/(0.3/0.7), roughly 1/42
        assertThat(adjusted).isLessThan(0.05).isCloseTo(0.0230, within(1e-3));
    }

    @Test
    void shouldClipToOpenUnitInterval() {
        assertThat(PrevalenceAdjuster.adjustPrior(1.0, 0.1, 0.9)).isLessThanOrEqualTo(1.0 - Probabilities.EPSILON);
        assertThat(PrevalenceAdjuster.adjustPrior(0.0, 0.9, 0.1)).isGreaterThanOrEqualTo(Probabilities.EPSILON);
    }

    @Test
    void policyShouldPreferOverrides() {
        PrevalencePolicy policy = PrevalencePolicy.builder().trainingOverride(0.2).deploymentDefault(0.05).build();

        assertThat(policy.resolveTrainingPrior(0.4)).isEqualTo(0.2);
        assertThat(policy.resolveDeploymentPrior(null)).isEqualTo(0.05);
        assertThat(policy.resolveDeploymentPrior(0.01)).isEqualTo(0.01);
        assertThat(PrevalencePolicy.none().resolveTrainingPrior(0.4)).isEqualTo(0.4);
    }

    @ParameterizedTest
    @CsvSource(value = {"1.5", "0.0", "-0.1", "NaN"})
    void invalidTrainingOverrideShouldKeepBundlePrior(double override) {
        PrevalencePolicy policy = PrevalencePolicy.builder().trainingOverride(override).build();

        assertThat(policy.resolveTrainingPrior(0.30)).isEqualTo(0.30);
    }

    @Test
    void shouldParsePriorText() {
        assertThat(PrevalencePolicy.parsePrior(null)).isNull();
        assertThat(PrevalencePolicy.parsePrior("   ")).isNull();
        assertThat(PrevalencePolicy.parsePrior(" 0.05 ")).isEqualTo(0.05);
        assertThat(PrevalencePolicy.parsePrior("abc")).isNaN();
        assertThat(PrevalenceAdjuster.isValidPrior(PrevalencePolicy.parsePrior("abc"))).isFalse();
    }
}
