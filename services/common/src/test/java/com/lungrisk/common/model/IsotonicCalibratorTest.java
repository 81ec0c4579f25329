package com.lungrisk.common.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class IsotonicCalibratorTest {

    @Test
    void shouldPoolAdjacentViolators() {
        double[] scores = {0.1, 0.2, 0.3, 0.4};
        int[] outcomes = {0, 1, 0, 1};

        IsotonicCalibrator calibrator = IsotonicCalibrator.fit(scores, outcomes);

        assertThat(calibrator.calibrate(0.1)).isEqualTo(0.0);
        assertThat(calibrator.calibrate(0.2)).isEqualTo(0.5);
        assertThat(calibrator.calibrate(0.3)).isEqualTo(0.5);
        assertThat(calibrator.calibrate(0.4)).isEqualTo(1.0);
    }

    @Test
    void shouldBeMonotoneNonDecreasing() {
        double[] scores = {0.9, 0.1, 0.5, 0.3, 0.7, 0.2, 0.8, 0.6};
        int[] outcomes = {1, 0, 1, 0, 0, 1, 1, 0};
        IsotonicCalibrator calibrator = IsotonicCalibrator.fit(scores, outcomes);

        double previous = -1.0;
        for (double x = 0.0; x <= 1.0; x += 0.05) {
            double y = calibrator.calibrate(x);
            assertThat(y).isGreaterThanOrEqualTo(previous).isBetween(0.0, 1.0);
            previous = y;
        }
    }

    @Test
    void shouldCollapseTiesAndInterpolate() {
        double[] scores = {0.2, 0.2, 0.6, 0.6};
        int[] outcomes = {0, 1, 1, 1};

        IsotonicCalibrator calibrator = IsotonicCalibrator.fit(scores, outcomes);

        assertThat(calibrator.knotCount()).isEqualTo(2);
        assertThat(calibrator.calibrate(0.4)).isCloseTo(0.75, within(1e-12));
        assertThat(calibrator.calibrate(0.0)).isEqualTo(0.5);
        assertThat(calibrator.calibrate(1.0)).isEqualTo(1.0);
    }
}
