package com.lungrisk.scoring.service;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RiskPercentagesTest {

    @ParameterizedTest
    @CsvSource({
        "0.0, 0.00",
        "0.12346, 12.35",
        "0.5, 50.00",
        "0.99994, 99.99",
        "1.0, 99.99",
        "1e-12, 0.00"
    })
    void shouldRoundAndCap(double probability, String expected) {
        assertThat(RiskPercentages.toPercentage(probability)).isEqualByComparingTo(expected);
        assertThat(RiskPercentages.toPercentage(probability).scale()).isEqualTo(2);
    }

    @Test
    void shouldPassThroughNull() {
        assertThat(RiskPercentages.toPercentage((Double) null)).isNull();
    }
}
