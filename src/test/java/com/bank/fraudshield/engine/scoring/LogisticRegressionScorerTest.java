package com.bank.fraudshield.engine.scoring;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class LogisticRegressionScorerTest {

    private final LogisticRegressionScorer scorer =
            new LogisticRegressionScorer(new double[]{1.0, -2.0}, 0.5);

    @Test
    void score_appliesSigmoidToLinearTerm() {
        // z = 0.5 + 1 - 2 = -0.5
        assertThat(scorer.score(new double[]{1.0, 1.0}))
                .isCloseTo(1.0 / (1.0 + Math.exp(0.5)), within(1e-12));
    }

    @Test
    void score_extremeMargins_stayFinite() {
        assertThat(scorer.score(new double[]{1000.0, 0.0})).isEqualTo(1.0);
        assertThat(scorer.score(new double[]{-1000.0, 0.0})).isCloseTo(0.0, within(1e-300));
    }

    @Test
    void attribute_isCoefficientTimesInput() {
        assertThat(scorer.supportsNativeAttribution()).isTrue();
        assertThat(scorer.attribute(new double[]{2.0, 0.5})).containsExactly(2.0, -1.0);
    }

    @Test
    void score_wrongDimension_throws() {
        assertThatThrownBy(() -> scorer.score(new double[]{1.0}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("expects 2");
    }

    @Test
    void sigmoid_isSymmetric() {
        assertThat(Sigmoid.apply(0.0)).isEqualTo(0.5);
        assertThat(Sigmoid.apply(3.0) + Sigmoid.apply(-3.0)).isCloseTo(1.0, within(1e-12));
    }
}
