package com.bank.fraudshield.engine.scoring;

import com.bank.fraudshield.engine.scoring.nn.Activation;
import com.bank.fraudshield.engine.scoring.nn.DenseLayer;
import com.bank.fraudshield.engine.scoring.nn.SequentialNetwork;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ReconstructionScorerTest {

    // Reconstructs every input as zero, so the error is the input's squared norm.
    private static SequentialNetwork zeroDecoder(int features) {
        return new SequentialNetwork(List.of(
                new DenseLayer(new double[features][features], new double[features], Activation.LINEAR)));
    }

    private final ReconstructionScorer scorer = new ReconstructionScorer(zeroDecoder(2),
            new MonotoneCurve(new double[]{0.0, 5.0}, new double[]{0.0, 1.0}), 2);

    @Test
    void reconstructionError_isMeanSquaredError() {
        assertThat(scorer.reconstructionError(new double[]{1.0, 2.0})).isCloseTo(2.5, within(1e-12));
    }

    @Test
    void score_mapsErrorThroughCurve() {
        assertThat(scorer.score(new double[]{1.0, 2.0})).isCloseTo(0.5, within(1e-12));
        assertThat(scorer.score(new double[]{10.0, 10.0})).isEqualTo(1.0);
    }

    @Test
    void attribute_sharesOfErrorSumToMse() {
        double[] contributions = scorer.attribute(new double[]{1.0, 2.0});

        assertThat(contributions).containsExactly(0.5, 2.0);
        assertThat(contributions[0] + contributions[1])
                .isCloseTo(scorer.reconstructionError(new double[]{1.0, 2.0}), within(1e-12));
    }

    @Test
    void score_wrongDimension_throws() {
        assertThatThrownBy(() -> scorer.score(new double[]{1.0, 2.0, 3.0}))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
