package com.bank.fraudshield.engine.decision;

import com.bank.fraudshield.config.RiskBandConfig;
import com.bank.fraudshield.model.RiskClassification;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DecisionPolicyTest {

    private RiskBandConfig bands;
    private DecisionPolicy policy;

    @BeforeEach
    void setUp() {
        bands = new RiskBandConfig();
        policy = new DecisionPolicy(bands);
    }

    @Test
    void decide_atThreshold_isFraudDecisionButSuspicious() {
        Decision decision = policy.decide(0.40, 0.40);

        assertThat(decision.isFraudDecision()).isTrue();
        assertThat(decision.getClassification()).isEqualTo(RiskClassification.SUSPICIOUS);
        assertThat(decision.getConfidence()).isCloseTo(0.2, within(1e-9));
    }

    @Test
    void decide_highProbability_isConfidentFraud() {
        Decision decision = policy.decide(0.95, 0.40);

        assertThat(decision.isFraudDecision()).isTrue();
        assertThat(decision.getClassification()).isEqualTo(RiskClassification.FRAUD);
        assertThat(decision.getConfidence()).isCloseTo(0.9, within(1e-9));
    }

    @Test
    void decide_thresholdAndBandsAreIndependent() {
        assertThat(policy.decide(0.35, 0.50).isFraudDecision()).isFalse();
        assertThat(policy.decide(0.35, 0.50).getClassification()).isEqualTo(RiskClassification.SUSPICIOUS);

        assertThat(policy.decide(0.20, 0.10).isFraudDecision()).isTrue();
        assertThat(policy.decide(0.20, 0.10).getClassification()).isEqualTo(RiskClassification.SAFE);
    }

    @Test
    void classify_bandEdges() {
        assertThat(policy.classify(0.2999)).isEqualTo(RiskClassification.SAFE);
        assertThat(policy.classify(0.30)).isEqualTo(RiskClassification.SUSPICIOUS);
        assertThat(policy.classify(0.6999)).isEqualTo(RiskClassification.SUSPICIOUS);
        assertThat(policy.classify(0.70)).isEqualTo(RiskClassification.FRAUD);
    }

    @Test
    void classify_isMonotoneInProbability() {
        RiskClassification previous = policy.classify(0.0);
        for (int i = 1; i <= 1000; i++) {
            RiskClassification current = policy.classify(i / 1000.0);
            assertThat(current.ordinal()).isGreaterThanOrEqualTo(previous.ordinal());
            previous = current;
        }
    }

    @Test
    void classify_followsUpdatedBands() {
        bands.setSafeBelow(0.1);
        bands.setFraudAtOrAbove(0.2);

        assertThat(policy.classify(0.25)).isEqualTo(RiskClassification.FRAUD);
    }

    @Test
    void confidence_peaksAtExtremes() {
        assertThat(DecisionPolicy.confidence(0.5)).isZero();
        assertThat(DecisionPolicy.confidence(0.0)).isEqualTo(1.0);
        assertThat(DecisionPolicy.confidence(1.0)).isEqualTo(1.0);
    }
}
