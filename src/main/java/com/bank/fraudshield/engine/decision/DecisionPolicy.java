package com.bank.fraudshield.engine.decision;

import com.bank.fraudshield.config.RiskBandConfig;
import com.bank.fraudshield.model.RiskClassification;
import org.springframework.stereotype.Component;

/**
 * Turns a calibrated probability into a binary decision against the bundle
 * threshold and a three-tier classification against the configured bands.
 * The threshold and the bands are independent of each other.
 */
@Component
public class DecisionPolicy {

    private final RiskBandConfig bandConfig;

    public DecisionPolicy(RiskBandConfig bandConfig) {
        this.bandConfig = bandConfig;
    }

    public Decision decide(double calibratedProbability, double threshold) {
        return new Decision(
                calibratedProbability >= threshold,
                classify(calibratedProbability),
                confidence(calibratedProbability));
    }

    public RiskClassification classify(double probability) {
        return RiskClassification.fromProbability(probability,
                bandConfig.getSafeBelow(), bandConfig.getFraudAtOrAbove());
    }

    /** Distance from the 0.5 decision midpoint, scaled to [0,1]. */
    public static double confidence(double probability) {
        return Math.min(1.0, 2.0 * Math.abs(probability - 0.5));
    }
}
