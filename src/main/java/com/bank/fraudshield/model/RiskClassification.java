package com.bank.fraudshield.model;

public enum RiskClassification {
    SAFE,
    SUSPICIOUS,
    FRAUD;

    /**
     * Three-tier banding: SAFE below {@code safeBelow}, FRAUD at or above
     * {@code fraudAtOrAbove}, SUSPICIOUS in between.
     */
    public static RiskClassification fromProbability(double probability, double safeBelow, double fraudAtOrAbove) {
        if (probability >= fraudAtOrAbove) return FRAUD;
        if (probability < safeBelow) return SAFE;
        return SUSPICIOUS;
    }
}
