package com.bank.fraudshield.model;

public enum AttributionDirection {
    INCREASES_RISK,
    DECREASES_RISK;

    public static AttributionDirection of(double signedImpact) {
        return signedImpact > 0 ? INCREASES_RISK : DECREASES_RISK;
    }
}
