package com.bank.fraudshield.model;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH;

    /**
     * Maps an attribution magnitude onto a severity. Returns null when the
     * magnitude is below the LOW cut point.
     */
    public static Severity fromMagnitude(double magnitude, double lowCut, double mediumCut, double highCut) {
        double m = Math.abs(magnitude);
        if (m >= highCut) return HIGH;
        if (m >= mediumCut) return MEDIUM;
        if (m >= lowCut) return LOW;
        return null;
    }
}
