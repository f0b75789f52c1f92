package com.bank.fraudshield.engine.fusion;

/** Used when the bundle ships no calibrator. */
public class IdentityCalibrator implements Calibrator {

    @Override
    public double calibrate(double rawProbability) {
        return rawProbability;
    }

    @Override
    public String getType() {
        return "NONE";
    }
}
