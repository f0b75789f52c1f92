package com.bank.fraudshield.engine.fusion;

/** Maps a raw fused probability onto a calibrated one. */
public interface Calibrator {

    double calibrate(double rawProbability);

    String getType();
}
