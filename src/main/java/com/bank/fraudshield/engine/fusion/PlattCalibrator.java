package com.bank.fraudshield.engine.fusion;

import com.bank.fraudshield.engine.scoring.Sigmoid;

/** p_cal = sigmoid(a * p + b). */
public class PlattCalibrator implements Calibrator {

    private final double a;
    private final double b;

    public PlattCalibrator(double a, double b) {
        this.a = a;
        this.b = b;
    }

    @Override
    public double calibrate(double rawProbability) {
        return Sigmoid.apply(a * rawProbability + b);
    }

    @Override
    public String getType() {
        return "PLATT";
    }
}
