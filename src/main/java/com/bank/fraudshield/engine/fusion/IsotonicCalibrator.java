package com.bank.fraudshield.engine.fusion;

import com.bank.fraudshield.engine.scoring.MonotoneCurve;

/** Piecewise-linear interpolation over fitted isotonic knots, clamped at both ends. */
public class IsotonicCalibrator implements Calibrator {

    private final MonotoneCurve curve;

    public IsotonicCalibrator(double[] x, double[] y) {
        for (double v : y) {
            if (v < 0.0 || v > 1.0) {
                throw new IllegalArgumentException("Isotonic knot probabilities must lie in [0,1]");
            }
        }
        this.curve = new MonotoneCurve(x, y);
    }

    @Override
    public double calibrate(double rawProbability) {
        return curve.apply(rawProbability);
    }

    @Override
    public String getType() {
        return "ISOTONIC";
    }
}
