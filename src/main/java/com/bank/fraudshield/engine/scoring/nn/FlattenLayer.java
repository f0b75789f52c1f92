package com.bank.fraudshield.engine.scoring.nn;

/** Collapses {@code [timesteps][channels]} into a single time step, row-major. */
public class FlattenLayer implements Layer {

    @Override
    public double[][] forward(double[][] input) {
        int total = 0;
        for (double[] step : input) {
            total += step.length;
        }
        double[] flat = new double[total];
        int pos = 0;
        for (double[] step : input) {
            System.arraycopy(step, 0, flat, pos, step.length);
            pos += step.length;
        }
        return new double[][]{flat};
    }

    @Override
    public boolean consumesSequence() {
        return true;
    }
}
