package com.bank.fraudshield.engine.scoring.nn;

import java.util.Arrays;

/** Max over the time axis, per channel. */
public class GlobalMaxPoolLayer implements Layer {

    @Override
    public double[][] forward(double[][] input) {
        if (input.length == 0) {
            throw new IllegalArgumentException("Cannot pool an empty sequence");
        }
        double[] pooled = Arrays.copyOf(input[0], input[0].length);
        for (int t = 1; t < input.length; t++) {
            for (int c = 0; c < pooled.length; c++) {
                pooled[c] = Math.max(pooled[c], input[t][c]);
            }
        }
        return new double[][]{pooled};
    }

    @Override
    public boolean consumesSequence() {
        return true;
    }
}
