package com.bank.fraudshield.engine.fusion;

import com.bank.fraudshield.engine.scoring.Sigmoid;

import java.util.Arrays;

/**
 * Fixed logistic combiner over base scores in canonical slot order, with the
 * per-slot fallback value used when a base model is unavailable.
 */
public class MetaLearner {

    private final double[] coefficients;
    private final double intercept;
    private final double[] fallbacks;

    public MetaLearner(double[] coefficients, double intercept, double[] fallbacks) {
        if (fallbacks.length != coefficients.length) {
            throw new IllegalArgumentException("Meta-learner has " + coefficients.length
                    + " coefficients but " + fallbacks.length + " fallbacks");
        }
        this.coefficients = Arrays.copyOf(coefficients, coefficients.length);
        this.intercept = intercept;
        this.fallbacks = Arrays.copyOf(fallbacks, fallbacks.length);
    }

    public double predict(double[] slotScores) {
        double[] contributions = contributions(slotScores);
        double z = intercept;
        for (double c : contributions) {
            z += c;
        }
        return Sigmoid.apply(z);
    }

    /** w_i * s_i per slot. */
    public double[] contributions(double[] slotScores) {
        if (slotScores.length != coefficients.length) {
            throw new IllegalArgumentException("Meta-learner expects " + coefficients.length
                    + " slots, got " + slotScores.length);
        }
        double[] out = new double[coefficients.length];
        for (int i = 0; i < coefficients.length; i++) {
            out[i] = coefficients[i] * slotScores[i];
        }
        return out;
    }

    public int getSlotCount() {
        return coefficients.length;
    }

    public double getFallback(int slot) {
        return fallbacks[slot];
    }

    public double getCoefficient(int slot) {
        return coefficients[slot];
    }

    public double getIntercept() {
        return intercept;
    }
}
