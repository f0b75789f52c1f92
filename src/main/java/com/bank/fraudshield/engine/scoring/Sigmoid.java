package com.bank.fraudshield.engine.scoring;

public final class Sigmoid {

    private Sigmoid() {}

    public static double apply(double z) {
        if (z >= 0) {
            return 1.0 / (1.0 + Math.exp(-z));
        }
        double e = Math.exp(z);
        return e / (1.0 + e);
    }
}
