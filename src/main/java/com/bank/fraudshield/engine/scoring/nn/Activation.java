package com.bank.fraudshield.engine.scoring.nn;

import com.bank.fraudshield.engine.scoring.Sigmoid;

import java.util.Locale;

public enum Activation {
    LINEAR,
    RELU,
    SIGMOID,
    TANH;

    public double apply(double x) {
        switch (this) {
            case RELU:
                return x > 0 ? x : 0.0;
            case SIGMOID:
                return Sigmoid.apply(x);
            case TANH:
                return Math.tanh(x);
            default:
                return x;
        }
    }

    /** Accepts the lower-case names used in exported artifacts; null means linear. */
    public static Activation fromName(String name) {
        if (name == null || name.isBlank()) {
            return LINEAR;
        }
        return Activation.valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
