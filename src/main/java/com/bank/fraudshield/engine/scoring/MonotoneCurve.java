package com.bank.fraudshield.engine.scoring;

import java.util.Arrays;

/**
 * Piecewise-linear, non-decreasing mapping through fitted knots. Inputs
 * outside the knot range take the value of the nearest end knot.
 */
public final class MonotoneCurve {

    private final double[] x;
    private final double[] y;

    public MonotoneCurve(double[] x, double[] y) {
        if (x == null || y == null || x.length == 0 || x.length != y.length) {
            throw new IllegalArgumentException("Curve needs the same non-zero number of x and y knots");
        }
        for (int i = 1; i < x.length; i++) {
            if (x[i] < x[i - 1]) {
                throw new IllegalArgumentException("Curve x knots must be ascending");
            }
            if (y[i] < y[i - 1]) {
                throw new IllegalArgumentException("Curve y knots must be non-decreasing");
            }
        }
        this.x = Arrays.copyOf(x, x.length);
        this.y = Arrays.copyOf(y, y.length);
    }

    public double apply(double value) {
        if (value <= x[0]) return y[0];
        int last = x.length - 1;
        if (value >= x[last]) return y[last];

        int idx = Arrays.binarySearch(x, value);
        if (idx >= 0) return y[idx];

        int hi = -idx - 1;
        int lo = hi - 1;
        double span = x[hi] - x[lo];
        if (span == 0.0) return y[hi];
        double t = (value - x[lo]) / span;
        return y[lo] + t * (y[hi] - y[lo]);
    }
}
