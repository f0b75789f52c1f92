package com.bank.fraudshield.engine.scaling;

import com.bank.fraudshield.model.ScalingVariant;

import java.util.Arrays;

/**
 * Maps each feature from its training [min, max] onto [rangeMin, rangeMax].
 * Out-of-range values extrapolate linearly unless clipping was requested.
 * Clipping makes the inverse lossy for out-of-range inputs.
 */
public class MinMaxScaler implements FeatureScaler {

    private final double[] dataMin;
    private final double[] dataRange;
    private final double rangeMin;
    private final double rangeMax;
    private final boolean clip;

    public MinMaxScaler(double[] dataMin, double[] dataMax, double rangeMin, double rangeMax, boolean clip) {
        if (dataMin.length != dataMax.length) {
            throw new IllegalArgumentException("dataMin and dataMax must have the same length");
        }
        if (rangeMax <= rangeMin) {
            throw new IllegalArgumentException("Feature range must be increasing");
        }
        this.dataMin = Arrays.copyOf(dataMin, dataMin.length);
        this.dataRange = new double[dataMin.length];
        for (int i = 0; i < dataMin.length; i++) {
            double range = dataMax[i] - dataMin[i];
            this.dataRange[i] = range == 0.0 ? 1.0 : range;
        }
        this.rangeMin = rangeMin;
        this.rangeMax = rangeMax;
        this.clip = clip;
    }

    @Override
    public ScalingVariant getVariant() {
        return ScalingVariant.MIN_MAX;
    }

    @Override
    public int dimension() {
        return dataMin.length;
    }

    @Override
    public double[] transform(double[] raw) {
        checkDimension(raw);
        double span = rangeMax - rangeMin;
        double[] out = new double[raw.length];
        for (int i = 0; i < raw.length; i++) {
            double v = (raw[i] - dataMin[i]) / dataRange[i] * span + rangeMin;
            out[i] = clip ? Math.max(rangeMin, Math.min(rangeMax, v)) : v;
        }
        return out;
    }

    @Override
    public double[] inverseTransform(double[] scaled) {
        checkDimension(scaled);
        double span = rangeMax - rangeMin;
        double[] out = new double[scaled.length];
        for (int i = 0; i < scaled.length; i++) {
            out[i] = (scaled[i] - rangeMin) / span * dataRange[i] + dataMin[i];
        }
        return out;
    }

    private void checkDimension(double[] v) {
        if (v.length != dataMin.length) {
            throw new IllegalArgumentException("Expected " + dataMin.length + " features, got " + v.length);
        }
    }
}
