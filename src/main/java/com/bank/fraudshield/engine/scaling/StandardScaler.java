package com.bank.fraudshield.engine.scaling;

import com.bank.fraudshield.model.ScalingVariant;

import java.util.Arrays;

/**
 * z = (x - mean) / scale, with the training-time mean and scale.
 * A zero scale (constant feature) is treated as 1.
 */
public class StandardScaler implements FeatureScaler {

    private final double[] mean;
    private final double[] scale;

    public StandardScaler(double[] mean, double[] scale) {
        if (mean.length != scale.length) {
            throw new IllegalArgumentException("mean and scale must have the same length");
        }
        this.mean = Arrays.copyOf(mean, mean.length);
        this.scale = new double[scale.length];
        for (int i = 0; i < scale.length; i++) {
            this.scale[i] = scale[i] == 0.0 ? 1.0 : scale[i];
        }
    }

    @Override
    public ScalingVariant getVariant() {
        return ScalingVariant.STANDARD;
    }

    @Override
    public int dimension() {
        return mean.length;
    }

    public double[] getMean() {
        return Arrays.copyOf(mean, mean.length);
    }

    @Override
    public double[] transform(double[] raw) {
        checkDimension(raw);
        double[] out = new double[raw.length];
        for (int i = 0; i < raw.length; i++) {
            out[i] = (raw[i] - mean[i]) / scale[i];
        }
        return out;
    }

    @Override
    public double[] inverseTransform(double[] scaled) {
        checkDimension(scaled);
        double[] out = new double[scaled.length];
        for (int i = 0; i < scaled.length; i++) {
            out[i] = scaled[i] * scale[i] + mean[i];
        }
        return out;
    }

    private void checkDimension(double[] v) {
        if (v.length != mean.length) {
            throw new IllegalArgumentException("Expected " + mean.length + " features, got " + v.length);
        }
    }
}
