package com.bank.fraudshield.engine.scaling;

import com.bank.fraudshield.model.ScalingVariant;

import java.util.Arrays;

/**
 * Pass-through for models trained on unscaled features.
 */
public class IdentityScaler implements FeatureScaler {

    private final int dimension;

    public IdentityScaler(int dimension) {
        this.dimension = dimension;
    }

    @Override
    public ScalingVariant getVariant() {
        return ScalingVariant.NONE;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public double[] transform(double[] raw) {
        return Arrays.copyOf(raw, raw.length);
    }

    @Override
    public double[] inverseTransform(double[] scaled) {
        return Arrays.copyOf(scaled, scaled.length);
    }
}
