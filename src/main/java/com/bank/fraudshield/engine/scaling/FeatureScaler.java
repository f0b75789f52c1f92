package com.bank.fraudshield.engine.scaling;

import com.bank.fraudshield.model.ScalingVariant;

/**
 * Per-feature affine transform fitted at training time.
 * Implementations are immutable and thread-safe.
 */
public interface FeatureScaler {

    ScalingVariant getVariant();

    int dimension();

    double[] transform(double[] raw);

    double[] inverseTransform(double[] scaled);
}
