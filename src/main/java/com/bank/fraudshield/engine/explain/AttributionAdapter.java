package com.bank.fraudshield.engine.explain;

import com.bank.fraudshield.engine.scoring.Scorer;

/**
 * Computes signed per-feature contributions of one model for one input.
 * Both vectors are in the model's own scaled space.
 */
public interface AttributionAdapter {

    double[] attribute(Scorer scorer, double[] input, double[] baseline);

    String getMethod();
}
