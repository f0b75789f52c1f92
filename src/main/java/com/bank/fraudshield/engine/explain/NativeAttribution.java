package com.bank.fraudshield.engine.explain;

import com.bank.fraudshield.engine.scoring.Scorer;

/**
 * Delegates to the scorer's own decomposition: coefficient times input for
 * linear models, split path contributions for tree ensembles, per-feature
 * reconstruction error for autoencoders.
 */
public class NativeAttribution implements AttributionAdapter {

    @Override
    public double[] attribute(Scorer scorer, double[] input, double[] baseline) {
        return scorer.attribute(input);
    }

    @Override
    public String getMethod() {
        return "NATIVE";
    }
}
