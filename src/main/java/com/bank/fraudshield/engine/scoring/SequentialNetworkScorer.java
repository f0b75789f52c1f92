package com.bank.fraudshield.engine.scoring;

import com.bank.fraudshield.engine.scoring.nn.SequentialNetwork;

/**
 * Classifier network ending in a single sigmoid unit. Attribution is left to
 * the model-agnostic adapters.
 */
public class SequentialNetworkScorer implements Scorer {

    private final SequentialNetwork network;
    private final int featureCount;

    public SequentialNetworkScorer(SequentialNetwork network, int featureCount) {
        this.network = network;
        this.featureCount = featureCount;
    }

    @Override
    public double score(double[] input) {
        if (input.length != featureCount) {
            throw new IllegalArgumentException("Network expects " + featureCount + " features, got " + input.length);
        }
        double[] out = network.forward(input);
        if (out.length != 1) {
            throw new IllegalStateException("Classifier network produced " + out.length + " outputs, expected 1");
        }
        double p = out[0];
        if (!Double.isFinite(p)) {
            throw new IllegalStateException("Classifier network produced non-finite output " + p);
        }
        return Math.max(0.0, Math.min(1.0, p));
    }
}
