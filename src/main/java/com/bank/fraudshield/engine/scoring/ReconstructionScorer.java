package com.bank.fraudshield.engine.scoring;

import com.bank.fraudshield.engine.scoring.nn.SequentialNetwork;

/**
 * Autoencoder scorer. The mean squared reconstruction error is mapped to a
 * fraud probability through the bundle's fitted monotone curve. Native
 * attribution is each feature's share of that error, always risk-increasing.
 */
public class ReconstructionScorer implements Scorer {

    private final SequentialNetwork network;
    private final MonotoneCurve errorMapping;
    private final int featureCount;

    public ReconstructionScorer(SequentialNetwork network, MonotoneCurve errorMapping, int featureCount) {
        this.network = network;
        this.errorMapping = errorMapping;
        this.featureCount = featureCount;
    }

    @Override
    public double score(double[] input) {
        double mse = reconstructionError(input);
        return Math.max(0.0, Math.min(1.0, errorMapping.apply(mse)));
    }

    public double reconstructionError(double[] input) {
        double[] squared = squaredErrors(input);
        double sum = 0.0;
        for (double v : squared) {
            sum += v;
        }
        return sum / squared.length;
    }

    @Override
    public boolean supportsNativeAttribution() {
        return true;
    }

    @Override
    public double[] attribute(double[] input) {
        double[] squared = squaredErrors(input);
        for (int i = 0; i < squared.length; i++) {
            squared[i] /= squared.length;
        }
        return squared;
    }

    private double[] squaredErrors(double[] input) {
        if (input.length != featureCount) {
            throw new IllegalArgumentException("Autoencoder expects " + featureCount + " features, got " + input.length);
        }
        double[] reconstruction = network.forward(input);
        if (reconstruction.length != featureCount) {
            throw new IllegalStateException("Autoencoder reconstructed " + reconstruction.length
                    + " values for " + featureCount + " features");
        }
        double[] squared = new double[featureCount];
        for (int i = 0; i < featureCount; i++) {
            double d = input[i] - reconstruction[i];
            if (!Double.isFinite(d)) {
                throw new IllegalStateException("Non-finite reconstruction for feature " + i);
            }
            squared[i] = d * d;
        }
        return squared;
    }
}
