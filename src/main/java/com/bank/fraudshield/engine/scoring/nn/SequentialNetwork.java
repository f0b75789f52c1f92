package com.bank.fraudshield.engine.scoring.nn;

import java.util.List;

/**
 * Ordered stack of layers. A flat input vector of N features enters as
 * N time steps of one channel when the first layer consumes sequences,
 * and as a single time step otherwise.
 */
public class SequentialNetwork {

    private final List<Layer> layers;
    private final boolean sequenceInput;

    public SequentialNetwork(List<Layer> layers) {
        if (layers == null || layers.isEmpty()) {
            throw new IllegalArgumentException("Network needs at least one layer");
        }
        this.layers = List.copyOf(layers);
        this.sequenceInput = this.layers.get(0).consumesSequence();
    }

    /** Runs the network and returns the final output flattened. */
    public double[] forward(double[] input) {
        double[][] tensor = sequenceInput ? asSequence(input) : new double[][]{input};
        for (Layer layer : layers) {
            tensor = layer.forward(tensor);
        }
        return new FlattenLayer().forward(tensor)[0];
    }

    public int depth() {
        return layers.size();
    }

    public boolean isSequenceInput() {
        return sequenceInput;
    }

    private static double[][] asSequence(double[] input) {
        double[][] seq = new double[input.length][1];
        for (int i = 0; i < input.length; i++) {
            seq[i][0] = input[i];
        }
        return seq;
    }
}
