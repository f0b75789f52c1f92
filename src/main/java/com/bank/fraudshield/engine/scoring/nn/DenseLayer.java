package com.bank.fraudshield.engine.scoring.nn;

/**
 * Fully connected layer applied independently at every time step, with
 * weights stored {@code [inputs][units]}.
 */
public class DenseLayer implements Layer {

    private final double[][] weights;
    private final double[] bias;
    private final Activation activation;

    public DenseLayer(double[][] weights, double[] bias, Activation activation) {
        if (weights.length == 0 || weights[0].length != bias.length) {
            throw new IllegalArgumentException("Dense weights and bias disagree on unit count");
        }
        this.weights = weights;
        this.bias = bias;
        this.activation = activation;
    }

    @Override
    public double[][] forward(double[][] input) {
        double[][] out = new double[input.length][];
        for (int t = 0; t < input.length; t++) {
            out[t] = forwardStep(input[t]);
        }
        return out;
    }

    private double[] forwardStep(double[] x) {
        if (x.length != weights.length) {
            throw new IllegalArgumentException("Dense layer expects " + weights.length + " inputs, got " + x.length);
        }
        int units = bias.length;
        double[] y = new double[units];
        for (int j = 0; j < units; j++) {
            double sum = bias[j];
            for (int i = 0; i < x.length; i++) {
                sum += x[i] * weights[i][j];
            }
            y[j] = activation.apply(sum);
        }
        return y;
    }

    public int getInputSize() {
        return weights.length;
    }

    public int getUnits() {
        return bias.length;
    }
}
