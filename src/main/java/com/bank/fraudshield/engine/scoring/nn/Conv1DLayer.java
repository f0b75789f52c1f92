package com.bank.fraudshield.engine.scoring.nn;

/**
 * Stride-1 temporal convolution with kernel stored
 * {@code [kernelSize][inputChannels][filters]}.
 */
public class Conv1DLayer implements Layer {

    public enum Padding {
        VALID,
        SAME
    }

    private final double[][][] kernel;
    private final double[] bias;
    private final Activation activation;
    private final Padding padding;

    public Conv1DLayer(double[][][] kernel, double[] bias, Activation activation, Padding padding) {
        if (kernel.length == 0 || kernel[0].length == 0 || kernel[0][0].length != bias.length) {
            throw new IllegalArgumentException("Conv1D kernel and bias disagree on filter count");
        }
        this.kernel = kernel;
        this.bias = bias;
        this.activation = activation;
        this.padding = padding;
    }

    @Override
    public double[][] forward(double[][] input) {
        int steps = input.length;
        int channels = kernel[0].length;
        int size = kernel.length;
        int filters = bias.length;

        int padLeft = padding == Padding.SAME ? (size - 1) / 2 : 0;
        int outSteps = padding == Padding.SAME ? steps : steps - size + 1;
        if (outSteps <= 0) {
            throw new IllegalArgumentException("Sequence of " + steps + " steps is shorter than kernel " + size);
        }

        double[][] out = new double[outSteps][filters];
        for (int t = 0; t < outSteps; t++) {
            for (int f = 0; f < filters; f++) {
                double sum = bias[f];
                for (int k = 0; k < size; k++) {
                    int src = t + k - padLeft;
                    if (src < 0 || src >= steps) continue;
                    double[] x = input[src];
                    if (x.length != channels) {
                        throw new IllegalArgumentException(
                                "Conv1D expects " + channels + " channels, got " + x.length);
                    }
                    for (int c = 0; c < channels; c++) {
                        sum += x[c] * kernel[k][c][f];
                    }
                }
                out[t][f] = activation.apply(sum);
            }
        }
        return out;
    }

    @Override
    public boolean consumesSequence() {
        return true;
    }
}
