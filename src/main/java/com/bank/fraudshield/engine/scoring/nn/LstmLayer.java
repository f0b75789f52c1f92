package com.bank.fraudshield.engine.scoring.nn;

/**
 * LSTM layer, optionally bidirectional. Gate order in the packed weights is
 * input, forget, cell, output; cell activation is tanh and gates use a sigmoid.
 * A bidirectional layer concatenates forward then backward outputs.
 */
public class LstmLayer implements Layer {

    private final Cell forward;
    private final Cell backward;
    private final boolean returnSequences;

    public LstmLayer(Cell forward, Cell backward, boolean returnSequences) {
        if (backward != null && backward.units != forward.units) {
            throw new IllegalArgumentException("Bidirectional LSTM directions must have the same units");
        }
        this.forward = forward;
        this.backward = backward;
        this.returnSequences = returnSequences;
    }

    @Override
    public double[][] forward(double[][] input) {
        double[][] fwd = forward.run(input, false);
        if (backward == null) {
            return returnSequences ? fwd : new double[][]{fwd[fwd.length - 1]};
        }
        double[][] bwd = backward.run(input, true);
        if (!returnSequences) {
            // backward direction finishes on the first time step
            return new double[][]{concat(fwd[fwd.length - 1], bwd[0])};
        }
        double[][] out = new double[input.length][];
        for (int t = 0; t < input.length; t++) {
            out[t] = concat(fwd[t], bwd[t]);
        }
        return out;
    }

    @Override
    public boolean consumesSequence() {
        return true;
    }

    public boolean isBidirectional() {
        return backward != null;
    }

    private static double[] concat(double[] a, double[] b) {
        double[] out = new double[a.length + b.length];
        System.arraycopy(a, 0, out, 0, a.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }

    /**
     * Weights of one direction: kernel {@code [inputs][4*units]}, recurrent
     * kernel {@code [units][4*units]}, bias {@code [4*units]}.
     */
    public static class Cell {

        private final double[][] kernel;
        private final double[][] recurrentKernel;
        private final double[] bias;
        private final int units;

        public Cell(double[][] kernel, double[][] recurrentKernel, double[] bias) {
            if (bias.length % 4 != 0) {
                throw new IllegalArgumentException("LSTM bias length must be a multiple of 4");
            }
            this.units = bias.length / 4;
            if (kernel.length == 0 || kernel[0].length != 4 * units
                    || recurrentKernel.length != units || (units > 0 && recurrentKernel[0].length != 4 * units)) {
                throw new IllegalArgumentException("LSTM weight shapes do not match " + units + " units");
            }
            this.kernel = kernel;
            this.recurrentKernel = recurrentKernel;
            this.bias = bias;
        }

        /** Hidden state per time step, indexed in original sequence order. */
        double[][] run(double[][] sequence, boolean reverse) {
            int steps = sequence.length;
            double[] h = new double[units];
            double[] c = new double[units];
            double[][] outputs = new double[steps][];
            double[] z = new double[4 * units];

            for (int n = 0; n < steps; n++) {
                int t = reverse ? steps - 1 - n : n;
                double[] x = sequence[t];
                if (x.length != kernel.length) {
                    throw new IllegalArgumentException("LSTM expects " + kernel.length + " channels, got " + x.length);
                }
                for (int j = 0; j < z.length; j++) {
                    double sum = bias[j];
                    for (int i = 0; i < x.length; i++) {
                        sum += x[i] * kernel[i][j];
                    }
                    for (int u = 0; u < units; u++) {
                        sum += h[u] * recurrentKernel[u][j];
                    }
                    z[j] = sum;
                }
                double[] next = new double[units];
                for (int u = 0; u < units; u++) {
                    double in = Activation.SIGMOID.apply(z[u]);
                    double forget = Activation.SIGMOID.apply(z[units + u]);
                    double candidate = Math.tanh(z[2 * units + u]);
                    double out = Activation.SIGMOID.apply(z[3 * units + u]);
                    c[u] = forget * c[u] + in * candidate;
                    next[u] = out * Math.tanh(c[u]);
                }
                h = next;
                outputs[t] = next;
            }
            return outputs;
        }

        public int getUnits() {
            return units;
        }
    }
}
