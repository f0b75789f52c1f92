package com.bank.fraudshield.engine.scoring.nn;

/**
 * One inference-only layer. Tensors are {@code double[timesteps][channels]};
 * a flat vector is a single time step.
 */
public interface Layer {

    double[][] forward(double[][] input);

    /** Whether this layer reads its input as a sequence rather than a flat vector. */
    default boolean consumesSequence() {
        return false;
    }
}
