package com.bank.fraudshield.engine.scoring;

/**
 * Uniform scoring capability over every base model family.
 * Implementations are immutable after construction and safe to call from many
 * threads at once.
 */
public interface Scorer {

    /**
     * Fraud probability in [0,1] for an input already scaled the way the model
     * was trained.
     */
    double score(double[] input);

    /**
     * Whether {@link #attribute(double[])} is available without falling back to
     * a model-agnostic method.
     */
    default boolean supportsNativeAttribution() {
        return false;
    }

    /**
     * Signed per-feature contributions to this model's output; positive values
     * push towards fraud. Units are model-specific (logit, margin or
     * probability), so callers normalize before comparing models.
     */
    default double[] attribute(double[] input) {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " has no native attribution");
    }
}
