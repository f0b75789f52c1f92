package com.bank.fraudshield.model;

/**
 * Algorithm tag of a base model. Determines which artifact format the bundle
 * loader expects and which attribution method applies during explanation.
 */
public enum Algorithm {
    LOGISTIC_REGRESSION(ModelFamily.ML),
    TREE_ENSEMBLE(ModelFamily.ML),
    FEED_FORWARD(ModelFamily.DL),
    CONVOLUTIONAL(ModelFamily.DL),
    RECURRENT(ModelFamily.DL),
    CONV_RECURRENT(ModelFamily.DL),
    AUTOENCODER(ModelFamily.DL);

    private final ModelFamily defaultFamily;

    Algorithm(ModelFamily defaultFamily) {
        this.defaultFamily = defaultFamily;
    }

    public ModelFamily getDefaultFamily() {
        return defaultFamily;
    }
}
