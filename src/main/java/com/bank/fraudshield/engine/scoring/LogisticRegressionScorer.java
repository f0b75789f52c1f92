package com.bank.fraudshield.engine.scoring;

import java.util.Arrays;

/**
 * p = sigmoid(intercept + w . x). Attribution is w_i * x_i in logit space,
 * which for standardized input is the contribution relative to the training mean.
 */
public class LogisticRegressionScorer implements Scorer {

    private final double[] coefficients;
    private final double intercept;

    public LogisticRegressionScorer(double[] coefficients, double intercept) {
        this.coefficients = Arrays.copyOf(coefficients, coefficients.length);
        this.intercept = intercept;
    }

    @Override
    public double score(double[] input) {
        checkDimension(input);
        double z = intercept;
        for (int i = 0; i < coefficients.length; i++) {
            z += coefficients[i] * input[i];
        }
        return Sigmoid.apply(z);
    }

    @Override
    public boolean supportsNativeAttribution() {
        return true;
    }

    @Override
    public double[] attribute(double[] input) {
        checkDimension(input);
        double[] contributions = new double[coefficients.length];
        for (int i = 0; i < coefficients.length; i++) {
            contributions[i] = coefficients[i] * input[i];
        }
        return contributions;
    }

    private void checkDimension(double[] input) {
        if (input.length != coefficients.length) {
            throw new IllegalArgumentException(
                    "Logistic model expects " + coefficients.length + " features, got " + input.length);
        }
    }
}
