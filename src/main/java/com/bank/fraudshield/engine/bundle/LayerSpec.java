package com.bank.fraudshield.engine.bundle;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * One exported network layer. {@code type} is one of {@code dense},
 * {@code conv1d}, {@code lstm}, {@code global_max_pool}, {@code flatten} or
 * {@code dropout} (a no-op at inference).
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class LayerSpec {

    private String type;
    private String activation;

    // dense
    private double[][] weights;
    private double[] bias;

    // conv1d
    private double[][][] kernel3d;
    private String padding = "valid";

    // lstm
    private double[][] kernel;
    private double[][] recurrentKernel;
    private boolean returnSequences;
    private LayerSpec backward;
}
