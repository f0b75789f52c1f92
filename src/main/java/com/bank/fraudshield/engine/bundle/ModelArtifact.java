package com.bank.fraudshield.engine.bundle;

import com.bank.fraudshield.engine.scoring.TreeEnsembleScorer;
import com.bank.fraudshield.engine.scoring.TreeNode;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Jackson view of one model artifact file. Which fields are populated depends
 * on the model's algorithm:
 * <ul>
 *   <li>logistic regression: {@code coefficients}, {@code intercept}</li>
 *   <li>tree ensemble: {@code trees}, {@code aggregation}, {@code baseMargin}</li>
 *   <li>neural networks: {@code layers}</li>
 *   <li>autoencoder: {@code layers} plus {@code errorMapping}</li>
 * </ul>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelArtifact {

    private double[] coefficients;
    private double intercept;

    private List<TreeNode> trees = new ArrayList<>();
    private TreeEnsembleScorer.Aggregation aggregation = TreeEnsembleScorer.Aggregation.AVERAGE;
    private double baseMargin;

    private List<LayerSpec> layers = new ArrayList<>();

    private CurveSpec errorMapping;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CurveSpec {
        private double[] x;
        private double[] y;
    }
}
