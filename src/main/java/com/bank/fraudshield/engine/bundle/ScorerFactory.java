package com.bank.fraudshield.engine.bundle;

import com.bank.fraudshield.engine.scoring.LogisticRegressionScorer;
import com.bank.fraudshield.engine.scoring.MonotoneCurve;
import com.bank.fraudshield.engine.scoring.ReconstructionScorer;
import com.bank.fraudshield.engine.scoring.Scorer;
import com.bank.fraudshield.engine.scoring.SequentialNetworkScorer;
import com.bank.fraudshield.engine.scoring.TreeEnsembleScorer;
import com.bank.fraudshield.engine.scoring.nn.Activation;
import com.bank.fraudshield.engine.scoring.nn.Conv1DLayer;
import com.bank.fraudshield.engine.scoring.nn.DenseLayer;
import com.bank.fraudshield.engine.scoring.nn.FlattenLayer;
import com.bank.fraudshield.engine.scoring.nn.GlobalMaxPoolLayer;
import com.bank.fraudshield.engine.scoring.nn.Layer;
import com.bank.fraudshield.engine.scoring.nn.LstmLayer;
import com.bank.fraudshield.engine.scoring.nn.SequentialNetwork;
import com.bank.fraudshield.model.Algorithm;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns a parsed artifact into the {@link Scorer} for its algorithm.
 * Shape problems surface as {@link IllegalArgumentException}; the loader
 * wraps them with the model name.
 */
public class ScorerFactory {

    public Scorer create(Algorithm algorithm, ModelArtifact artifact, int featureCount) {
        switch (algorithm) {
            case LOGISTIC_REGRESSION:
                return logistic(artifact, featureCount);
            case TREE_ENSEMBLE:
                return new TreeEnsembleScorer(artifact.getTrees(), artifact.getAggregation(),
                        artifact.getBaseMargin(), featureCount);
            case FEED_FORWARD:
            case CONVOLUTIONAL:
            case RECURRENT:
            case CONV_RECURRENT:
                return new SequentialNetworkScorer(network(artifact), featureCount);
            case AUTOENCODER:
                return reconstruction(artifact, featureCount);
            default:
                throw new IllegalArgumentException("Unsupported algorithm " + algorithm);
        }
    }

    private Scorer logistic(ModelArtifact artifact, int featureCount) {
        double[] coefficients = artifact.getCoefficients();
        if (coefficients == null || coefficients.length != featureCount) {
            throw new IllegalArgumentException("Logistic model needs " + featureCount + " coefficients");
        }
        return new LogisticRegressionScorer(coefficients, artifact.getIntercept());
    }

    private Scorer reconstruction(ModelArtifact artifact, int featureCount) {
        ModelArtifact.CurveSpec mapping = artifact.getErrorMapping();
        if (mapping == null) {
            throw new IllegalArgumentException("Autoencoder artifact has no errorMapping");
        }
        return new ReconstructionScorer(network(artifact),
                new MonotoneCurve(mapping.getX(), mapping.getY()), featureCount);
    }

    SequentialNetwork network(ModelArtifact artifact) {
        List<Layer> layers = new ArrayList<>();
        for (LayerSpec spec : artifact.getLayers()) {
            Layer layer = layer(spec);
            if (layer != null) {
                layers.add(layer);
            }
        }
        return new SequentialNetwork(layers);
    }

    private Layer layer(LayerSpec spec) {
        String type = spec.getType() == null ? "" : spec.getType().toLowerCase(Locale.ROOT);
        switch (type) {
            case "dense":
                require(spec.getWeights() != null && spec.getBias() != null, "dense layer needs weights and bias");
                return new DenseLayer(spec.getWeights(), spec.getBias(), Activation.fromName(spec.getActivation()));
            case "conv1d":
                require(spec.getKernel3d() != null && spec.getBias() != null, "conv1d layer needs kernel3d and bias");
                return new Conv1DLayer(spec.getKernel3d(), spec.getBias(), Activation.fromName(spec.getActivation()),
                        Conv1DLayer.Padding.valueOf(spec.getPadding().toUpperCase(Locale.ROOT)));
            case "lstm":
                LstmLayer.Cell backward = spec.getBackward() != null ? cell(spec.getBackward()) : null;
                return new LstmLayer(cell(spec), backward, spec.isReturnSequences());
            case "global_max_pool":
                return new GlobalMaxPoolLayer();
            case "flatten":
                return new FlattenLayer();
            case "dropout":
                return null;
            default:
                throw new IllegalArgumentException("Unknown layer type '" + spec.getType() + "'");
        }
    }

    private LstmLayer.Cell cell(LayerSpec spec) {
        require(spec.getKernel() != null && spec.getRecurrentKernel() != null && spec.getBias() != null,
                "lstm layer needs kernel, recurrentKernel and bias");
        return new LstmLayer.Cell(spec.getKernel(), spec.getRecurrentKernel(), spec.getBias());
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }
}
