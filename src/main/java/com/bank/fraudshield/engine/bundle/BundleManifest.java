package com.bank.fraudshield.engine.bundle;

import com.bank.fraudshield.engine.schema.FeatureDefinition;
import com.bank.fraudshield.model.Algorithm;
import com.bank.fraudshield.model.ModelFamily;
import com.bank.fraudshield.model.ScalingVariant;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Jackson view of {@code bundle.json}, the entry point of a model bundle
 * directory. Model artifacts are referenced by path relative to the directory.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class BundleManifest {

    private String bundleVersion;
    private SchemaSpec featureSchema;
    private ScalerSpecs scalers = new ScalerSpecs();
    // Raw-space reference point for occlusion; defaults to the standard scaler mean
    private double[] baseline;
    private List<ModelSpec> models = new ArrayList<>();
    private MetaLearnerSpec metaLearner;
    private CalibratorSpec calibrator;
    private DecisionSpec decision;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SchemaSpec {
        private String version;
        private List<FeatureDefinition> features = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ScalerSpecs {
        private StandardSpec standard;
        private MinMaxSpec minMax;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StandardSpec {
        private double[] mean;
        private double[] scale;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MinMaxSpec {
        private double[] dataMin;
        private double[] dataMax;
        private double rangeMin = 0.0;
        private double rangeMax = 1.0;
        private boolean clip = false;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ModelSpec {
        private String name;
        private String displayName;
        // Optional; derived from the algorithm when absent
        private ModelFamily family;
        private Algorithm algorithm;
        private ScalingVariant scaling = ScalingVariant.NONE;
        private String artifact;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MetaLearnerSpec {
        private double[] coefficients;
        private double intercept;
        private double[] fallbacks;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CalibratorSpec {
        private String type;
        private double a;
        private double b;
        private double[] x;
        private double[] y;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DecisionSpec {
        private double threshold = 0.5;
    }
}
