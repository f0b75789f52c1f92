package com.bank.fraudshield.engine.bundle;

import com.bank.fraudshield.engine.fusion.Calibrator;
import com.bank.fraudshield.engine.fusion.IdentityCalibrator;
import com.bank.fraudshield.engine.fusion.MetaLearner;
import com.bank.fraudshield.engine.registry.ModelDescriptor;
import com.bank.fraudshield.engine.scaling.ScalingPolicy;
import com.bank.fraudshield.engine.schema.FeatureContractValidator;
import com.bank.fraudshield.engine.schema.FeatureSchema;
import com.bank.fraudshield.model.ModelFamily;

import java.util.Arrays;
import java.util.List;

/**
 * Versioned, immutable artifact set the whole engine scores against:
 * feature schema, scalers, base models in canonical order, meta-learner,
 * calibrator and decision threshold. Loaded once at startup.
 */
public final class ModelBundle {

    private final String version;
    private final FeatureSchema schema;
    private final FeatureContractValidator validator;
    private final ScalingPolicy scalingPolicy;
    private final List<ModelDescriptor> models;
    private final MetaLearner metaLearner;
    private final Calibrator calibrator;
    private final boolean calibrated;
    private final double threshold;
    private final double[] baseline;

    public ModelBundle(String version, FeatureSchema schema, ScalingPolicy scalingPolicy,
                       List<ModelDescriptor> models, MetaLearner metaLearner, Calibrator calibrator,
                       double threshold, double[] baseline) {
        if (models.isEmpty()) {
            throw new IllegalArgumentException("Bundle has no base models");
        }
        for (int i = 0; i < models.size(); i++) {
            if (models.get(i).getSlot() != i) {
                throw new IllegalArgumentException("Model " + models.get(i).getName()
                        + " has slot " + models.get(i).getSlot() + " but is at position " + i);
            }
        }
        if (metaLearner.getSlotCount() != models.size()) {
            throw new IllegalArgumentException("Meta-learner expects " + metaLearner.getSlotCount()
                    + " base models, bundle has " + models.size());
        }
        if (!(threshold >= 0.0 && threshold <= 1.0)) {
            throw new IllegalArgumentException("Decision threshold must be in [0,1], got " + threshold);
        }
        if (baseline.length != schema.size()) {
            throw new IllegalArgumentException("Baseline has " + baseline.length
                    + " values for " + schema.size() + " features");
        }
        this.version = version;
        this.schema = schema;
        this.validator = new FeatureContractValidator(schema);
        this.scalingPolicy = scalingPolicy;
        this.models = List.copyOf(models);
        this.metaLearner = metaLearner;
        this.calibrated = calibrator != null;
        this.calibrator = calibrator != null ? calibrator : new IdentityCalibrator();
        this.threshold = threshold;
        this.baseline = Arrays.copyOf(baseline, baseline.length);
    }

    public String getVersion() {
        return version;
    }

    public FeatureSchema getSchema() {
        return schema;
    }

    public FeatureContractValidator getValidator() {
        return validator;
    }

    public ScalingPolicy getScalingPolicy() {
        return scalingPolicy;
    }

    public List<ModelDescriptor> getModels() {
        return models;
    }

    public MetaLearner getMetaLearner() {
        return metaLearner;
    }

    public Calibrator getCalibrator() {
        return calibrator;
    }

    public boolean isCalibrated() {
        return calibrated;
    }

    public double getThreshold() {
        return threshold;
    }

    /** Raw-space reference vector (training mean) used for occlusion. */
    public double[] getBaseline() {
        return Arrays.copyOf(baseline, baseline.length);
    }

    public long countFamily(ModelFamily family) {
        return models.stream().filter(m -> m.getFamily() == family).count();
    }
}
