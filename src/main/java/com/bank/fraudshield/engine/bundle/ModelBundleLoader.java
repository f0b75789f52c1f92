package com.bank.fraudshield.engine.bundle;

import com.bank.fraudshield.engine.fusion.Calibrator;
import com.bank.fraudshield.engine.fusion.IsotonicCalibrator;
import com.bank.fraudshield.engine.fusion.MetaLearner;
import com.bank.fraudshield.engine.fusion.PlattCalibrator;
import com.bank.fraudshield.engine.registry.ModelDescriptor;
import com.bank.fraudshield.engine.scaling.FeatureScaler;
import com.bank.fraudshield.engine.scaling.IdentityScaler;
import com.bank.fraudshield.engine.scaling.MinMaxScaler;
import com.bank.fraudshield.engine.scaling.ScalingPolicy;
import com.bank.fraudshield.engine.scaling.StandardScaler;
import com.bank.fraudshield.engine.schema.FeatureSchema;
import com.bank.fraudshield.engine.scoring.Scorer;
import com.bank.fraudshield.exception.BundleLoadException;
import com.bank.fraudshield.model.ScalingVariant;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads a bundle directory and builds the {@link ModelBundle}. Any missing
 * file, unknown format or shape mismatch fails the whole load with a
 * {@link BundleLoadException}; a partially loaded bundle is never returned.
 */
public class ModelBundleLoader {

    private static final Logger log = LoggerFactory.getLogger(ModelBundleLoader.class);

    public static final String MANIFEST_FILE = "bundle.json";

    private final ObjectMapper objectMapper;
    private final ScorerFactory scorerFactory;

    public ModelBundleLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true);
        this.scorerFactory = new ScorerFactory();
    }

    public ModelBundle load(Path bundleDir) {
        if (bundleDir == null || !Files.isDirectory(bundleDir)) {
            throw new BundleLoadException("Bundle directory not found: " + bundleDir);
        }
        Path manifestPath = bundleDir.resolve(MANIFEST_FILE);
        BundleManifest manifest = read(manifestPath, BundleManifest.class);

        if (manifest.getBundleVersion() == null || manifest.getBundleVersion().isBlank()) {
            throw new BundleLoadException("bundleVersion is missing in " + manifestPath);
        }

        FeatureSchema schema = schema(manifest);
        int featureCount = schema.size();
        Map<ScalingVariant, FeatureScaler> scalers = scalers(manifest, featureCount);
        List<ModelDescriptor> models = models(manifest, bundleDir, featureCount);

        Set<ScalingVariant> required = EnumSet.noneOf(ScalingVariant.class);
        models.forEach(m -> required.add(m.getScaling()));
        ScalingPolicy scalingPolicy;
        try {
            scalingPolicy = new ScalingPolicy(scalers, required);
        } catch (IllegalArgumentException e) {
            throw new BundleLoadException("Scaler configuration is incomplete: " + e.getMessage(), e);
        }

        MetaLearner metaLearner = metaLearner(manifest, models.size());
        Calibrator calibrator = calibrator(manifest.getCalibrator());
        double threshold = manifest.getDecision() != null ? manifest.getDecision().getThreshold() : 0.5;
        double[] baseline = baseline(manifest, scalers, featureCount);

        try {
            ModelBundle bundle = new ModelBundle(manifest.getBundleVersion(), schema, scalingPolicy, models,
                    metaLearner, calibrator, threshold, baseline);
            log.info("Loaded model bundle {} from {}: {} features (schema {}), {} models, calibrator={}, threshold={}",
                    bundle.getVersion(), bundleDir, featureCount, schema.getVersion(), models.size(),
                    bundle.getCalibrator().getType(), threshold);
            return bundle;
        } catch (IllegalArgumentException e) {
            throw new BundleLoadException("Inconsistent bundle " + manifest.getBundleVersion() + ": " + e.getMessage(), e);
        }
    }

    private FeatureSchema schema(BundleManifest manifest) {
        BundleManifest.SchemaSpec spec = manifest.getFeatureSchema();
        if (spec == null || spec.getFeatures() == null || spec.getFeatures().isEmpty()) {
            throw new BundleLoadException("Bundle declares no feature schema");
        }
        try {
            return new FeatureSchema(spec.getVersion() != null ? spec.getVersion() : manifest.getBundleVersion(),
                    spec.getFeatures());
        } catch (IllegalArgumentException e) {
            throw new BundleLoadException("Invalid feature schema: " + e.getMessage(), e);
        }
    }

    private Map<ScalingVariant, FeatureScaler> scalers(BundleManifest manifest, int featureCount) {
        Map<ScalingVariant, FeatureScaler> scalers = new EnumMap<>(ScalingVariant.class);
        scalers.put(ScalingVariant.NONE, new IdentityScaler(featureCount));
        if (manifest.getScalers() == null) {
            return scalers;
        }

        BundleManifest.StandardSpec standard = manifest.getScalers().getStandard();
        if (standard != null) {
            checkLength("standard.mean", standard.getMean(), featureCount);
            checkLength("standard.scale", standard.getScale(), featureCount);
            scalers.put(ScalingVariant.STANDARD, new StandardScaler(standard.getMean(), standard.getScale()));
        }
        BundleManifest.MinMaxSpec minMax = manifest.getScalers().getMinMax();
        if (minMax != null) {
            checkLength("minMax.dataMin", minMax.getDataMin(), featureCount);
            checkLength("minMax.dataMax", minMax.getDataMax(), featureCount);
            try {
                scalers.put(ScalingVariant.MIN_MAX, new MinMaxScaler(minMax.getDataMin(), minMax.getDataMax(),
                        minMax.getRangeMin(), minMax.getRangeMax(), minMax.isClip()));
            } catch (IllegalArgumentException e) {
                throw new BundleLoadException("Invalid min-max scaler: " + e.getMessage(), e);
            }
        }
        return scalers;
    }

    private List<ModelDescriptor> models(BundleManifest manifest, Path bundleDir, int featureCount) {
        List<ModelDescriptor> models = new ArrayList<>();
        Set<String> names = new HashSet<>();
        if (manifest.getModels() == null || manifest.getModels().isEmpty()) {
            throw new BundleLoadException("Bundle declares no base models");
        }
        int slot = 0;
        for (BundleManifest.ModelSpec spec : manifest.getModels()) {
            if (spec == null || spec.getName() == null || spec.getAlgorithm() == null
                    || spec.getScaling() == null || spec.getArtifact() == null) {
                throw new BundleLoadException("Model at slot " + slot + " needs name, algorithm, scaling and artifact");
            }
            if (!names.add(spec.getName())) {
                throw new BundleLoadException("Duplicate model name: " + spec.getName());
            }
            Path artifactPath = bundleDir.resolve(spec.getArtifact()).normalize();
            if (!artifactPath.startsWith(bundleDir.normalize())) {
                throw new BundleLoadException("Artifact of " + spec.getName() + " points outside the bundle");
            }
            ModelArtifact artifact = read(artifactPath, ModelArtifact.class);

            Scorer scorer;
            try {
                scorer = scorerFactory.create(spec.getAlgorithm(), artifact, featureCount);
            } catch (RuntimeException e) {
                throw new BundleLoadException("Cannot build model " + spec.getName() + ": " + e.getMessage(), e);
            }

            models.add(ModelDescriptor.builder()
                    .name(spec.getName())
                    .displayName(spec.getDisplayName())
                    .family(spec.getFamily() != null ? spec.getFamily() : spec.getAlgorithm().getDefaultFamily())
                    .algorithm(spec.getAlgorithm())
                    .scaling(spec.getScaling())
                    .slot(slot)
                    .scorer(scorer)
                    .build());
            log.info("Registered base model [{}] {} ({}, {}, scaling={})",
                    slot, spec.getName(), spec.getAlgorithm(), models.get(slot).getFamily(), spec.getScaling());
            slot++;
        }
        return models;
    }

    private MetaLearner metaLearner(BundleManifest manifest, int modelCount) {
        BundleManifest.MetaLearnerSpec spec = manifest.getMetaLearner();
        if (spec == null || spec.getCoefficients() == null) {
            throw new BundleLoadException("Bundle has no meta-learner");
        }
        checkLength("metaLearner.coefficients", spec.getCoefficients(), modelCount);
        double[] fallbacks = spec.getFallbacks();
        if (fallbacks == null) {
            fallbacks = new double[modelCount];
            Arrays.fill(fallbacks, 0.5);
            log.warn("Meta-learner declares no fallbacks; unavailable slots will be imputed with 0.5");
        }
        checkLength("metaLearner.fallbacks", fallbacks, modelCount);
        return new MetaLearner(spec.getCoefficients(), spec.getIntercept(), fallbacks);
    }

    private Calibrator calibrator(BundleManifest.CalibratorSpec spec) {
        if (spec == null || spec.getType() == null) {
            return null;
        }
        try {
            switch (spec.getType().toUpperCase(Locale.ROOT)) {
                case "PLATT":
                    return new PlattCalibrator(spec.getA(), spec.getB());
                case "ISOTONIC":
                    return new IsotonicCalibrator(spec.getX(), spec.getY());
                case "NONE":
                    return null;
                default:
                    throw new BundleLoadException("Unknown calibrator type: " + spec.getType());
            }
        } catch (IllegalArgumentException e) {
            throw new BundleLoadException("Invalid calibrator: " + e.getMessage(), e);
        }
    }

    private double[] baseline(BundleManifest manifest, Map<ScalingVariant, FeatureScaler> scalers, int featureCount) {
        if (manifest.getBaseline() != null) {
            checkLength("baseline", manifest.getBaseline(), featureCount);
            return manifest.getBaseline();
        }
        FeatureScaler standard = scalers.get(ScalingVariant.STANDARD);
        if (standard instanceof StandardScaler s) {
            return s.getMean();
        }
        BundleManifest.MinMaxSpec minMax = manifest.getScalers() != null ? manifest.getScalers().getMinMax() : null;
        if (minMax != null) {
            // midpoint of the training range
            double[] mid = new double[featureCount];
            for (int i = 0; i < featureCount; i++) {
                mid[i] = (minMax.getDataMin()[i] + minMax.getDataMax()[i]) / 2.0;
            }
            return mid;
        }
        log.warn("Bundle has no baseline or scaler statistics; occlusion will use a zero baseline");
        return new double[featureCount];
    }

    private <T> T read(Path path, Class<T> type) {
        if (!Files.isRegularFile(path)) {
            throw new BundleLoadException("Bundle file not found: " + path);
        }
        try {
            return objectMapper.readValue(path.toFile(), type);
        } catch (IOException e) {
            throw new BundleLoadException("Cannot parse " + path + ": " + e.getMessage(), e);
        }
    }

    private static void checkLength(String field, double[] values, int expected) {
        if (values == null || values.length != expected) {
            throw new BundleLoadException(field + " must have " + expected + " values, got "
                    + (values == null ? "none" : values.length));
        }
    }
}
