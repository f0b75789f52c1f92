package com.bank.fraudshield.testutil;

import com.bank.fraudshield.engine.bundle.ModelBundle;
import com.bank.fraudshield.engine.bundle.ModelBundleLoader;
import com.bank.fraudshield.engine.fusion.MetaLearner;
import com.bank.fraudshield.engine.registry.ModelDescriptor;
import com.bank.fraudshield.engine.scaling.FeatureScaler;
import com.bank.fraudshield.engine.scaling.IdentityScaler;
import com.bank.fraudshield.engine.scaling.ScalingPolicy;
import com.bank.fraudshield.engine.schema.FeatureDefinition;
import com.bank.fraudshield.engine.schema.FeatureSchema;
import com.bank.fraudshield.engine.scoring.Scorer;
import com.bank.fraudshield.model.Algorithm;
import com.bank.fraudshield.model.ModelFamily;
import com.bank.fraudshield.model.ScalingVariant;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Bundles for engine tests: the on-disk fixture under src/test/resources and
 * small in-memory bundles built from lambda scorers.
 */
public final class TestBundles {

    public static final Path FIXTURE_PATH = Path.of("src/test/resources/bundles/fixture");

    public static final List<String> FIXTURE_FEATURES =
            List.of("amount_zscore", "velocity_high_1h", "device_critical_risk");

    public static final List<String> FIXTURE_MODELS = List.of("logistic_regression", "random_forest",
            "xgboost", "mlp", "cnn", "bilstm", "autoencoder");

    private TestBundles() {}

    public static ModelBundle loadFixture() {
        return new ModelBundleLoader(new ObjectMapper()).load(FIXTURE_PATH);
    }

    /** Feature map in the fixture schema. */
    public static Map<String, Object> fixtureFeatures(double amount, double velocity, double deviceRisk) {
        Map<String, Object> features = new LinkedHashMap<>();
        features.put("amount_zscore", amount);
        features.put("velocity_high_1h", velocity);
        features.put("device_critical_risk", deviceRisk);
        return features;
    }

    /** Training mean of the fixture; every model scores it low. */
    public static Map<String, Object> fixtureSafe() {
        return fixtureFeatures(0.0, 2.0, 0.1);
    }

    /** Calibrated probability ~0.49: SUSPICIOUS and above the 0.40 threshold. */
    public static Map<String, Object> fixtureSuspicious() {
        return fixtureFeatures(1.0, 4.0, 0.45);
    }

    /** Calibrated probability ~0.91. */
    public static Map<String, Object> fixtureFraud() {
        return fixtureFeatures(3.0, 9.0, 0.9);
    }

    public static Scorer scorer(ToDoubleFunction<double[]> fn) {
        return fn::applyAsDouble;
    }

    public static Scorer constant(double score) {
        return input -> score;
    }

    public static Scorer failing(String message) {
        return input -> {
            throw new IllegalStateException(message);
        };
    }

    public static Scorer sleeping(long millis, double score) {
        return input -> {
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted", e);
            }
            return score;
        };
    }

    public static ModelDescriptor descriptor(String name, ModelFamily family, int slot, Scorer scorer) {
        return ModelDescriptor.builder()
                .name(name)
                .displayName(name.toUpperCase())
                .family(family)
                .algorithm(family == ModelFamily.ML ? Algorithm.LOGISTIC_REGRESSION : Algorithm.FEED_FORWARD)
                .scaling(ScalingVariant.NONE)
                .slot(slot)
                .scorer(scorer)
                .build();
    }

    /**
     * In-memory bundle over features f0, f1, f2 with unscaled inputs, a meta-learner
     * that weights every slot 2.0 with intercept -n, fallbacks 0.5, no calibrator
     * and threshold 0.4. Even slots are ML, odd slots DL.
     */
    public static ModelBundle inMemory(Scorer... scorers) {
        double[] coefficients = new double[scorers.length];
        Arrays.fill(coefficients, 2.0);
        return inMemoryWithMeta(coefficients, -scorers.length, scorers);
    }

    /** Like {@link #inMemory} but with explicit meta-learner coefficients and intercept. */
    public static ModelBundle inMemoryWithMeta(double[] coefficients, double intercept, Scorer... scorers) {
        List<ModelDescriptor> models = new ArrayList<>();
        for (int i = 0; i < scorers.length; i++) {
            ModelFamily family = i % 2 == 0 ? ModelFamily.ML : ModelFamily.DL;
            models.add(descriptor("model_" + i, family, i, scorers[i]));
        }
        double[] fallbacks = new double[scorers.length];
        Arrays.fill(fallbacks, 0.5);

        FeatureSchema schema = new FeatureSchema("mem-1", List.of(
                FeatureDefinition.of("f0"), FeatureDefinition.of("f1"), FeatureDefinition.of("f2")));
        Map<ScalingVariant, FeatureScaler> scalers = new EnumMap<>(ScalingVariant.class);
        scalers.put(ScalingVariant.NONE, new IdentityScaler(3));
        ScalingPolicy policy = new ScalingPolicy(scalers, EnumSet.of(ScalingVariant.NONE));

        return new ModelBundle("mem-bundle", schema, policy, models,
                new MetaLearner(coefficients, intercept, fallbacks), null, 0.4, new double[3]);
    }

    public static Map<String, Object> memFeatures(double f0, double f1, double f2) {
        Map<String, Object> features = new LinkedHashMap<>();
        features.put("f0", f0);
        features.put("f1", f1);
        features.put("f2", f2);
        return features;
    }
}
