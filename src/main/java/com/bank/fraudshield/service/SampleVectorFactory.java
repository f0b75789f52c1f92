package com.bank.fraudshield.service;

import com.bank.fraudshield.engine.bundle.ModelBundle;
import com.bank.fraudshield.engine.scaling.FeatureScaler;
import com.bank.fraudshield.engine.scaling.ScalingPolicy;
import com.bank.fraudshield.model.ScalingVariant;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Synthetic feature maps for smoke testing. Values are drawn in the scaled
 * space of the bundle's standard (or min-max) scaler and mapped back to raw
 * units, so they land in realistic ranges. The generator is re-seeded on
 * every call, so a profile always yields the same map.
 */
public class SampleVectorFactory {

    public enum Profile {
        NORMAL,
        FRAUD
    }

    static final long SEED = 42L;

    // Leading features that the fraud profile pushes hardest
    static final int STRONG_INDICATORS = 10;

    private final ModelBundle bundle;

    public SampleVectorFactory(ModelBundle bundle) {
        this.bundle = bundle;
    }

    public Map<String, Double> create(Profile profile) {
        List<String> names = bundle.getSchema().getNames();
        int n = names.size();
        Random random = new Random(SEED);
        ScalingPolicy policy = bundle.getScalingPolicy();

        double[] raw;
        if (policy.getAvailableVariants().contains(ScalingVariant.STANDARD)) {
            double[] z = new double[n];
            for (int i = 0; i < n; i++) {
                z[i] = profile == Profile.FRAUD
                        ? (i < STRONG_INDICATORS ? uniform(random, 2.5, 4.0) : uniform(random, 0.5, 1.5))
                        : uniform(random, -0.5, 0.5);
            }
            raw = policy.getScaler(ScalingVariant.STANDARD).inverseTransform(z);
        } else {
            double[] u = new double[n];
            for (int i = 0; i < n; i++) {
                u[i] = profile == Profile.FRAUD
                        ? (i < STRONG_INDICATORS ? uniform(random, 0.7, 1.0) : uniform(random, 0.3, 0.8))
                        : (i < STRONG_INDICATORS ? uniform(random, 0.0, 0.3) : uniform(random, 0.1, 0.5));
            }
            FeatureScaler minMax = policy.getAvailableVariants().contains(ScalingVariant.MIN_MAX)
                    ? policy.getScaler(ScalingVariant.MIN_MAX) : null;
            raw = minMax != null ? minMax.inverseTransform(u) : u;
        }

        Map<String, Double> sample = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            sample.put(names.get(i), raw[i]);
        }
        return sample;
    }

    private static double uniform(Random random, double lo, double hi) {
        return lo + (hi - lo) * random.nextDouble();
    }
}
