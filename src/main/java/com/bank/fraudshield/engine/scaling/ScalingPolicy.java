package com.bank.fraudshield.engine.scaling;

import com.bank.fraudshield.model.FeatureVector;
import com.bank.fraudshield.model.ScalingVariant;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Produces, for one validated vector, the scaled view each required scaling
 * variant needs. Statistics always come from the bundle; nothing is refitted.
 */
public class ScalingPolicy {

    private final Map<ScalingVariant, FeatureScaler> scalers;
    private final Set<ScalingVariant> requiredVariants;

    public ScalingPolicy(Map<ScalingVariant, FeatureScaler> scalers, Set<ScalingVariant> requiredVariants) {
        for (ScalingVariant variant : requiredVariants) {
            if (!scalers.containsKey(variant)) {
                throw new IllegalArgumentException("No scaler available for required variant " + variant);
            }
        }
        EnumMap<ScalingVariant, FeatureScaler> copy = new EnumMap<>(ScalingVariant.class);
        copy.putAll(scalers);
        this.scalers = Collections.unmodifiableMap(copy);
        this.requiredVariants = Set.copyOf(requiredVariants);
    }

    public ScaledViews apply(FeatureVector vector) {
        double[] raw = vector.toArray();
        EnumMap<ScalingVariant, double[]> views = new EnumMap<>(ScalingVariant.class);
        for (ScalingVariant variant : requiredVariants) {
            views.put(variant, scalers.get(variant).transform(raw));
        }
        return new ScaledViews(vector, views);
    }

    public FeatureScaler getScaler(ScalingVariant variant) {
        FeatureScaler scaler = scalers.get(variant);
        if (scaler == null) {
            throw new IllegalArgumentException("No scaler for variant " + variant);
        }
        return scaler;
    }

    public Set<ScalingVariant> getAvailableVariants() {
        return scalers.keySet();
    }

    public Set<ScalingVariant> getRequiredVariants() {
        return requiredVariants;
    }
}
