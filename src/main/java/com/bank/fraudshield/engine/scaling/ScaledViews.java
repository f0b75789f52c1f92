package com.bank.fraudshield.engine.scaling;

import com.bank.fraudshield.model.FeatureVector;
import com.bank.fraudshield.model.ScalingVariant;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * The scaled variants of one feature vector, keyed by scaling variant.
 */
public final class ScaledViews {

    private final FeatureVector source;
    private final Map<ScalingVariant, double[]> views;

    ScaledViews(FeatureVector source, EnumMap<ScalingVariant, double[]> views) {
        this.source = source;
        this.views = Collections.unmodifiableMap(views);
    }

    public FeatureVector getSource() {
        return source;
    }

    public boolean has(ScalingVariant variant) {
        return views.containsKey(variant);
    }

    /** Returns a copy so that scorers cannot disturb each other's input. */
    public double[] get(ScalingVariant variant) {
        double[] view = views.get(variant);
        if (view == null) {
            throw new IllegalStateException("No scaled view for variant " + variant);
        }
        return Arrays.copyOf(view, view.length);
    }
}
