package com.bank.fraudshield.engine.explain;

import com.bank.fraudshield.engine.registry.ModelDescriptor;
import com.bank.fraudshield.model.ModelFamily;

/**
 * Picks the attribution method for a model. Classical models always use
 * their native decomposition; neural models follow the configured mode.
 */
public final class AttributionAdapters {

    private static final AttributionAdapter NATIVE = new NativeAttribution();
    private static final AttributionAdapter OCCLUSION = new OcclusionAttribution();

    private AttributionAdapters() {}

    /** Returns null when the model is left out of attribution. */
    public static AttributionAdapter select(ModelDescriptor model, DlAttributionMode dlMode) {
        boolean nativeSupport = model.getScorer().supportsNativeAttribution();
        if (model.getFamily() == ModelFamily.ML) {
            return nativeSupport ? NATIVE : OCCLUSION;
        }
        if (dlMode == DlAttributionMode.NONE) {
            return null;
        }
        return nativeSupport ? NATIVE : OCCLUSION;
    }
}
