package com.bank.fraudshield.engine.registry;

import com.bank.fraudshield.engine.scoring.Scorer;
import com.bank.fraudshield.model.Algorithm;
import com.bank.fraudshield.model.ModelFamily;
import com.bank.fraudshield.model.ScalingVariant;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Identity and loaded scorer of one base model. Built once by the bundle
 * loader and shared read-only.
 */
@Value
@Builder
public class ModelDescriptor {

    @NonNull String name;
    String displayName;
    @NonNull ModelFamily family;
    @NonNull Algorithm algorithm;
    @NonNull ScalingVariant scaling;
    int slot;
    @NonNull Scorer scorer;

    public String getDisplayName() {
        return displayName != null ? displayName : name;
    }
}
