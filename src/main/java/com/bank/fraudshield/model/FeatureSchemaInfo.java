package com.bank.fraudshield.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Expected input features")
public class FeatureSchemaInfo {

    @Schema(example = "features-63-v2")
    private String schemaVersion;

    @Schema(example = "63")
    private int expectedFeatureCount;

    @Schema(description = "Feature names in canonical order")
    private List<String> featureNames;

    @Schema(description = "Scaling variants the bundle provides")
    private List<ScalingVariant> availableScalers;

    @Schema(description = "Unknown-key handling", example = "REJECT")
    private String extraFeaturePolicy;
}
