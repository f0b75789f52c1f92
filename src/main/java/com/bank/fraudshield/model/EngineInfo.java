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
@Schema(description = "Bundle, threshold and model metadata")
public class EngineInfo {

    @Schema(example = "2025.11-meta-v3")
    private String bundleVersion;

    @Schema(example = "features-63-v2")
    private String featureSchemaVersion;

    private Thresholds thresholds;

    @Schema(description = "Minimum successful base models per request", example = "10")
    private int minQuorum;

    @Schema(description = "Base models in canonical fusion order")
    private List<ModelSummary> modelList;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Thresholds {
        @Schema(description = "Operating threshold T for the binary decision", example = "0.4")
        private double threshold;
        @Schema(description = "SAFE below this probability", example = "0.3")
        private double safeBelow;
        @Schema(description = "FRAUD at or above this probability", example = "0.7")
        private double fraudAtOrAbove;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ModelSummary {
        private int slot;
        private String name;
        private String displayName;
        private ModelFamily family;
        private Algorithm algorithm;
        private ScalingVariant scaling;
    }
}
