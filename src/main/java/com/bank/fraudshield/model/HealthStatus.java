package com.bank.fraudshield.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Engine health and loaded-model summary")
public class HealthStatus {

    @Schema(description = "Overall status", example = "UP")
    private String status;

    @Schema(description = "What is loaded")
    private ModelsLoaded modelsLoaded;

    @Schema(description = "Active bundle version", example = "2025.11-meta-v3")
    private String bundleVersion;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ModelsLoaded {
        private int mlCount;
        private int dlCount;
        // always true once started: the loader refuses bundles without a meta-learner
        private boolean metaLearnerPresent;
        @Schema(description = "Whether the bundle applies a fitted calibrator after the meta-learner", example = "true")
        private boolean calibrated;
        private boolean explainerReady;
    }
}
