package com.bank.fraudshield.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@Schema(description = "Fused, calibrated and thresholded ensemble prediction")
public class EnsembleResult {

    @Schema(description = "Meta-learner output before calibration", example = "0.4312")
    double rawProbability;

    @Schema(description = "Calibrated fraud probability in [0,1]", example = "0.4000")
    double calibratedProbability;

    @Schema(description = "Operating threshold T applied for the binary decision", example = "0.4")
    double threshold;

    @Schema(description = "calibratedProbability >= threshold", example = "true")
    boolean fraudDecision;

    @Schema(description = "Three-tier classification", example = "SUSPICIOUS")
    RiskClassification classification;

    @Schema(description = "Certainty in [0,1], 2*|p-0.5|", example = "0.2")
    double confidence;

    @Schema(description = "Bundle version that produced this result", example = "2025.11-meta-v3")
    String bundleVersion;

    @Schema(description = "Wall-clock inference time in milliseconds", example = "12.4")
    double inferenceTimeMs;

    @Schema(description = "Base model participation")
    ModelStats modelStats;

    @Schema(description = "Per-model scores in canonical order")
    List<BaseScore> baseScores;
}
