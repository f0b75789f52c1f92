package com.bank.fraudshield.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@Schema(description = "One base model's view of a transaction")
public class ModelContribution {

    @Schema(description = "Model key", example = "catboost")
    String modelName;

    @Schema(description = "Human-readable model name", example = "CatBoost")
    String displayName;

    @Schema(description = "Model family", example = "ML")
    ModelFamily family;

    @Schema(description = "Algorithm tag", example = "TREE_ENSEMBLE")
    Algorithm algorithm;

    @Schema(description = "Model's own score; null when unavailable", example = "0.91", nullable = true)
    Double score;

    @Schema(description = "Whether the model produced a score", example = "true")
    boolean available;

    @Schema(description = "Tier this model's score falls into under the active bands", example = "FRAUD")
    RiskClassification classification;

    @Schema(description = "Meta-learner coefficient times the fused slot value", example = "1.73")
    double metaContribution;

    @Schema(description = "metaContribution divided by the sum of absolute contributions", example = "0.21")
    double normalizedContribution;

    @Schema(description = "Whether local feature attribution was computed for this model", example = "true")
    boolean attributed;

    @Schema(description = "Top local feature contributions, empty when not attributed")
    List<FeatureAttribution> topFeatures;
}
