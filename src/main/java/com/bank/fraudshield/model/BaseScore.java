package com.bank.fraudshield.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

/**
 * One base model's output for one feature vector. When the model failed,
 * {@code available} is false, {@code score} is null and {@code failureReason}
 * says why.
 */
@Value
@Builder
@Schema(description = "Output of a single base model")
public class BaseScore {

    @Schema(description = "Model key in the bundle", example = "xgboost")
    String modelName;

    @Schema(description = "Human-readable model name", example = "XGBoost")
    String displayName;

    @Schema(description = "Model family", example = "ML")
    ModelFamily family;

    @Schema(description = "Position of this model in the canonical fusion order", example = "2")
    int slot;

    @Schema(description = "Fraud probability in [0,1]; null when unavailable", example = "0.8123", nullable = true)
    Double score;

    @Schema(description = "Whether the model produced a usable score", example = "true")
    boolean available;

    @Schema(description = "Reason the model was unavailable, if any")
    String failureReason;

    public static BaseScore unavailable(String modelName, String displayName, ModelFamily family,
                                        int slot, String reason) {
        return BaseScore.builder()
                .modelName(modelName)
                .displayName(displayName)
                .family(family)
                .slot(slot)
                .score(null)
                .available(false)
                .failureReason(reason)
                .build();
    }
}
