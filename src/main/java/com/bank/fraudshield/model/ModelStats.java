package com.bank.fraudshield.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@Schema(description = "How many base models took part in a prediction")
public class ModelStats {

    @Schema(description = "Classical ML models that produced a score", example = "5")
    int mlModelsUsed;

    @Schema(description = "Deep learning models that produced a score", example = "8")
    int dlModelsUsed;

    @Schema(description = "Total base models in the bundle", example = "13")
    int totalBaseModels;

    @Schema(description = "Models whose slot was imputed from the bundle fallback")
    List<String> unavailableModels;
}
