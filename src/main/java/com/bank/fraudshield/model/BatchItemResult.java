package com.bank.fraudshield.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "One entry of a batch prediction, index-aligned with the request")
public class BatchItemResult {

    @Schema(description = "Zero-based position in the request array", example = "1")
    int index;

    @Schema(description = "Whether this item produced a result", example = "false")
    boolean success;

    @Schema(description = "Prediction, present when success is true")
    EnsembleResult result;

    @Schema(description = "Error, present when success is false")
    ErrorResponse error;

    public static BatchItemResult ok(int index, EnsembleResult result) {
        return BatchItemResult.builder().index(index).success(true).result(result).build();
    }

    public static BatchItemResult failed(int index, ErrorResponse error) {
        return BatchItemResult.builder().index(index).success(false).error(error).build();
    }
}
