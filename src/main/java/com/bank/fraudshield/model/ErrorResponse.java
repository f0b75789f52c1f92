package com.bank.fraudshield.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Typed error returned to callers")
public class ErrorResponse {

    @Schema(description = "Stable error code", example = "ERR-SCHEMA-001")
    String errorCode;

    @Schema(description = "Error type", example = "SchemaViolation")
    String error;

    @Schema(description = "Human-readable message")
    String message;

    @Schema(description = "Structured details, e.g. missing / extra / nonNumeric field lists")
    Map<String, Object> details;

    @Schema(description = "Epoch milliseconds", example = "1739886764000")
    long timestamp;
}
