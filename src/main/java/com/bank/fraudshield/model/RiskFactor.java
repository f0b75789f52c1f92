package com.bank.fraudshield.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Human-readable risk factor derived from feature attribution")
public class RiskFactor {

    @Schema(description = "Short factor title", example = "Critical Pattern Anomaly")
    String factor;

    @Schema(description = "Feature the factor was derived from", example = "velocity_24h_critical")
    String feature;

    @Schema(description = "Severity band of the attribution magnitude", example = "HIGH")
    Severity severity;

    @Schema(description = "Global attribution that produced this factor", example = "0.34")
    double attribution;

    @Schema(description = "Business-readable description")
    String description;
}
