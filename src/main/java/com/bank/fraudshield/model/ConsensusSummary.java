package com.bank.fraudshield.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "How the individual base models voted under the tier bands")
public class ConsensusSummary {

    @Schema(example = "9")
    int fraudCount;

    @Schema(example = "3")
    int suspiciousCount;

    @Schema(example = "1")
    int safeCount;

    @Schema(description = "Base models that produced no score", example = "0")
    int unavailableCount;

    @Schema(description = "Lowest base score", example = "0.12")
    double minScore;

    @Schema(description = "Highest base score", example = "0.97")
    double maxScore;

    @Schema(description = "Population standard deviation of base scores", example = "0.21")
    double stdDevScore;
}
