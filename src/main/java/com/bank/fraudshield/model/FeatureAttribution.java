package com.bank.fraudshield.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Signed contribution of one input feature to a score")
public class FeatureAttribution {

    @Schema(description = "Feature name", example = "amount_zscore_critical")
    String feature;

    @Schema(description = "Raw (unscaled) feature value", example = "3.41")
    double value;

    @Schema(description = "Signed impact; positive pushes towards fraud", example = "0.182")
    double impact;

    @Schema(description = "Absolute impact", example = "0.182")
    double magnitude;

    @Schema(description = "Direction of the impact", example = "INCREASES_RISK")
    AttributionDirection direction;
}
