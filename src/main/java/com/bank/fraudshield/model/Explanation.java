package com.bank.fraudshield.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@Schema(description = "Structured explanation of an ensemble decision")
public class Explanation {

    @Schema(description = "Per-model breakdown, ranked by absolute meta-learner contribution")
    List<ModelContribution> modelContributions;

    @Schema(description = "Top input features for the fused decision, ranked by magnitude")
    List<FeatureAttribution> featureAttributions;

    @Schema(description = "Risk factors derived from the global attribution")
    List<RiskFactor> riskFactors;

    @Schema(description = "Base model vote counts")
    ConsensusSummary consensus;

    @Schema(description = "One-paragraph narrative of the decision")
    String summary;

    @Schema(description = "Suggested reviewer actions")
    List<String> recommendations;

    @Schema(description = "False when some attributions were skipped (timeout or capacity)", example = "true")
    boolean complete;

    @Schema(description = "Models whose local attribution was skipped")
    List<String> skippedAttributions;
}
