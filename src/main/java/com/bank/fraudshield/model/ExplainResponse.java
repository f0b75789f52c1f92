package com.bank.fraudshield.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Prediction together with its explanation")
public class ExplainResponse {

    EnsembleResult prediction;

    Explanation explanation;
}
