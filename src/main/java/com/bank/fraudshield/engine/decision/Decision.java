package com.bank.fraudshield.engine.decision;

import com.bank.fraudshield.model.RiskClassification;
import lombok.Value;

@Value
public class Decision {
    boolean fraudDecision;
    RiskClassification classification;
    double confidence;
}
