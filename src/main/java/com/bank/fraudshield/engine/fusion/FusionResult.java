package com.bank.fraudshield.engine.fusion;

import lombok.Value;

@Value
public class FusionResult {

    FusionVector fusionVector;
    double rawProbability;
    double calibratedProbability;

    /** w_i * s_i per slot, using imputed values for unavailable slots. */
    double[] contributions;
}
