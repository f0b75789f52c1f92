package com.bank.fraudshield.engine.explain;

import com.bank.fraudshield.engine.scoring.Scorer;

import java.util.Arrays;

/**
 * Model-agnostic attribution: replace one feature at a time by its baseline
 * value and record how far the score falls. Positive values mean the actual
 * feature value raised the fraud score.
 */
public class OcclusionAttribution implements AttributionAdapter {

    @Override
    public double[] attribute(Scorer scorer, double[] input, double[] baseline) {
        double baseScore = scorer.score(input);
        double[] contributions = new double[input.length];
        double[] modified = Arrays.copyOf(input, input.length);

        for (int i = 0; i < input.length; i++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new IllegalStateException("Occlusion interrupted at feature " + i);
            }
            modified[i] = baseline[i];
            contributions[i] = baseScore - scorer.score(modified);
            modified[i] = input[i];
        }
        return contributions;
    }

    @Override
    public String getMethod() {
        return "OCCLUSION";
    }
}
