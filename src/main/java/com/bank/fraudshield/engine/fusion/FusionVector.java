package com.bank.fraudshield.engine.fusion;

import com.bank.fraudshield.model.BaseScore;

import java.util.Arrays;
import java.util.List;

/**
 * Base scores in canonical slot order, with unavailable slots imputed from
 * the meta-learner fallbacks and a mask recording which slots were imputed.
 */
public final class FusionVector {

    private final double[] values;
    private final boolean[] imputed;

    private FusionVector(double[] values, boolean[] imputed) {
        this.values = values;
        this.imputed = imputed;
    }

    public static FusionVector of(List<BaseScore> scores, MetaLearner metaLearner) {
        int slots = metaLearner.getSlotCount();
        if (scores.size() != slots) {
            throw new IllegalArgumentException("Expected " + slots + " base scores, got " + scores.size());
        }
        double[] values = new double[slots];
        boolean[] imputed = new boolean[slots];
        for (BaseScore score : scores) {
            int slot = score.getSlot();
            if (score.isAvailable()) {
                values[slot] = score.getScore();
            } else {
                values[slot] = metaLearner.getFallback(slot);
                imputed[slot] = true;
            }
        }
        return new FusionVector(values, imputed);
    }

    public double[] values() {
        return Arrays.copyOf(values, values.length);
    }

    public boolean isImputed(int slot) {
        return imputed[slot];
    }

    public int imputedCount() {
        int count = 0;
        for (boolean b : imputed) {
            if (b) count++;
        }
        return count;
    }

    public int size() {
        return values.length;
    }
}
