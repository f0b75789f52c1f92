package com.bank.fraudshield.engine.fusion;

import com.bank.fraudshield.engine.bundle.ModelBundle;
import com.bank.fraudshield.model.BaseScore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Combines base scores into one calibrated probability: imputation of
 * unavailable slots, the fixed logistic meta-learner, then the bundle's
 * calibrator. Nothing here is trained or refitted.
 */
@Component
public class FusionStage {

    private static final Logger log = LoggerFactory.getLogger(FusionStage.class);

    private final MetaLearner metaLearner;
    private final Calibrator calibrator;

    public FusionStage(ModelBundle bundle) {
        this.metaLearner = bundle.getMetaLearner();
        this.calibrator = bundle.getCalibrator();
    }

    public FusionResult fuse(List<BaseScore> baseScores) {
        FusionVector vector = FusionVector.of(baseScores, metaLearner);
        if (vector.imputedCount() > 0) {
            log.debug("Imputed {} of {} fusion slots from fallbacks", vector.imputedCount(), vector.size());
        }

        double[] values = vector.values();
        double raw = metaLearner.predict(values);
        double calibrated = calibrator.calibrate(raw);
        if (!Double.isFinite(calibrated)) {
            throw new IllegalStateException(calibrator.getType() + " calibrator produced " + calibrated);
        }
        calibrated = Math.max(0.0, Math.min(1.0, calibrated));

        return new FusionResult(vector, raw, calibrated, metaLearner.contributions(values));
    }
}
