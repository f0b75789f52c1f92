package com.bank.fraudshield.service;

import com.bank.fraudshield.config.EngineConfig;
import com.bank.fraudshield.config.MetricsConfig;
import com.bank.fraudshield.engine.bundle.ModelBundle;
import com.bank.fraudshield.engine.decision.Decision;
import com.bank.fraudshield.engine.decision.DecisionPolicy;
import com.bank.fraudshield.engine.explain.ExplainabilityStage;
import com.bank.fraudshield.engine.fusion.FusionResult;
import com.bank.fraudshield.engine.fusion.FusionStage;
import com.bank.fraudshield.engine.registry.BaseModelRegistry;
import com.bank.fraudshield.engine.scaling.ScaledViews;
import com.bank.fraudshield.exception.DownstreamTimeoutException;
import com.bank.fraudshield.exception.EngineException;
import com.bank.fraudshield.exception.ErrorResponses;
import com.bank.fraudshield.exception.QuorumNotMetException;
import com.bank.fraudshield.model.BaseScore;
import com.bank.fraudshield.model.BatchItemResult;
import com.bank.fraudshield.model.EnsembleResult;
import com.bank.fraudshield.model.ExplainResponse;
import com.bank.fraudshield.model.Explanation;
import com.bank.fraudshield.model.FeatureVector;
import com.bank.fraudshield.model.ModelFamily;
import com.bank.fraudshield.model.ModelStats;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Main orchestrator for fraud inference.
 *
 * Flow:
 * 1. Validate the raw feature map against the bundle schema
 * 2. Build the scaled views the base models need
 * 3. Score every base model in parallel (within engine.request-timeout-ms)
 * 4. Check the quorum of available base scores
 * 5. Fuse and calibrate via the meta-learner
 * 6. Apply the decision policy (threshold + risk bands)
 * 7. Optionally explain the result
 */
@Service
public class InferenceService {

    private static final Logger log = LoggerFactory.getLogger(InferenceService.class);

    private final ModelBundle bundle;
    private final BaseModelRegistry registry;
    private final FusionStage fusionStage;
    private final DecisionPolicy decisionPolicy;
    private final ExplainabilityStage explainabilityStage;
    private final EngineConfig engineConfig;
    private final MetricsConfig metricsConfig;

    public InferenceService(ModelBundle bundle,
                            BaseModelRegistry registry,
                            FusionStage fusionStage,
                            DecisionPolicy decisionPolicy,
                            ExplainabilityStage explainabilityStage,
                            EngineConfig engineConfig,
                            MetricsConfig metricsConfig) {
        this.bundle = bundle;
        this.registry = registry;
        this.fusionStage = fusionStage;
        this.decisionPolicy = decisionPolicy;
        this.explainabilityStage = explainabilityStage;
        this.engineConfig = engineConfig;
        this.metricsConfig = metricsConfig;
    }

    @Observed(name = "inference.predict", contextualName = "predict")
    public EnsembleResult predict(Map<String, ?> features) {
        return infer(features).result;
    }

    @Observed(name = "inference.explain", contextualName = "predict-and-explain")
    public ExplainResponse explain(Map<String, ?> features) {
        Inference inference = infer(features);
        Explanation explanation = explainabilityStage.explain(
                inference.views, inference.baseScores, inference.fusion, inference.result);
        return ExplainResponse.builder()
                .prediction(inference.result)
                .explanation(explanation)
                .build();
    }

    /**
     * Score every item independently. Never throws: each item's failure is
     * reported in place and the other items still run.
     */
    @Observed(name = "inference.predict_batch", contextualName = "predict-batch")
    public List<BatchItemResult> predictBatch(List<? extends Map<String, ?>> items) {
        List<BatchItemResult> results = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            try {
                results.add(BatchItemResult.ok(i, infer(items.get(i)).result));
            } catch (EngineException e) {
                log.debug("Batch item {} failed: {}", i, e.getMessage());
                results.add(BatchItemResult.failed(i, ErrorResponses.of(e)));
            } catch (RuntimeException e) {
                log.error("Unexpected error scoring batch item {}", i, e);
                results.add(BatchItemResult.failed(i, ErrorResponses.internal("An unexpected error occurred")));
            }
        }
        return results;
    }

    private Inference infer(Map<String, ?> features) {
        long start = System.nanoTime();

        // 1. Validate
        FeatureVector vector = bundle.getValidator().validate(features, engineConfig.getExtraFeaturePolicy());

        // 2. Scale
        ScaledViews views = bundle.getScalingPolicy().apply(vector);

        // 3. Score base models
        List<BaseScore> baseScores;
        try {
            baseScores = registry.scoreAll(views, engineConfig.getRequestTimeoutMs());
        } catch (DownstreamTimeoutException e) {
            metricsConfig.recordRequestTimeout();
            throw e;
        }

        // 4. Quorum
        List<String> unavailable = new ArrayList<>();
        int mlUsed = 0;
        int dlUsed = 0;
        for (BaseScore score : baseScores) {
            if (!score.isAvailable()) {
                unavailable.add(score.getModelName());
            } else if (score.getFamily() == ModelFamily.ML) {
                mlUsed++;
            } else {
                dlUsed++;
            }
        }
        int available = mlUsed + dlUsed;
        if (available < engineConfig.getMinQuorum()) {
            metricsConfig.recordQuorumFailure();
            log.warn("Quorum not met: {} of {} base models available, {} required; unavailable={}",
                    available, baseScores.size(), engineConfig.getMinQuorum(), unavailable);
            throw new QuorumNotMetException(available, engineConfig.getMinQuorum(), unavailable);
        }

        // 5. Fuse and calibrate
        FusionResult fusion = fusionStage.fuse(baseScores);

        // 6. Decide
        Decision decision = decisionPolicy.decide(fusion.getCalibratedProbability(), bundle.getThreshold());

        EnsembleResult result = EnsembleResult.builder()
                .rawProbability(fusion.getRawProbability())
                .calibratedProbability(fusion.getCalibratedProbability())
                .threshold(bundle.getThreshold())
                .fraudDecision(decision.isFraudDecision())
                .classification(decision.getClassification())
                .confidence(decision.getConfidence())
                .bundleVersion(bundle.getVersion())
                .inferenceTimeMs((System.nanoTime() - start) / 1_000_000.0)
                .modelStats(ModelStats.builder()
                        .mlModelsUsed(mlUsed)
                        .dlModelsUsed(dlUsed)
                        .totalBaseModels(baseScores.size())
                        .unavailableModels(unavailable)
                        .build())
                .baseScores(baseScores)
                .build();

        metricsConfig.recordPrediction(result.getClassification().name(), result.getCalibratedProbability());

        if (result.isFraudDecision()) {
            log.info("Fraud decision: p_cal={}, classification={}, bundle={}",
                    String.format("%.4f", result.getCalibratedProbability()),
                    result.getClassification(), result.getBundleVersion());
        } else {
            log.debug("Prediction: p_cal={}, classification={}", result.getCalibratedProbability(),
                    result.getClassification());
        }

        return new Inference(views, baseScores, fusion, result);
    }

    private static final class Inference {
        final ScaledViews views;
        final List<BaseScore> baseScores;
        final FusionResult fusion;
        final EnsembleResult result;

        Inference(ScaledViews views, List<BaseScore> baseScores, FusionResult fusion, EnsembleResult result) {
            this.views = views;
            this.baseScores = baseScores;
            this.fusion = fusion;
            this.result = result;
        }
    }
}
