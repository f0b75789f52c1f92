package com.bank.fraudshield.service;

import com.bank.fraudshield.config.EngineConfig;
import com.bank.fraudshield.engine.bundle.ModelBundle;
import com.bank.fraudshield.engine.schema.ExtraFeaturePolicy;
import com.bank.fraudshield.exception.DownstreamTimeoutException;
import com.bank.fraudshield.exception.QuorumNotMetException;
import com.bank.fraudshield.exception.SchemaViolationException;
import com.bank.fraudshield.model.*;
import com.bank.fraudshield.testutil.TestBundles;
import com.bank.fraudshield.testutil.TestEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.bank.fraudshield.testutil.TestBundles.constant;
import static com.bank.fraudshield.testutil.TestBundles.failing;
import static com.bank.fraudshield.testutil.TestBundles.sleeping;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.assertj.core.api.Assertions.within;

class InferenceServiceTest {

    private TestEngine engine;
    private InferenceService service;

    @BeforeEach
    void setUp() {
        engine = TestEngine.fixture();
        service = engine.inferenceService;
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    // ── Fixture predictions ──

    @Test
    void predict_fraudSample_isFraud() {
        Map<String, Double> sample = new SampleVectorFactory(engine.bundle).create(SampleVectorFactory.Profile.FRAUD);

        EnsembleResult result = service.predict(sample);

        assertThat(result.getRawProbability()).isCloseTo(0.952118, within(1e-5));
        assertThat(result.getCalibratedProbability()).isCloseTo(0.90556, within(1e-5));
        assertThat(result.getClassification()).isEqualTo(RiskClassification.FRAUD);
        assertThat(result.isFraudDecision()).isTrue();
        assertThat(result.getConfidence()).isCloseTo(0.81112, within(1e-4));
        assertThat(result.getThreshold()).isEqualTo(0.4);
        assertThat(result.getBundleVersion()).isEqualTo("fixture-1.0");
    }

    @Test
    void predict_reportsModelStatsAndOrderedBaseScores() {
        EnsembleResult result = service.predict(TestBundles.fixtureFraud());

        assertThat(result.getModelStats().getMlModelsUsed()).isEqualTo(3);
        assertThat(result.getModelStats().getDlModelsUsed()).isEqualTo(4);
        assertThat(result.getModelStats().getTotalBaseModels()).isEqualTo(7);
        assertThat(result.getModelStats().getUnavailableModels()).isEmpty();
        assertThat(result.getBaseScores()).extracting(BaseScore::getModelName)
                .containsExactlyElementsOf(TestBundles.FIXTURE_MODELS);
        assertThat(result.getBaseScores().get(5).getScore()).isCloseTo(0.382828, within(1e-5));
        assertThat(result.getInferenceTimeMs()).isNotNegative();
    }

    @Test
    void predict_suspiciousVector_crossesThresholdButStaysInMiddleBand() {
        EnsembleResult result = service.predict(TestBundles.fixtureSuspicious());

        assertThat(result.getCalibratedProbability()).isCloseTo(0.488119, within(1e-5));
        assertThat(result.getClassification()).isEqualTo(RiskClassification.SUSPICIOUS);
        assertThat(result.isFraudDecision()).isTrue();
    }

    @Test
    void predict_trainingMean_isSafe() {
        EnsembleResult result = service.predict(TestBundles.fixtureSafe());

        assertThat(result.getCalibratedProbability()).isCloseTo(0.091762, within(1e-5));
        assertThat(result.getClassification()).isEqualTo(RiskClassification.SAFE);
        assertThat(result.isFraudDecision()).isFalse();
    }

    @Test
    void predict_sameInput_isDeterministic() {
        EnsembleResult first = service.predict(TestBundles.fixtureSuspicious());
        EnsembleResult second = service.predict(TestBundles.fixtureSuspicious());

        assertThat(second.getCalibratedProbability()).isEqualTo(first.getCalibratedProbability());
        assertThat(second.getBaseScores()).extracting(BaseScore::getScore)
                .containsExactlyElementsOf(first.getBaseScores().stream().map(BaseScore::getScore).toList());
    }

    @Test
    void predict_recordsPredictionMetric() {
        service.predict(TestBundles.fixtureFraud());

        assertThat(engine.meterRegistry.find("prediction.count").tag("classification", "FRAUD").counter())
                .isNotNull();
    }

    // ── Schema ──

    @Test
    void predict_missingFeature_throwsSchemaViolation() {
        Map<String, Object> features = TestBundles.fixtureFraud();
        features.remove("amount_zscore");

        SchemaViolationException ex = catchThrowableOfType(() -> service.predict(features),
                SchemaViolationException.class);

        assertThat(ex.getMissing()).containsExactly("amount_zscore");
    }

    @Test
    void predict_extraFeatureWithDropPolicy_isScored() {
        engine.engineConfig.setExtraFeaturePolicy(ExtraFeaturePolicy.DROP);
        Map<String, Object> features = TestBundles.fixtureFraud();
        features.put("legacy_flag", 1);

        assertThat(service.predict(features).getClassification()).isEqualTo(RiskClassification.FRAUD);
    }

    // ── Quorum ──

    @Test
    void predict_quorumAboveModelCount_fails() {
        engine.engineConfig.setMinQuorum(8);

        QuorumNotMetException ex = catchThrowableOfType(() -> service.predict(TestBundles.fixtureFraud()),
                QuorumNotMetException.class);

        assertThat(ex.getAvailable()).isEqualTo(7);
        assertThat(ex.getRequired()).isEqualTo(8);
        assertThat(engine.counter("quorum.failure.count")).isEqualTo(1.0);
    }

    @Test
    void predict_failedModelsBelowQuorum_fails() {
        ModelBundle bundle = TestBundles.inMemory(constant(0.9), failing("a"), failing("b"));
        EngineConfig config = new EngineConfig();
        config.setMinQuorum(2);

        try (TestEngine small = TestEngine.of(bundle, config)) {
            QuorumNotMetException ex = catchThrowableOfType(
                    () -> small.inferenceService.predict(TestBundles.memFeatures(1, 2, 3)),
                    QuorumNotMetException.class);

            assertThat(ex.getUnavailableModels()).containsExactly("model_1", "model_2");
            assertThat(ex.getDetails()).containsEntry("available", 1);
        }
    }

    @Test
    void predict_failedModelWithinQuorum_isImputed() {
        ModelBundle bundle = TestBundles.inMemory(constant(0.9), failing("a"), constant(0.8));
        EngineConfig config = new EngineConfig();
        config.setMinQuorum(2);

        try (TestEngine small = TestEngine.of(bundle, config)) {
            EnsembleResult result = small.inferenceService.predict(TestBundles.memFeatures(1, 2, 3));

            assertThat(result.getModelStats().getUnavailableModels()).containsExactly("model_1");
            assertThat(result.getModelStats().getMlModelsUsed()).isEqualTo(2);
            assertThat(result.getModelStats().getDlModelsUsed()).isZero();
            // -3 + 2*0.9 + 2*0.5 (fallback) + 2*0.8
            assertThat(result.getRawProbability()).isCloseTo(1.0 / (1.0 + Math.exp(-1.4)), within(1e-9));
            assertThat(result.getBaseScores().get(1).isAvailable()).isFalse();
        }
    }

    // ── Timeout ──

    @Test
    void predict_slowModel_timesOutAndRecordsMetric() {
        ModelBundle bundle = TestBundles.inMemory(constant(0.9), sleeping(3000, 0.5));
        EngineConfig config = new EngineConfig();
        config.setMinQuorum(1);
        config.setRequestTimeoutMs(100);

        try (TestEngine small = TestEngine.of(bundle, config)) {
            assertThatThrownBy(() -> small.inferenceService.predict(TestBundles.memFeatures(1, 2, 3)))
                    .isInstanceOf(DownstreamTimeoutException.class);
            assertThat(small.counter("request.timeout.count")).isEqualTo(1.0);
        }
    }

    // ── Batch ──

    @Test
    void predictBatch_failedItemReportedInPlace() {
        Map<String, Object> broken = TestBundles.fixtureSafe();
        broken.remove("velocity_high_1h");

        List<BatchItemResult> results = service.predictBatch(List.of(
                TestBundles.fixtureFraud(), broken, TestBundles.fixtureSafe()));

        assertThat(results).extracting(BatchItemResult::getIndex).containsExactly(0, 1, 2);
        assertThat(results).extracting(BatchItemResult::isSuccess).containsExactly(true, false, true);
        assertThat(results.get(0).getResult().getClassification()).isEqualTo(RiskClassification.FRAUD);
        assertThat(results.get(1).getResult()).isNull();
        assertThat(results.get(1).getError().getErrorCode()).isEqualTo(SchemaViolationException.ERROR_CODE);
        assertThat(results.get(1).getError().getDetails().get("missing"))
                .isEqualTo(List.of("velocity_high_1h"));
        assertThat(results.get(2).getResult().getClassification()).isEqualTo(RiskClassification.SAFE);
    }

    @Test
    void predictBatch_matchesSinglePredictions() {
        List<BatchItemResult> results = service.predictBatch(List.of(TestBundles.fixtureSuspicious()));

        assertThat(results.get(0).getResult().getCalibratedProbability())
                .isEqualTo(service.predict(TestBundles.fixtureSuspicious()).getCalibratedProbability());
    }

    @Test
    void predictBatch_empty_returnsEmpty() {
        assertThat(service.predictBatch(List.of())).isEmpty();
    }

    @Test
    void predictBatch_quorumFailure_isPerItem() {
        engine.engineConfig.setMinQuorum(8);

        List<BatchItemResult> results = service.predictBatch(List.of(TestBundles.fixtureFraud()));

        assertThat(results.get(0).isSuccess()).isFalse();
        assertThat(results.get(0).getError().getError()).isEqualTo("QuorumNotMet");
    }
}
