package com.bank.fraudshield.service;

import com.bank.fraudshield.config.EngineConfig;
import com.bank.fraudshield.model.EngineInfo;
import com.bank.fraudshield.model.FeatureSchemaInfo;
import com.bank.fraudshield.model.HealthStatus;
import com.bank.fraudshield.model.ScalingVariant;
import com.bank.fraudshield.testutil.TestBundles;
import com.bank.fraudshield.testutil.TestEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EngineStatusServiceTest {

    private TestEngine engine;
    private EngineStatusService statusService;

    @BeforeEach
    void setUp() {
        engine = TestEngine.fixture();
        statusService = new EngineStatusService(engine.bundle, engine.engineConfig, engine.bandConfig,
                engine.explainabilityStage);
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    void health_reportsLoadedModels() {
        HealthStatus health = statusService.health();

        assertThat(health.getStatus()).isEqualTo("healthy");
        assertThat(health.getBundleVersion()).isEqualTo("fixture-1.0");
        assertThat(health.getModelsLoaded().getMlCount()).isEqualTo(3);
        assertThat(health.getModelsLoaded().getDlCount()).isEqualTo(4);
        assertThat(health.getModelsLoaded().isMetaLearnerPresent()).isTrue();
        assertThat(health.getModelsLoaded().isCalibrated()).isTrue();
        assertThat(health.getModelsLoaded().isExplainerReady()).isTrue();
    }

    @Test
    void health_bundleWithoutCalibrator_reportsUncalibrated() {
        try (TestEngine memEngine = TestEngine.of(TestBundles.inMemory(TestBundles.constant(0.4)), new EngineConfig())) {
            EngineStatusService memStatus = new EngineStatusService(memEngine.bundle, memEngine.engineConfig,
                    memEngine.bandConfig, memEngine.explainabilityStage);

            assertThat(memStatus.health().getModelsLoaded().isCalibrated()).isFalse();
        }
    }

    @Test
    void health_quorumLargerThanBundle_isDegraded() {
        engine.engineConfig.setMinQuorum(8);

        assertThat(statusService.health().getStatus()).isEqualTo("degraded");
    }

    @Test
    void health_explainPoolShutDown_explainerNotReady() {
        engine.close();

        assertThat(statusService.health().getModelsLoaded().isExplainerReady()).isFalse();
    }

    @Test
    void info_reportsThresholdBandsAndModels() {
        EngineInfo info = statusService.info();

        assertThat(info.getFeatureSchemaVersion()).isEqualTo("fs-3");
        assertThat(info.getThresholds().getThreshold()).isEqualTo(0.4);
        assertThat(info.getThresholds().getSafeBelow()).isEqualTo(0.30);
        assertThat(info.getThresholds().getFraudAtOrAbove()).isEqualTo(0.70);
        assertThat(info.getMinQuorum()).isEqualTo(5);
        assertThat(info.getModelList()).extracting(EngineInfo.ModelSummary::getName)
                .containsExactlyElementsOf(TestBundles.FIXTURE_MODELS);
        assertThat(info.getModelList().get(4).getScaling()).isEqualTo(ScalingVariant.MIN_MAX);
    }

    @Test
    void features_reportsCanonicalOrder() {
        FeatureSchemaInfo features = statusService.features();

        assertThat(features.getExpectedFeatureCount()).isEqualTo(3);
        assertThat(features.getFeatureNames()).containsExactlyElementsOf(TestBundles.FIXTURE_FEATURES);
        assertThat(features.getAvailableScalers())
                .containsExactly(ScalingVariant.NONE, ScalingVariant.STANDARD, ScalingVariant.MIN_MAX);
        assertThat(features.getExtraFeaturePolicy()).isEqualTo("REJECT");
    }
}
