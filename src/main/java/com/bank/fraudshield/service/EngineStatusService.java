package com.bank.fraudshield.service;

import com.bank.fraudshield.config.EngineConfig;
import com.bank.fraudshield.config.RiskBandConfig;
import com.bank.fraudshield.engine.bundle.ModelBundle;
import com.bank.fraudshield.engine.explain.ExplainabilityStage;
import com.bank.fraudshield.engine.registry.ModelDescriptor;
import com.bank.fraudshield.model.EngineInfo;
import com.bank.fraudshield.model.FeatureSchemaInfo;
import com.bank.fraudshield.model.HealthStatus;
import com.bank.fraudshield.model.ModelFamily;
import com.bank.fraudshield.model.ScalingVariant;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read-only views of the loaded bundle and the active configuration.
 */
@Service
public class EngineStatusService {

    private final ModelBundle bundle;
    private final EngineConfig engineConfig;
    private final RiskBandConfig bandConfig;
    private final ExplainabilityStage explainabilityStage;
    private final SampleVectorFactory sampleVectorFactory;

    public EngineStatusService(ModelBundle bundle,
                               EngineConfig engineConfig,
                               RiskBandConfig bandConfig,
                               ExplainabilityStage explainabilityStage) {
        this.bundle = bundle;
        this.engineConfig = engineConfig;
        this.bandConfig = bandConfig;
        this.explainabilityStage = explainabilityStage;
        this.sampleVectorFactory = new SampleVectorFactory(bundle);
    }

    public HealthStatus health() {
        int models = bundle.getModels().size();
        boolean quorumPossible = models >= engineConfig.getMinQuorum();
        return HealthStatus.builder()
                .status(quorumPossible ? "healthy" : "degraded")
                .modelsLoaded(HealthStatus.ModelsLoaded.builder()
                        .mlCount((int) bundle.countFamily(ModelFamily.ML))
                        .dlCount((int) bundle.countFamily(ModelFamily.DL))
                        .metaLearnerPresent(bundle.getMetaLearner() != null)
                        .calibrated(bundle.isCalibrated())
                        .explainerReady(explainabilityStage.isReady())
                        .build())
                .bundleVersion(bundle.getVersion())
                .build();
    }

    public EngineInfo info() {
        List<EngineInfo.ModelSummary> summaries = new ArrayList<>();
        for (ModelDescriptor model : bundle.getModels()) {
            summaries.add(EngineInfo.ModelSummary.builder()
                    .slot(model.getSlot())
                    .name(model.getName())
                    .displayName(model.getDisplayName())
                    .family(model.getFamily())
                    .algorithm(model.getAlgorithm())
                    .scaling(model.getScaling())
                    .build());
        }
        return EngineInfo.builder()
                .bundleVersion(bundle.getVersion())
                .featureSchemaVersion(bundle.getSchema().getVersion())
                .thresholds(EngineInfo.Thresholds.builder()
                        .threshold(bundle.getThreshold())
                        .safeBelow(bandConfig.getSafeBelow())
                        .fraudAtOrAbove(bandConfig.getFraudAtOrAbove())
                        .build())
                .minQuorum(engineConfig.getMinQuorum())
                .modelList(summaries)
                .build();
    }

    public FeatureSchemaInfo features() {
        List<ScalingVariant> scalers = bundle.getScalingPolicy().getAvailableVariants().stream()
                .sorted()
                .collect(Collectors.toList());
        return FeatureSchemaInfo.builder()
                .schemaVersion(bundle.getSchema().getVersion())
                .expectedFeatureCount(bundle.getSchema().size())
                .featureNames(bundle.getSchema().getNames())
                .availableScalers(scalers)
                .extraFeaturePolicy(engineConfig.getExtraFeaturePolicy().name())
                .build();
    }

    public Map<String, Double> sample(SampleVectorFactory.Profile profile) {
        return sampleVectorFactory.create(profile);
    }
}
