package com.bank.fraudshield.engine.explain;

import com.bank.fraudshield.config.EngineConfig;
import com.bank.fraudshield.config.MetricsConfig;
import com.bank.fraudshield.config.RiskBandConfig;
import com.bank.fraudshield.engine.bundle.ModelBundle;
import com.bank.fraudshield.engine.decision.DecisionPolicy;
import com.bank.fraudshield.engine.fusion.FusionResult;
import com.bank.fraudshield.engine.registry.ModelDescriptor;
import com.bank.fraudshield.engine.scaling.ScaledViews;
import com.bank.fraudshield.model.AttributionDirection;
import com.bank.fraudshield.model.BaseScore;
import com.bank.fraudshield.model.ConsensusSummary;
import com.bank.fraudshield.model.EnsembleResult;
import com.bank.fraudshield.model.Explanation;
import com.bank.fraudshield.model.FeatureAttribution;
import com.bank.fraudshield.model.FeatureVector;
import com.bank.fraudshield.model.ModelContribution;
import com.bank.fraudshield.model.RiskClassification;
import com.bank.fraudshield.model.RiskFactor;
import com.bank.fraudshield.model.ScalingVariant;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Explains a finished prediction.
 *
 * Flow:
 * 1. Acquire a concurrency permit (bounded by engine.explain.max-concurrent)
 * 2. Run per-model attributions on the explain pool within engine.explain.timeout-ms
 * 3. Weight each model's normalized attribution by its share of the meta-learner input
 * 4. Derive risk factors, consensus, narrative summary and recommendations
 *
 * Attributions that cannot run in time are listed as skipped and the
 * explanation is marked incomplete; the prediction itself is never affected.
 */
@Component
public class ExplainabilityStage {

    private static final Logger log = LoggerFactory.getLogger(ExplainabilityStage.class);

    private final ModelBundle bundle;
    private final ExecutorService executor;
    private final EngineConfig engineConfig;
    private final RiskBandConfig bandConfig;
    private final DecisionPolicy decisionPolicy;
    private final MetricsConfig metricsConfig;
    private final Semaphore permits;
    private final Map<ScalingVariant, double[]> scaledBaselines;
    private final ExplanationNarrator narrator = new ExplanationNarrator();

    public ExplainabilityStage(ModelBundle bundle,
                               @Qualifier("explainExecutor") ExecutorService executor,
                               EngineConfig engineConfig,
                               RiskBandConfig bandConfig,
                               DecisionPolicy decisionPolicy,
                               MetricsConfig metricsConfig) {
        this.bundle = bundle;
        this.executor = executor;
        this.engineConfig = engineConfig;
        this.bandConfig = bandConfig;
        this.decisionPolicy = decisionPolicy;
        this.metricsConfig = metricsConfig;
        this.permits = new Semaphore(Math.max(1, engineConfig.getExplain().getMaxConcurrent()));

        this.scaledBaselines = new EnumMap<>(ScalingVariant.class);
        double[] baseline = bundle.getBaseline();
        for (ScalingVariant variant : bundle.getScalingPolicy().getRequiredVariants()) {
            scaledBaselines.put(variant, bundle.getScalingPolicy().getScaler(variant).transform(baseline));
        }
    }

    public boolean isReady() {
        return !executor.isShutdown();
    }

    @Observed(name = "inference.explain_stage", contextualName = "explain-stage")
    public Explanation explain(ScaledViews views, List<BaseScore> baseScores, FusionResult fusion,
                               EnsembleResult result) {
        List<String> skipped = new ArrayList<>();
        Map<Integer, double[]> attributions = runAttributions(views, baseScores, skipped);

        FeatureVector source = views.getSource();
        int modelTop = engineConfig.getExplain().getModelTopFeatures();
        double[] normalized = normalize(fusion.getContributions());

        List<ModelContribution> modelContributions = new ArrayList<>();
        for (ModelDescriptor model : bundle.getModels()) {
            int slot = model.getSlot();
            BaseScore score = baseScores.get(slot);
            double[] attribution = attributions.get(slot);
            modelContributions.add(ModelContribution.builder()
                    .modelName(model.getName())
                    .displayName(model.getDisplayName())
                    .family(model.getFamily())
                    .algorithm(model.getAlgorithm())
                    .score(score.getScore())
                    .available(score.isAvailable())
                    .classification(score.isAvailable() ? decisionPolicy.classify(score.getScore()) : null)
                    .metaContribution(fusion.getContributions()[slot])
                    .normalizedContribution(normalized[slot])
                    .attributed(attribution != null)
                    .topFeatures(attribution != null ? rank(attribution, source, modelTop) : List.of())
                    .build());
        }

        double[] global = globalAttribution(attributions, normalized, source.size());
        List<FeatureAttribution> featureAttributions =
                rank(global, source, engineConfig.getExplain().getTopFeatures());

        List<RiskFactor> riskFactors = new RiskFactorDeriver(bundle.getSchema(), bandConfig.getSeverity())
                .derive(featureAttributions);
        ConsensusSummary consensus = consensus(baseScores);

        boolean complete = skipped.isEmpty();
        if (!complete) {
            metricsConfig.recordExplanationIncomplete();
            log.warn("Explanation incomplete; skipped attributions for {}", skipped);
        }

        return Explanation.builder()
                .modelContributions(modelContributions)
                .featureAttributions(featureAttributions)
                .riskFactors(riskFactors)
                .consensus(consensus)
                .summary(narrator.summarize(result, consensus, riskFactors, featureAttributions))
                .recommendations(narrator.recommend(result, consensus, riskFactors))
                .complete(complete)
                .skippedAttributions(List.copyOf(skipped))
                .build();
    }

    private Map<Integer, double[]> runAttributions(ScaledViews views, List<BaseScore> baseScores,
                                                   List<String> skipped) {
        DlAttributionMode mode = engineConfig.getExplain().getDlAttribution();
        List<ModelDescriptor> targets = new ArrayList<>();
        List<Callable<double[]>> tasks = new ArrayList<>();
        for (ModelDescriptor model : bundle.getModels()) {
            if (!baseScores.get(model.getSlot()).isAvailable()) continue;
            AttributionAdapter adapter = AttributionAdapters.select(model, mode);
            if (adapter == null) continue;
            double[] input = views.get(model.getScaling());
            double[] baseline = scaledBaselines.get(model.getScaling());
            targets.add(model);
            tasks.add(() -> adapter.attribute(model.getScorer(), input, baseline));
        }

        Map<Integer, double[]> attributions = new HashMap<>();
        if (tasks.isEmpty()) {
            return attributions;
        }

        long timeoutMs = engineConfig.getExplain().getTimeoutMs();
        long start = System.nanoTime();
        boolean acquired = false;
        try {
            acquired = permits.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS);
            if (!acquired) {
                log.warn("No explanation permit within {} ms; skipping all attributions", timeoutMs);
                targets.forEach(m -> skipped.add(m.getName()));
                return attributions;
            }
            long remaining = Math.max(1, timeoutMs - TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
            List<Future<double[]>> futures = executor.invokeAll(tasks, remaining, TimeUnit.MILLISECONDS);
            for (int i = 0; i < futures.size(); i++) {
                ModelDescriptor model = targets.get(i);
                Future<double[]> future = futures.get(i);
                if (future.isCancelled()) {
                    skipped.add(model.getName());
                    continue;
                }
                try {
                    attributions.put(model.getSlot(), future.get());
                } catch (ExecutionException e) {
                    log.warn("Attribution failed for model {}: {}", model.getName(), e.getCause().getMessage());
                    skipped.add(model.getName());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            targets.stream()
                    .filter(m -> !attributions.containsKey(m.getSlot()) && !skipped.contains(m.getName()))
                    .forEach(m -> skipped.add(m.getName()));
        } finally {
            if (acquired) {
                permits.release();
            }
        }
        return attributions;
    }

    /** c_i / sum |c_j|, or all zeros when every contribution is zero. */
    static double[] normalize(double[] contributions) {
        double total = 0.0;
        for (double c : contributions) {
            total += Math.abs(c);
        }
        double[] out = new double[contributions.length];
        if (total == 0.0) {
            return out;
        }
        for (int i = 0; i < contributions.length; i++) {
            out[i] = contributions[i] / total;
        }
        return out;
    }

    /**
     * Per-feature sum of each model's L1-normalized attribution times that model's
     * signed normalized meta contribution. Base scores are non-negative, so the sign
     * of the contribution is the sign of the meta coefficient: a feature that raises
     * a negatively weighted model's score lowers the fused probability.
     */
    static double[] globalAttribution(Map<Integer, double[]> attributions, double[] normalizedMeta, int featureCount) {
        double[] global = new double[featureCount];
        for (Map.Entry<Integer, double[]> entry : attributions.entrySet()) {
            double[] attribution = entry.getValue();
            double sumAbs = 0.0;
            for (double a : attribution) {
                sumAbs += Math.abs(a);
            }
            if (sumAbs == 0.0) continue;
            double weight = normalizedMeta[entry.getKey()];
            for (int i = 0; i < featureCount; i++) {
                global[i] += attribution[i] / sumAbs * weight;
            }
        }
        return global;
    }

    static List<FeatureAttribution> rank(double[] impacts, FeatureVector source, int limit) {
        return IntStream.range(0, impacts.length)
                .filter(i -> impacts[i] != 0.0)
                .boxed()
                .sorted(Comparator.comparingDouble((Integer i) -> -Math.abs(impacts[i]))
                        .thenComparingInt(i -> i))
                .limit(Math.max(0, limit))
                .map(i -> FeatureAttribution.builder()
                        .feature(source.getNames().get(i))
                        .value(source.get(i))
                        .impact(impacts[i])
                        .magnitude(Math.abs(impacts[i]))
                        .direction(AttributionDirection.of(impacts[i]))
                        .build())
                .collect(Collectors.toList());
    }

    ConsensusSummary consensus(List<BaseScore> baseScores) {
        int fraud = 0;
        int suspicious = 0;
        int safe = 0;
        int unavailable = 0;
        List<Double> scores = new ArrayList<>();
        for (BaseScore score : baseScores) {
            if (!score.isAvailable()) {
                unavailable++;
                continue;
            }
            scores.add(score.getScore());
            RiskClassification tier = decisionPolicy.classify(score.getScore());
            if (tier == RiskClassification.FRAUD) fraud++;
            else if (tier == RiskClassification.SUSPICIOUS) suspicious++;
            else safe++;
        }

        double min = scores.stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
        double max = scores.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        double mean = scores.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double variance = scores.stream().mapToDouble(s -> (s - mean) * (s - mean)).average().orElse(0.0);

        return ConsensusSummary.builder()
                .fraudCount(fraud)
                .suspiciousCount(suspicious)
                .safeCount(safe)
                .unavailableCount(unavailable)
                .minScore(min)
                .maxScore(max)
                .stdDevScore(Math.sqrt(variance))
                .build();
    }
}
