package com.bank.fraudshield.engine.registry;

import com.bank.fraudshield.config.MetricsConfig;
import com.bank.fraudshield.engine.bundle.ModelBundle;
import com.bank.fraudshield.engine.scaling.ScaledViews;
import com.bank.fraudshield.exception.DownstreamTimeoutException;
import com.bank.fraudshield.model.BaseScore;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Invokes every base model of the bundle against one set of scaled views.
 * Each model runs independently on the base-model pool; a model that throws
 * or returns a non-finite value yields an unavailable {@link BaseScore}
 * without affecting the others. Results come back in canonical slot order.
 */
@Component
public class BaseModelRegistry {

    private static final Logger log = LoggerFactory.getLogger(BaseModelRegistry.class);

    private final List<ModelDescriptor> models;
    private final ExecutorService executor;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public BaseModelRegistry(ModelBundle bundle,
                             @Qualifier("baseModelExecutor") ExecutorService executor,
                             Tracer tracer, MetricsConfig metricsConfig) {
        this.models = bundle.getModels();
        this.executor = executor;
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Score all models within the given budget.
     *
     * @throws DownstreamTimeoutException if any model is still running when the budget runs out
     */
    @Observed(name = "models.score_all", contextualName = "score-all-models")
    public List<BaseScore> scoreAll(ScaledViews views, long timeoutMs) {
        List<Callable<BaseScore>> tasks = new ArrayList<>(models.size());
        for (ModelDescriptor model : models) {
            tasks.add(() -> scoreOne(model, views));
        }

        List<Future<BaseScore>> futures;
        try {
            futures = executor.invokeAll(tasks, timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DownstreamTimeoutException(timeoutMs);
        }

        List<BaseScore> scores = new ArrayList<>(models.size());
        for (int i = 0; i < futures.size(); i++) {
            Future<BaseScore> future = futures.get(i);
            ModelDescriptor model = models.get(i);
            if (future.isCancelled()) {
                log.warn("Base model {} did not finish within {} ms", model.getName(), timeoutMs);
                throw new DownstreamTimeoutException(timeoutMs);
            }
            try {
                scores.add(future.get());
            } catch (ExecutionException e) {
                // scoreOne handles exceptions itself, so only errors reach here
                log.error("Base model {} failed unexpectedly", model.getName(), e.getCause());
                scores.add(unavailable(model, String.valueOf(e.getCause())));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DownstreamTimeoutException(timeoutMs);
            }
        }
        return scores;
    }

    BaseScore scoreOne(ModelDescriptor model, ScaledViews views) {
        Span span = tracer.nextSpan()
                .name("model.score." + model.getName())
                .tag("model.name", model.getName())
                .tag("model.family", model.getFamily().name())
                .tag("model.algorithm", model.getAlgorithm().name())
                .start();

        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            double score = model.getScorer().score(views.get(model.getScaling()));
            if (!Double.isFinite(score) || score < 0.0 || score > 1.0) {
                throw new IllegalStateException("score " + score + " is not a probability");
            }
            span.tag("model.score", String.valueOf(score));
            return BaseScore.builder()
                    .modelName(model.getName())
                    .displayName(model.getDisplayName())
                    .family(model.getFamily())
                    .slot(model.getSlot())
                    .score(score)
                    .available(true)
                    .build();
        } catch (Exception e) {
            span.error(e);
            log.warn("Base model {} unavailable: {}", model.getName(), e.getMessage());
            log.debug("Base model {} failure detail", model.getName(), e);
            return unavailable(model, e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            span.end();
        }
    }

    private BaseScore unavailable(ModelDescriptor model, String reason) {
        metricsConfig.recordModelUnavailable(model.getName());
        return BaseScore.unavailable(model.getName(), model.getDisplayName(), model.getFamily(),
                model.getSlot(), reason);
    }

    public List<ModelDescriptor> getModels() {
        return models;
    }
}
