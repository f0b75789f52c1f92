package com.bank.fraudshield.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPrediction(String classification, double calibratedProbability) {
        Counter.builder("prediction.count")
                .tag("classification", classification)
                .register(registry)
                .increment();

        DistributionSummary.builder("prediction.calibrated_probability")
                .tag("classification", classification)
                .register(registry)
                .record(calibratedProbability);
    }

    public void recordModelUnavailable(String modelName) {
        Counter.builder("base_model.unavailable.count")
                .tag("model", modelName)
                .register(registry)
                .increment();
    }

    public void recordQuorumFailure() {
        Counter.builder("quorum.failure.count")
                .register(registry)
                .increment();
    }

    public void recordExplanationIncomplete() {
        Counter.builder("explanation.incomplete.count")
                .register(registry)
                .increment();
    }

    public void recordRequestTimeout() {
        Counter.builder("request.timeout.count")
                .register(registry)
                .increment();
    }
}
