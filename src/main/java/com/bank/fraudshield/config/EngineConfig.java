package com.bank.fraudshield.config;

import com.bank.fraudshield.engine.explain.DlAttributionMode;
import com.bank.fraudshield.engine.schema.ExtraFeaturePolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "engine")
public class EngineConfig {

    // Directory holding bundle.json and the model artifacts. Required.
    private String bundlePath;

    // Minimum number of base models that must score successfully.
    private int minQuorum = 10;

    // When > 0, startup fails unless the bundle has exactly this many base models.
    private int expectedModelCount = 0;

    // REJECT: unknown keys are a schema violation. DROP: they are logged and ignored.
    private ExtraFeaturePolicy extraFeaturePolicy = ExtraFeaturePolicy.REJECT;

    private int baseModelPoolSize = 8;

    // End-to-end budget for the base model fan-out of one request.
    private long requestTimeoutMs = 2000;

    private Explain explain = new Explain();

    @Data
    public static class Explain {
        private long timeoutMs = 5000;
        private int maxConcurrent = 2;
        private int poolSize = 4;
        private int topFeatures = 10;
        private int modelTopFeatures = 5;
        private DlAttributionMode dlAttribution = DlAttributionMode.OCCLUSION;
    }
}
