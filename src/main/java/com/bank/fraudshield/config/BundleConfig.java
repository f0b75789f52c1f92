package com.bank.fraudshield.config;

import com.bank.fraudshield.engine.bundle.ModelBundle;
import com.bank.fraudshield.engine.bundle.ModelBundleLoader;
import com.bank.fraudshield.exception.BundleLoadException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Loads the model bundle while the context starts. Any load failure aborts
 * startup.
 */
@Configuration
public class BundleConfig {

    private static final Logger log = LoggerFactory.getLogger(BundleConfig.class);

    @Bean
    public ModelBundle modelBundle(EngineConfig engineConfig, ObjectMapper objectMapper) {
        String bundlePath = engineConfig.getBundlePath();
        if (bundlePath == null || bundlePath.isBlank()) {
            throw new BundleLoadException("engine.bundle-path is not set");
        }

        ModelBundle bundle = new ModelBundleLoader(objectMapper).load(Path.of(bundlePath));

        int modelCount = bundle.getModels().size();
        if (engineConfig.getExpectedModelCount() > 0 && modelCount != engineConfig.getExpectedModelCount()) {
            throw new BundleLoadException("Bundle " + bundle.getVersion() + " has " + modelCount
                    + " base models, expected " + engineConfig.getExpectedModelCount());
        }
        if (engineConfig.getMinQuorum() > modelCount) {
            log.warn("engine.min-quorum={} exceeds the {} base models in bundle {}; every request will fail quorum",
                    engineConfig.getMinQuorum(), modelCount, bundle.getVersion());
        }
        return bundle;
    }
}
