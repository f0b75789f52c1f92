package com.bank.fraudshield.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ExecutorConfig {

    @Bean(name = "baseModelExecutor", destroyMethod = "shutdownNow")
    public ExecutorService baseModelExecutor(EngineConfig engineConfig) {
        return Executors.newFixedThreadPool(Math.max(1, engineConfig.getBaseModelPoolSize()),
                daemonThreads("base-model-"));
    }

    @Bean(name = "explainExecutor", destroyMethod = "shutdownNow")
    public ExecutorService explainExecutor(EngineConfig engineConfig) {
        return Executors.newFixedThreadPool(Math.max(1, engineConfig.getExplain().getPoolSize()),
                daemonThreads("explain-"));
    }

    static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
