package com.bank.fraudshield.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "risk")
public class RiskBandConfig {

    // Calibrated probability below which a transaction is SAFE.
    private double safeBelow = 0.30;

    // Calibrated probability at or above which a transaction is FRAUD.
    private double fraudAtOrAbove = 0.70;

    // Global attribution cut points for risk factor severity.
    private SeverityCuts severity = new SeverityCuts();

    @Data
    public static class SeverityCuts {
        private double low = 0.05;
        private double medium = 0.15;
        private double high = 0.30;
    }
}
