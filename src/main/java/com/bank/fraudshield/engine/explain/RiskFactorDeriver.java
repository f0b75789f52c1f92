package com.bank.fraudshield.engine.explain;

import com.bank.fraudshield.config.RiskBandConfig;
import com.bank.fraudshield.engine.schema.FeatureDefinition;
import com.bank.fraudshield.engine.schema.FeatureSchema;
import com.bank.fraudshield.model.FeatureAttribution;
import com.bank.fraudshield.model.RiskFactor;
import com.bank.fraudshield.model.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns ranked global attributions into reviewer-facing risk factors. Text
 * comes from the feature's label and description in the bundle, or from the
 * {@code critical}/{@code high} naming convention when the bundle has none.
 */
public class RiskFactorDeriver {

    private final FeatureSchema schema;
    private final RiskBandConfig.SeverityCuts cuts;

    public RiskFactorDeriver(FeatureSchema schema, RiskBandConfig.SeverityCuts cuts) {
        this.schema = schema;
        this.cuts = cuts;
    }

    public List<RiskFactor> derive(List<FeatureAttribution> ranked) {
        List<RiskFactor> factors = new ArrayList<>();
        for (FeatureAttribution attribution : ranked) {
            Severity severity = Severity.fromMagnitude(attribution.getMagnitude(),
                    cuts.getLow(), cuts.getMedium(), cuts.getHigh());
            if (severity == null) {
                continue;
            }
            factors.add(RiskFactor.builder()
                    .factor(factorName(attribution.getFeature()))
                    .feature(attribution.getFeature())
                    .severity(severity)
                    .attribution(attribution.getImpact())
                    .description(describe(attribution))
                    .build());
        }
        return factors;
    }

    String factorName(String feature) {
        int index = schema.indexOf(feature);
        FeatureDefinition definition = index >= 0 ? schema.getFeature(index) : null;
        if (definition != null && definition.getLabel() != null && !definition.getLabel().isBlank()) {
            return definition.getLabel();
        }
        return indicatorType(feature);
    }

    private String describe(FeatureAttribution attribution) {
        String feature = attribution.getFeature();
        String effect = attribution.getImpact() > 0 ? "raises" : "lowers";
        String value = String.format(Locale.ROOT, "%.2f", attribution.getValue());

        int index = schema.indexOf(feature);
        FeatureDefinition definition = index >= 0 ? schema.getFeature(index) : null;
        if (definition != null && definition.getDescription() != null && !definition.getDescription().isBlank()) {
            return definition.getDescription() + " (value " + value + ") " + effect + " fraud risk";
        }

        String lower = feature.toLowerCase(Locale.ROOT);
        if (attribution.getImpact() > 0 && lower.contains("critical")) {
            return "Critical feature " + feature + " shows a highly unusual pattern (value " + value + ")";
        }
        if (attribution.getImpact() > 0) {
            return indicatorType(feature) + ": suspicious activity detected in " + feature + " (value " + value + ")";
        }
        return indicatorType(feature) + ": " + feature + " matches normal behaviour (value " + value + ")";
    }

    static String indicatorType(String feature) {
        String lower = feature.toLowerCase(Locale.ROOT);
        if (lower.contains("critical")) return "Critical Risk Indicator";
        if (lower.contains("high")) return "High Risk Indicator";
        return "Risk Indicator";
    }
}
