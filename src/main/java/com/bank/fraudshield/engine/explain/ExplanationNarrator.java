package com.bank.fraudshield.engine.explain;

import com.bank.fraudshield.model.ConsensusSummary;
import com.bank.fraudshield.model.EnsembleResult;
import com.bank.fraudshield.model.FeatureAttribution;
import com.bank.fraudshield.model.RiskClassification;
import com.bank.fraudshield.model.RiskFactor;
import com.bank.fraudshield.model.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Builds the one-paragraph summary and the reviewer action list that
 * accompany an explanation. Every recommendation starts with its action
 * keyword: BLOCK, REVIEW or APPROVE.
 */
public class ExplanationNarrator {

    // Base score spread above which the models are considered to disagree
    static final double DISAGREEMENT_STD = 0.25;

    public String summarize(EnsembleResult result, ConsensusSummary consensus,
                            List<RiskFactor> riskFactors, List<FeatureAttribution> attributions) {
        double p = result.getCalibratedProbability();
        int available = consensus.getFraudCount() + consensus.getSuspiciousCount() + consensus.getSafeCount();
        StringBuilder sb = new StringBuilder();

        switch (result.getClassification()) {
            case FRAUD:
                sb.append(String.format(Locale.ROOT,
                        "This transaction was flagged as FRAUDULENT with %.1f%% fraud probability. ", p * 100));
                if (!riskFactors.isEmpty()) {
                    sb.append("Key concerns identified: ")
                            .append(riskFactors.stream().limit(3).map(RiskFactor::getFactor)
                                    .collect(Collectors.joining(", ")))
                            .append(". ");
                } else {
                    sb.append("Multiple suspicious patterns were detected by the ensemble. ");
                }
                appendDrivers(sb, attributions, true, "Primary risk indicators");
                break;
            case SAFE:
                sb.append(String.format(Locale.ROOT,
                        "This transaction appears LEGITIMATE with %.1f%% fraud probability. ", p * 100));
                if (!riskFactors.isEmpty()) {
                    sb.append("Although ").append(riskFactors.size())
                            .append(" minor risk factor(s) were detected, they are within acceptable limits. ");
                } else {
                    sb.append("No significant risk patterns were identified. ");
                }
                appendDrivers(sb, attributions, false, "Strong legitimacy indicators");
                break;
            default:
                sb.append(String.format(Locale.ROOT,
                        "Transaction classification: SUSPICIOUS with %.1f%% fraud probability. ", p * 100));
                sb.append("Please review manually for a final decision. ");
                break;
        }

        sb.append(String.format(Locale.ROOT, "%d of %d available base models classify it as fraud",
                consensus.getFraudCount(), available));
        if (consensus.getUnavailableCount() > 0) {
            sb.append(" (").append(consensus.getUnavailableCount()).append(" unavailable)");
        }
        sb.append('.');
        return sb.toString();
    }

    public List<String> recommend(EnsembleResult result, ConsensusSummary consensus, List<RiskFactor> riskFactors) {
        List<String> recommendations = new ArrayList<>();
        RiskClassification classification = result.getClassification();
        boolean criticalFactor = riskFactors.stream()
                .anyMatch(f -> f.getSeverity() == Severity.HIGH && f.getAttribution() > 0);
        long raisingFactors = riskFactors.stream().filter(f -> f.getAttribution() > 0).count();

        if (classification == RiskClassification.FRAUD) {
            recommendations.add("BLOCK transaction immediately");
            recommendations.add("BLOCK: flag account for comprehensive security review");
            recommendations.add("BLOCK: initiate customer verification process");
            if (criticalFactor) {
                recommendations.add("REVIEW: escalate to fraud investigation team");
            }
            if (raisingFactors > 1) {
                recommendations.add("REVIEW: check recent transaction history for related patterns");
            }
        } else if (classification == RiskClassification.SAFE) {
            recommendations.add("APPROVE transaction");
            if (raisingFactors > 0) {
                recommendations.add("APPROVE: monitor account for 24 hours");
                recommendations.add("APPROVE: update customer risk profile");
            } else {
                recommendations.add("APPROVE: process normally");
            }
        } else {
            recommendations.add("REVIEW transaction manually");
            recommendations.add("REVIEW: consider additional authentication");
            recommendations.add("REVIEW: monitor for related suspicious activity");
        }

        if (consensus.getStdDevScore() > DISAGREEMENT_STD) {
            recommendations.add(String.format(Locale.ROOT,
                    "REVIEW: base models disagree strongly (score spread %.2f to %.2f)",
                    consensus.getMinScore(), consensus.getMaxScore()));
        }
        if (consensus.getUnavailableCount() > 0) {
            recommendations.add("REVIEW: " + consensus.getUnavailableCount()
                    + " base model(s) were unavailable and imputed");
        }
        return recommendations;
    }

    private static void appendDrivers(StringBuilder sb, List<FeatureAttribution> attributions,
                                      boolean raising, String label) {
        List<String> drivers = attributions.stream()
                .filter(a -> raising ? a.getImpact() > 0 : a.getImpact() < 0)
                .limit(3)
                .map(FeatureAttribution::getFeature)
                .collect(Collectors.toList());
        if (!drivers.isEmpty()) {
            sb.append(label).append(": ").append(String.join(", ", drivers)).append(". ");
        }
    }
}
