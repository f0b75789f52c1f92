package com.bank.fraudshield.engine.explain;

import com.bank.fraudshield.model.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.bank.fraudshield.testutil.TestDataFactory.createEnsembleResult;
import static org.assertj.core.api.Assertions.assertThat;

class ExplanationNarratorTest {

    private final ExplanationNarrator narrator = new ExplanationNarrator();

    private static ConsensusSummary consensus(int fraud, int suspicious, int safe, int unavailable, double std) {
        return ConsensusSummary.builder()
                .fraudCount(fraud).suspiciousCount(suspicious).safeCount(safe).unavailableCount(unavailable)
                .minScore(0.05).maxScore(0.98).stdDevScore(std)
                .build();
    }

    private static RiskFactor factor(String name, Severity severity, double attribution) {
        return RiskFactor.builder().factor(name).feature(name).severity(severity).attribution(attribution)
                .description(name).build();
    }

    private static FeatureAttribution attribution(String feature, double impact) {
        return FeatureAttribution.builder().feature(feature).value(1.0).impact(impact)
                .magnitude(Math.abs(impact)).direction(AttributionDirection.of(impact)).build();
    }

    @Test
    void recommend_fraudWithCriticalFactors_blocksAndEscalates() {
        List<String> recommendations = narrator.recommend(
                createEnsembleResult(0.93, RiskClassification.FRAUD),
                consensus(11, 1, 1, 0, 0.1),
                List.of(factor("Critical Risk Indicator", Severity.HIGH, 0.4),
                        factor("High Risk Indicator", Severity.MEDIUM, 0.2)));

        assertThat(recommendations).containsExactly(
                "BLOCK transaction immediately",
                "BLOCK: flag account for comprehensive security review",
                "BLOCK: initiate customer verification process",
                "REVIEW: escalate to fraud investigation team",
                "REVIEW: check recent transaction history for related patterns");
    }

    @Test
    void recommend_safeWithoutFactors_approves() {
        List<String> recommendations = narrator.recommend(
                createEnsembleResult(0.05, RiskClassification.SAFE), consensus(0, 0, 13, 0, 0.02), List.of());

        assertThat(recommendations).containsExactly("APPROVE transaction", "APPROVE: process normally");
    }

    @Test
    void recommend_safeWithRaisingFactor_monitors() {
        List<String> recommendations = narrator.recommend(
                createEnsembleResult(0.12, RiskClassification.SAFE), consensus(0, 1, 12, 0, 0.05),
                List.of(factor("Risk Indicator", Severity.LOW, 0.06)));

        assertThat(recommendations).contains("APPROVE: monitor account for 24 hours");
    }

    @Test
    void recommend_suspiciousWithDisagreement_addsReview() {
        List<String> recommendations = narrator.recommend(
                createEnsembleResult(0.5, RiskClassification.SUSPICIOUS), consensus(5, 3, 5, 0, 0.31), List.of());

        assertThat(recommendations.get(0)).isEqualTo("REVIEW transaction manually");
        assertThat(recommendations).anyMatch(r -> r.startsWith("REVIEW: base models disagree strongly"));
    }

    @Test
    void summarize_fraudListsConcernsAndDrivers() {
        String summary = narrator.summarize(
                createEnsembleResult(0.93, RiskClassification.FRAUD),
                consensus(11, 1, 1, 0, 0.1),
                List.of(factor("Critical Risk Indicator", Severity.HIGH, 0.4)),
                List.of(attribution("device_critical_risk", 0.4), attribution("tenure", -0.1)));

        assertThat(summary)
                .startsWith("This transaction was flagged as FRAUDULENT with 93.0% fraud probability.")
                .contains("Key concerns identified: Critical Risk Indicator")
                .contains("Primary risk indicators: device_critical_risk.")
                .endsWith("11 of 13 available base models classify it as fraud.");
    }

    @Test
    void summarize_safeMentionsLegitimacyAndUnavailableModels() {
        String summary = narrator.summarize(
                createEnsembleResult(0.05, RiskClassification.SAFE),
                consensus(0, 0, 12, 1, 0.02),
                List.of(),
                List.of(attribution("tenure", -0.3)));

        assertThat(summary)
                .contains("LEGITIMATE", "No significant risk patterns", "Strong legitimacy indicators: tenure")
                .endsWith("(1 unavailable).");
    }

    @Test
    void summarize_suspiciousAsksForReview() {
        String summary = narrator.summarize(
                createEnsembleResult(0.45, RiskClassification.SUSPICIOUS), consensus(4, 5, 4, 0, 0.2),
                List.of(), List.of());

        assertThat(summary).contains("SUSPICIOUS with 45.0%", "review manually");
    }
}
