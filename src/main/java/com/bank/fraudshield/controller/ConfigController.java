package com.bank.fraudshield.controller;

import com.bank.fraudshield.config.EngineConfig;
import com.bank.fraudshield.config.RiskBandConfig;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View and modify runtime risk bands and quorum")
public class ConfigController {

    private static final Logger log = LoggerFactory.getLogger(ConfigController.class);

    private final RiskBandConfig bandConfig;
    private final EngineConfig engineConfig;

    public ConfigController(RiskBandConfig bandConfig, EngineConfig engineConfig) {
        this.bandConfig = bandConfig;
        this.engineConfig = engineConfig;
    }

    @Operation(summary = "Get risk bands and quorum")
    @GetMapping("/bands")
    public ResponseEntity<Map<String, Object>> getBands() {
        return ResponseEntity.ok(Map.of(
                "safeBelow", bandConfig.getSafeBelow(),
                "fraudAtOrAbove", bandConfig.getFraudAtOrAbove(),
                "minQuorum", engineConfig.getMinQuorum()
        ));
    }

    @Operation(summary = "Update risk bands and quorum",
            description = "Changes apply immediately but reset on restart. The bundle decision threshold is not affected.")
    @PutMapping("/bands")
    public ResponseEntity<?> updateBands(@RequestBody Map<String, Object> body) {
        double safeBelow = toDouble(body, "safeBelow", bandConfig.getSafeBelow());
        double fraudAt = toDouble(body, "fraudAtOrAbove", bandConfig.getFraudAtOrAbove());
        int minQuorum = toInt(body, "minQuorum", engineConfig.getMinQuorum());

        if (!(safeBelow >= 0 && safeBelow <= 1)) return badRequest("safeBelow must be in [0, 1]", "safeBelow");
        if (!(fraudAt >= 0 && fraudAt <= 1)) return badRequest("fraudAtOrAbove must be in [0, 1]", "fraudAtOrAbove");
        if (safeBelow >= fraudAt) return badRequest("safeBelow must be below fraudAtOrAbove", "safeBelow");
        if (minQuorum < 1) return badRequest("minQuorum must be an integer >= 1", "minQuorum");

        bandConfig.setSafeBelow(safeBelow);
        bandConfig.setFraudAtOrAbove(fraudAt);
        engineConfig.setMinQuorum(minQuorum);
        log.info("Risk bands updated: safeBelow={}, fraudAtOrAbove={}, minQuorum={}", safeBelow, fraudAt, minQuorum);

        return getBands();
    }

    // ── Helpers ──

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }

    private double toDouble(Map<String, Object> body, String key, double defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.doubleValue();
        try { return Double.parseDouble(v.toString()); } catch (NumberFormatException e) { return Double.NaN; }
    }

    private int toInt(Map<String, Object> body, String key, int defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        // fractional or out-of-range values map to -1 so validation rejects them
        if (v instanceof Number n) {
            double d = n.doubleValue();
            boolean integral = d == Math.rint(d) && d >= Integer.MIN_VALUE && d <= Integer.MAX_VALUE;
            return integral ? n.intValue() : -1;
        }
        try { return Integer.parseInt(v.toString()); } catch (NumberFormatException e) { return -1; }
    }
}
