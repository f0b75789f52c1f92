package com.bank.fraudshield.controller;

import com.bank.fraudshield.model.EngineInfo;
import com.bank.fraudshield.model.FeatureSchemaInfo;
import com.bank.fraudshield.model.HealthStatus;
import com.bank.fraudshield.service.EngineStatusService;
import com.bank.fraudshield.service.SampleVectorFactory;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Engine", description = "Health, bundle information and feature schema")
public class EngineController {

    private final EngineStatusService statusService;

    public EngineController(EngineStatusService statusService) {
        this.statusService = statusService;
    }

    @Operation(summary = "Engine health",
            description = "Reports loaded ML/DL model counts, meta-learner and explainer readiness and the bundle version.")
    @GetMapping("/health")
    public ResponseEntity<HealthStatus> health() {
        return ResponseEntity.ok(statusService.health());
    }

    @Operation(summary = "Bundle and decision configuration",
            description = "Bundle version, feature schema version, decision threshold, risk bands, quorum and model list.")
    @GetMapping("/info")
    public ResponseEntity<EngineInfo> info() {
        return ResponseEntity.ok(statusService.info());
    }

    @Operation(summary = "Feature schema", description = "Expected feature count and names in canonical order.")
    @GetMapping("/features")
    public ResponseEntity<FeatureSchemaInfo> features() {
        return ResponseEntity.ok(statusService.features());
    }

    @Operation(summary = "Sample feature map",
            description = "Deterministic synthetic feature map for smoke testing /predict and /explain.")
    @GetMapping("/features/sample")
    public ResponseEntity<?> sample(
            @Parameter(description = "normal or fraud", example = "normal")
            @RequestParam(defaultValue = "normal") String profile) {
        SampleVectorFactory.Profile parsed;
        try {
            parsed = SampleVectorFactory.Profile.valueOf(profile.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "profile must be 'normal' or 'fraud'", "field", "profile"));
        }
        return ResponseEntity.ok(statusService.sample(parsed));
    }
}
