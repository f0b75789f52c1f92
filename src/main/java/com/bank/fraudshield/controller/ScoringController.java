package com.bank.fraudshield.controller;

import com.bank.fraudshield.model.BatchItemResult;
import com.bank.fraudshield.model.EnsembleResult;
import com.bank.fraudshield.model.ExplainResponse;
import com.bank.fraudshield.service.InferenceService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Scoring", description = "Fraud prediction, explanation and batch scoring")
public class ScoringController {

    private final InferenceService inferenceService;

    public ScoringController(InferenceService inferenceService) {
        this.inferenceService = inferenceService;
    }

    @Operation(summary = "Score a transaction",
            description = "Validates the feature map against the bundle schema, scores it with every base model, " +
                    "fuses and calibrates the result and classifies it as SAFE, SUSPICIOUS or FRAUD.")
    @ApiResponse(responseCode = "200", description = "Prediction")
    @ApiResponse(responseCode = "400", description = "Feature map does not match the schema")
    @ApiResponse(responseCode = "503", description = "Too few base models available")
    @ApiResponse(responseCode = "504", description = "Request exceeded its time budget")
    @PostMapping("/predict")
    public ResponseEntity<EnsembleResult> predict(@RequestBody Map<String, Object> features) {
        return ResponseEntity.ok(inferenceService.predict(features));
    }

    @Operation(summary = "Score and explain a transaction",
            description = "Same as /predict, plus per-model breakdown, global feature attribution, risk factors, " +
                    "model consensus and reviewer recommendations.")
    @PostMapping("/explain")
    public ResponseEntity<ExplainResponse> explain(@RequestBody Map<String, Object> features) {
        return ResponseEntity.ok(inferenceService.explain(features));
    }

    @Operation(summary = "Score a batch of transactions",
            description = "Each item is scored independently. Always returns 200; failed items carry their error in place.")
    @PostMapping("/predict/batch")
    public ResponseEntity<List<BatchItemResult>> predictBatch(@RequestBody List<Map<String, Object>> items) {
        return ResponseEntity.ok(inferenceService.predictBatch(items));
    }
}
