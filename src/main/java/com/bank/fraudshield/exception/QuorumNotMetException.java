package com.bank.fraudshield.exception;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Too few base models produced a score to fuse a result. This is a degraded
 * service condition, not a client error.
 */
public class QuorumNotMetException extends EngineException {

    public static final String ERROR_CODE = "ERR-QUORUM-001";

    private final int available;
    private final int required;
    private final List<String> unavailableModels;

    public QuorumNotMetException(int available, int required, List<String> unavailableModels) {
        super(ERROR_CODE, String.format("Only %d base models produced a score, %d required", available, required));
        this.available = available;
        this.required = required;
        this.unavailableModels = List.copyOf(unavailableModels);
    }

    public int getAvailable() {
        return available;
    }

    public int getRequired() {
        return required;
    }

    public List<String> getUnavailableModels() {
        return unavailableModels;
    }

    @Override
    public String getErrorType() {
        return "QuorumNotMet";
    }

    @Override
    public Map<String, Object> getDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("available", available);
        details.put("required", required);
        details.put("unavailableModels", unavailableModels);
        return details;
    }
}
