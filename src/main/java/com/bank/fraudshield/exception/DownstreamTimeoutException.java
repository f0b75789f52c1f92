package com.bank.fraudshield.exception;

import java.util.Map;

/**
 * The request exceeded its wall-clock budget and was aborted.
 */
public class DownstreamTimeoutException extends EngineException {

    public static final String ERROR_CODE = "ERR-TIMEOUT-001";

    private final long budgetMs;

    public DownstreamTimeoutException(long budgetMs) {
        super(ERROR_CODE, "Request exceeded its " + budgetMs + " ms budget");
        this.budgetMs = budgetMs;
    }

    public long getBudgetMs() {
        return budgetMs;
    }

    @Override
    public String getErrorType() {
        return "DownstreamTimeout";
    }

    @Override
    public Map<String, Object> getDetails() {
        return Map.of("budgetMs", budgetMs);
    }
}
