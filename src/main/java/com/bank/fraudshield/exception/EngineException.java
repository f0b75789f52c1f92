package com.bank.fraudshield.exception;

import java.util.Map;

/**
 * Base class for the engine's typed errors. Each subclass carries a stable
 * error code and a short type name that is surfaced to callers.
 */
public abstract class EngineException extends RuntimeException {

    private final String errorCode;

    protected EngineException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected EngineException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /** Type name as exposed in error bodies, e.g. "SchemaViolation". */
    public abstract String getErrorType();

    /** Structured details for the error body. */
    public Map<String, Object> getDetails() {
        return Map.of();
    }
}
