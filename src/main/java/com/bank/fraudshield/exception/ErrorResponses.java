package com.bank.fraudshield.exception;

import com.bank.fraudshield.model.ErrorResponse;

/** Builds error bodies for typed engine errors and unexpected failures. */
public final class ErrorResponses {

    public static final String INTERNAL_ERROR_CODE = "ERR-INTERNAL-001";

    private ErrorResponses() {}

    public static ErrorResponse of(EngineException e) {
        return ErrorResponse.builder()
                .errorCode(e.getErrorCode())
                .error(e.getErrorType())
                .message(e.getMessage())
                .details(e.getDetails().isEmpty() ? null : e.getDetails())
                .timestamp(System.currentTimeMillis())
                .build();
    }

    public static ErrorResponse internal(String message) {
        return ErrorResponse.builder()
                .errorCode(INTERNAL_ERROR_CODE)
                .error("InternalError")
                .message(message)
                .timestamp(System.currentTimeMillis())
                .build();
    }
}
