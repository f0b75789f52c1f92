package com.bank.fraudshield.controller;

import com.bank.fraudshield.exception.DownstreamTimeoutException;
import com.bank.fraudshield.exception.EngineException;
import com.bank.fraudshield.exception.ErrorResponses;
import com.bank.fraudshield.exception.QuorumNotMetException;
import com.bank.fraudshield.exception.SchemaViolationException;
import com.bank.fraudshield.model.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps engine errors to HTTP status codes and a uniform error body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(SchemaViolationException.class)
    public ResponseEntity<ErrorResponse> handleSchemaViolation(SchemaViolationException ex) {
        log.debug("Schema violation: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ErrorResponses.of(ex));
    }

    @ExceptionHandler(QuorumNotMetException.class)
    public ResponseEntity<ErrorResponse> handleQuorumNotMet(QuorumNotMetException ex) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ErrorResponses.of(ex));
    }

    @ExceptionHandler(DownstreamTimeoutException.class)
    public ResponseEntity<ErrorResponse> handleTimeout(DownstreamTimeoutException ex) {
        log.warn("Request timed out: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT).body(ErrorResponses.of(ex));
    }

    @ExceptionHandler(EngineException.class)
    public ResponseEntity<ErrorResponse> handleEngineException(EngineException ex) {
        log.error("Engine error {}: {}", ex.getErrorCode(), ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponses.of(ex));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ErrorResponse.builder()
                .errorCode("ERR-REQUEST-001")
                .error("MalformedRequest")
                .message("Request body is not valid JSON of the expected shape")
                .timestamp(System.currentTimeMillis())
                .build());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponses.internal("An unexpected error occurred"));
    }
}
