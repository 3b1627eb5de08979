package com.eventaudit.api;

import com.eventaudit.domain.exception.BackendUnavailableException;
import com.eventaudit.domain.exception.CacheWaitTimeoutException;
import com.eventaudit.domain.exception.ConfigurationMissingException;
import com.eventaudit.domain.exception.UnknownCheckException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps audit failures that escape the detector to error bodies.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ConfigurationMissingException.class)
    public ResponseEntity<ErrorResponse> handleConfigurationMissing(ConfigurationMissingException ex) {
        log.error("Configuration missing", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "CONFIGURATION_MISSING", ex.getMessage());
    }

    @ExceptionHandler(BackendUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleBackendUnavailable(BackendUnavailableException ex) {
        log.warn("Backend unavailable: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "BACKEND_UNAVAILABLE", ex.getMessage());
    }

    @ExceptionHandler(CacheWaitTimeoutException.class)
    public ResponseEntity<ErrorResponse> handleCacheWaitTimeout(CacheWaitTimeoutException ex) {
        return respond(HttpStatus.GATEWAY_TIMEOUT, "CACHE_WAIT_TIMEOUT", ex.getMessage());
    }

    @ExceptionHandler(UnknownCheckException.class)
    public ResponseEntity<ErrorResponse> handleUnknownCheck(UnknownCheckException ex) {
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Rejected request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAllExceptions(Exception ex) {
        log.error("Unhandled exception occurred", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR", ex.getMessage());
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String details) {
        ErrorResponse error = ErrorResponse.builder()
                .code(code)
                .message(status.getReasonPhrase())
                .details(details)
                .build();
        return ResponseEntity.status(status).body(error);
    }
}
