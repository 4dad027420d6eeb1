package com.phillippitts.multiroomaudio.presentation.exception;

import com.phillippitts.multiroomaudio.exception.PlayerConfigStoreException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Orchestrator operations report expected failures as results; this only handles what
 * escapes them. Bodies keep the {@code success/error} shape of regular results.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - body missing or not valid JSON (HTTP 400).
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(ApiError.of("Request body must be valid JSON", ex.getClass().getSimpleName()));
    }

    /**
     * Client error - bean validation failed (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleInvalid(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
            .map(fe -> fe.getDefaultMessage())
            .collect(Collectors.joining("; "));
        LOG.warn("Request validation failed: {}", message);
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(ApiError.of(message, ex.getClass().getSimpleName()));
    }

    /**
     * Persistence unavailable (HTTP 503).
     */
    @ExceptionHandler(PlayerConfigStoreException.class)
    ResponseEntity<ApiError> handleStoreFailure(PlayerConfigStoreException ex) {
        LOG.error("Configuration store failure: path={}", ex.getPath(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(ApiError.of("Configuration store unavailable", ex.getClass().getSimpleName()));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ApiError.of("Internal server error", "InternalServerError"));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        boolean success,
        String error,
        String errorCode,
        Instant timestamp
    ) {
        static ApiError of(String error, String errorCode) {
            return new ApiError(false, error, errorCode, Instant.now());
        }
    }
}
