package com.storefront.scraper.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps domain exceptions raised through the REST layer to JSON error bodies.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleJobNotFound(JobNotFoundException e) {
        log.warn("Job not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Job not found", e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        Map<String, String> errors = new LinkedHashMap<>();
        e.getBindingResult().getAllErrors().forEach(error -> {
            String field = error instanceof FieldError fe ? fe.getField() : error.getObjectName();
            errors.put(field, error.getDefaultMessage());
        });
        log.warn("Validation error: {}", errors);
        return respond(HttpStatus.BAD_REQUEST, "Validation failed", errors.toString());
    }

    @ExceptionHandler({IllegalArgumentException.class, InvalidProxyException.class,
            DeviceNotFoundException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleBadInput(RuntimeException e) {
        log.warn("Bad request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid argument", e.getMessage());
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ErrorResponse> handleRateLimit(RateLimitExceededException e) {
        log.warn("Rate limit: {}", e.getMessage());
        return respond(HttpStatus.TOO_MANY_REQUESTS, "Rate limit exceeded", e.getMessage());
    }

    @ExceptionHandler(NoProxyAvailableException.class)
    public ResponseEntity<ErrorResponse> handleNoProxy(NoProxyAvailableException e) {
        log.warn("No proxy: {}", e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "No proxy available", e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception e) {
        log.error("Unexpected error occurred", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error",
                e.getMessage() != null ? e.getMessage() : "An unexpected error occurred");
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String message, String details) {
        return ResponseEntity.status(status).body(new ErrorResponse(status.value(), message, details));
    }

    public record ErrorResponse(int status, String message, String details) {
    }
}
