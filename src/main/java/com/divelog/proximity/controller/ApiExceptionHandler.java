package com.divelog.proximity.controller;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Maps bad client input to 400 responses with a small JSON body.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException e) {
        List<String> errors = e.getBindingResult().getFieldErrors().stream()
            .map(ApiExceptionHandler::describe)
            .toList();
        log.debug("Rejected request: {}", errors);
        return badRequest("Validation failed", errors);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
        log.debug("Rejected request: {}", e.getMessage());
        return badRequest(e.getMessage(), List.of());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException e) {
        // Jackson wraps exceptions thrown from record constructors
        Throwable cause = e.getMostSpecificCause();
        String message = cause instanceof IllegalArgumentException ? cause.getMessage() : "Malformed request body";
        log.debug("Rejected request body: {}", cause.getMessage());
        return badRequest(message, List.of());
    }

    private static ResponseEntity<Map<String, Object>> badRequest(String message, List<String> errors) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
            "status", "ERROR",
            "message", message != null ? message : "Bad request",
            "errors", errors,
            "timestamp", Instant.now().toString()
        ));
    }

    private static String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }
}
