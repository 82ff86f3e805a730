package com.runtimehub.runtime_engine.controller;

import com.runtimehub.runtime_engine.engine.exception.CapacityException;
import com.runtimehub.runtime_engine.engine.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps admission failures to HTTP statuses with a {@code {error, type}} body.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, String>> validation(ValidationException e) {
        return body(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(CapacityException.class)
    public ResponseEntity<Map<String, String>> capacity(CapacityException e) {
        log.warn("Rejected workflow: {}", e.getMessage());
        return body(HttpStatus.TOO_MANY_REQUESTS, e);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> unreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest()
                .body(Map.of("error", "Malformed workflow payload", "type", "ValidationException"));
    }

    private static ResponseEntity<Map<String, String>> body(HttpStatus status, RuntimeException e) {
        return ResponseEntity.status(status)
                .body(Map.of("error", e.getMessage(), "type", e.getClass().getSimpleName()));
    }
}
