package com.example.chatsync.controller;

import com.example.chatsync.store.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    // ValidationException is an IllegalArgumentException
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException e) {
        logger.warn("Rejected request: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "validation", e.getMessage());
    }

    @ExceptionHandler(StorageUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleStorage(StorageUnavailableException e) {
        logger.error("Storage unavailable: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "storage_unavailable", e.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleStatus(ResponseStatusException e) {
        logger.warn("Request failed: {}", e.getMessage());
        HttpStatus status = HttpStatus.resolve(e.getStatusCode().value());
        return error(status != null ? status : HttpStatus.BAD_REQUEST, "request", e.getReason());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception e) {
        logger.error("Unhandled error", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal", "Internal server error");
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
