package com.promptvault.controller;

import com.promptvault.exception.PromptNotFoundException;
import com.promptvault.exception.SnapshotParseException;
import com.promptvault.exception.StorageException;
import com.promptvault.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps the library's error kinds to HTTP responses with a small JSON body.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, String>> handleValidation(ValidationException e) {
        return error(HttpStatus.BAD_REQUEST, "validation", e.getMessage());
    }

    @ExceptionHandler(SnapshotParseException.class)
    public ResponseEntity<Map<String, String>> handleParse(SnapshotParseException e) {
        return error(HttpStatus.BAD_REQUEST, "parse", e.getMessage());
    }

    @ExceptionHandler(PromptNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(PromptNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, "not_found", e.getMessage());
    }

    @ExceptionHandler({StorageException.class, DataAccessException.class})
    public ResponseEntity<Map<String, String>> handleStorage(RuntimeException e) {
        log.error("Storage failure", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "storage", e.getMessage());
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String kind, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "error", kind,
                "message", message != null ? message : status.getReasonPhrase()
        ));
    }
}
