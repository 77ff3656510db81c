package com.quantlab.orchestrator.controller;

import com.quantlab.orchestrator.exception.ConflictingJobException;
import com.quantlab.orchestrator.exception.InvalidJobStateException;
import com.quantlab.orchestrator.exception.JobNotFoundException;
import com.quantlab.orchestrator.exception.RemoteRejectedException;
import com.quantlab.orchestrator.exception.StorageUnavailableException;
import com.quantlab.orchestrator.exception.StrategyNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Maps orchestrator exceptions to JSON error bodies {@code {status, reason, message, ts}}.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(ConflictingJobException.class)
    public ResponseEntity<Map<String, Object>> conflict(ConflictingJobException ex) {
        Map<String, Object> body = body("active_job_exists", ex.getMessage());
        if (ex.getActiveJobId() != null) {
            body.put("activeJobId", ex.getActiveJobId());
        }
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler(InvalidJobStateException.class)
    public ResponseEntity<Map<String, Object>> invalidState(InvalidJobStateException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body("invalid_job_state", ex.getMessage()));
    }

    @ExceptionHandler(RemoteRejectedException.class)
    public ResponseEntity<Map<String, Object>> remoteRejected(RemoteRejectedException ex) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body("remote_rejected", ex.getMessage()));
    }

    @ExceptionHandler({JobNotFoundException.class, StrategyNotFoundException.class})
    public ResponseEntity<Map<String, Object>> notFound(RuntimeException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body("not_found", ex.getMessage()));
    }

    @ExceptionHandler(StorageUnavailableException.class)
    public ResponseEntity<Map<String, Object>> storageUnavailable(StorageUnavailableException ex) {
        log.error("Storage unavailable: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body("storage_unavailable", ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(body("bad_request", ex.getMessage() == null ? "invalid_request" : ex.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body("bad_request", "malformed_request_body"));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> validation(MethodArgumentNotValidException ex) {
        Map<String, String> fields = new HashMap<>();
        for (FieldError fe : ex.getBindingResult().getFieldErrors()) {
            fields.put(fe.getField(), fe.getDefaultMessage() == null ? "invalid" : fe.getDefaultMessage());
        }
        Map<String, Object> body = body("validation_error", "invalid_request");
        body.put("fields", fields);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    private static Map<String, Object> body(String reason, String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("status", "error");
        body.put("reason", reason);
        body.put("message", message);
        body.put("ts", Instant.now().toString());
        return body;
    }
}
