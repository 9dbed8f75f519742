package com.deepansh.trader.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps failures escaping the agent and trace endpoints to {@code {error, type, timestamp}}.
 * Cycle and action failures never reach here: they travel as outcome values.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(OracleConfigurationException.class)
    public ResponseEntity<Map<String, Object>> handleOracleConfiguration(OracleConfigurationException ex) {
        log.error("Oracle misconfigured: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), "oracle_configuration");
    }

    @ExceptionHandler(DataSourceException.class)
    public ResponseEntity<Map<String, Object>> handleDataSource(DataSourceException ex) {
        log.warn("Data source unavailable [source={}]: {}", ex.getSource(), ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, ex.getMessage(), "data_source");
    }

    @ExceptionHandler(StateStoreException.class)
    public ResponseEntity<Map<String, Object>> handleStateStore(StateStoreException ex) {
        log.error("State file unavailable: {}", ex.getMessage(), ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), "state_store");
    }

    @ExceptionHandler(AgentException.class)
    public ResponseEntity<Map<String, Object>> handleAgent(AgentException ex) {
        log.error("Agent error: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), "agent");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String msg = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .findFirst()
                .orElse("Validation failed");
        return respond(HttpStatus.BAD_REQUEST, msg, "validation");
    }

    // Malformed start parameters
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        return respond(HttpStatus.BAD_REQUEST, "Request body is not valid JSON", "validation");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneral(Exception ex) {
        log.error("Unexpected error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", "internal");
    }

    private ResponseEntity<Map<String, Object>> respond(HttpStatus status, String message, String type) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message == null ? status.getReasonPhrase() : message);
        body.put("type", type);
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(status).body(body);
    }
}
