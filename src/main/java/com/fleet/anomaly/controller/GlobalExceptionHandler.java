package com.fleet.anomaly.controller;

import com.fleet.anomaly.exception.AnomalyStoreException;
import com.fleet.anomaly.exception.FeatureSchemaException;
import com.fleet.anomaly.exception.InvalidDetectionRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * The requested feature table is unusable or the request names a path outside the
     * allowed directories. Nothing was written.
     */
    @ExceptionHandler({FeatureSchemaException.class, InvalidDetectionRequestException.class})
    public ResponseEntity<Map<String, String>> handleInvalidInput(RuntimeException ex) {
        log.warn("Rejected detection request: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
                "error", "Invalid detection request",
                "message", ex.getMessage()));
    }

    /**
     * The service is misconfigured or a run could not complete; the caller cannot fix this.
     */
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, String>> handleServerState(IllegalStateException ex) {
        log.error("Detection run failed", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of(
                "error", "Detection failed",
                "message", ex.getMessage()));
    }

    /**
     * Reading the input or writing the anomaly table failed. Any previous output is untouched.
     */
    @ExceptionHandler(AnomalyStoreException.class)
    public ResponseEntity<Map<String, String>> handleStoreFailure(AnomalyStoreException ex) {
        log.error("Anomaly store failure", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of(
                "error", "Anomaly store failure",
                "message", ex.getMessage()));
    }
}
