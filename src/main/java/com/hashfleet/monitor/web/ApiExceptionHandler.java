package com.hashfleet.monitor.web;

import com.hashfleet.monitor.ingest.ReportValidationException;
import com.hashfleet.monitor.storage.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps the error taxonomy to HTTP: client errors are 400 and never logged as
 * failures, store failures are 500, unsupported backend queries 501.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ReportValidationException.class)
    public ResponseEntity<Map<String, String>> invalidReport(ReportValidationException e) {
        log.warn("Rejected report: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> unreadable(HttpMessageNotReadableException e) {
        log.warn("Rejected unreadable request body: {}", e.getMostSpecificCause().getMessage());
        return error(HttpStatus.BAD_REQUEST, "Malformed JSON body");
    }

    @ExceptionHandler(PersistenceException.class)
    public ResponseEntity<Map<String, String>> persistenceFailure(PersistenceException e) {
        log.error("Error processing hashrate data: {}", e.getMessage());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    @ExceptionHandler(UnsupportedOperationException.class)
    public ResponseEntity<Map<String, String>> unsupported(UnsupportedOperationException e) {
        return error(HttpStatus.NOT_IMPLEMENTED, e.getMessage());
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", String.valueOf(message)));
    }
}
