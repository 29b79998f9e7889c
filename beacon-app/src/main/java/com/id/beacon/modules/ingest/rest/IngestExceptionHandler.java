package com.id.beacon.modules.ingest.rest;

import com.id.beacon.modules.ingest.exceptions.TelemetryIngestException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * Maps ingestion failures to their HTTP status. Framework errors (including
 * {@link org.springframework.web.server.ResponseStatusException}) keep the base class handling;
 * anything else is a 500.
 */
@RestControllerAdvice
@Slf4j
public class IngestExceptionHandler extends ResponseEntityExceptionHandler {

    @ExceptionHandler(TelemetryIngestException.class)
    public ResponseEntity<ProblemDetail> handleIngest(TelemetryIngestException e) {
        if (e.getStatus().is5xxServerError()) {
            log.error("Ingestion failed: {}", e.getMessage());
        } else {
            log.debug("Ingestion rejected with {}: {}", e.getStatus().value(), e.getMessage());
        }
        return ResponseEntity.status(e.getStatus()).body(ProblemDetail.forStatusAndDetail(e.getStatus(), e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleUnexpected(Exception e) {
        log.error("Unexpected failure while handling request", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error"));
    }
}
