package com.id.beacon.modules.ingest.exceptions;

import org.springframework.http.HttpStatus;

/**
 * Root of the failures an ingestion call can surface to its caller. Each subtype carries the HTTP
 * status it maps to.
 */
public abstract class TelemetryIngestException extends RuntimeException {

    protected TelemetryIngestException(String message) {
        super(message);
    }

    protected TelemetryIngestException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract HttpStatus getStatus();
}
