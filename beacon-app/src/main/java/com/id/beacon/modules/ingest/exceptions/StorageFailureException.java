package com.id.beacon.modules.ingest.exceptions;

import org.springframework.http.HttpStatus;

/**
 * Thrown when none of the records of a non-empty batch could be persisted.
 */
public class StorageFailureException extends TelemetryIngestException {

    public StorageFailureException(String message) {
        super(message);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
