package com.id.beacon.modules.ingest.exceptions;

import org.springframework.http.HttpStatus;

/**
 * Thrown when no dialect of the auto-detection chain could decode the payload.
 */
public class AmbiguousPayloadException extends TelemetryIngestException {

    public AmbiguousPayloadException(String message) {
        super(message);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.BAD_REQUEST;
    }
}
