package com.id.beacon.modules.ingest.exceptions;

import org.springframework.http.HttpStatus;

public class MalformedPayloadException extends TelemetryIngestException {

    public MalformedPayloadException(String message) {
        super(message);
    }

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.BAD_REQUEST;
    }
}
