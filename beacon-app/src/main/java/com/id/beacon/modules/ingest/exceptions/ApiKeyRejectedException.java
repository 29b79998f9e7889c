package com.id.beacon.modules.ingest.exceptions;

import org.springframework.http.HttpStatus;

public class ApiKeyRejectedException extends TelemetryIngestException {

    public ApiKeyRejectedException(String message) {
        super(message);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.FORBIDDEN;
    }
}
