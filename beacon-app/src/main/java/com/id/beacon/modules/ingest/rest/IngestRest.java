package com.id.beacon.modules.ingest.rest;

import com.id.beacon.model.BeaconIngestAck;
import com.id.beacon.modules.decoder.model.TelemetryHint;
import com.id.beacon.modules.ingest.logic.ApiKeyVerifier;
import com.id.beacon.modules.ingest.service.IngestionPipeline;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

/**
 * Telemetry push endpoints. The OTLP and remote-write paths pin their dialect; {@code /} and
 * {@code /ingest} auto-detect it.
 */
@RestController
public class IngestRest {

    public static final String BODY_ENCODING_HEADER = "x-body-encoding";
    public static final String TRANSFER_ENCODING_HEADER = "Content-Transfer-Encoding";

    private final IngestionPipeline pipeline;

    public IngestRest(IngestionPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @PostMapping({"/", "ingest"})
    public BeaconIngestAck ingest(@RequestBody(required = false) byte[] body, @RequestHeader HttpHeaders headers) {
        return handle(body, headers, TelemetryHint.AUTO);
    }

    @PostMapping("api/v1/write")
    public BeaconIngestAck remoteWrite(@RequestBody(required = false) byte[] body, @RequestHeader HttpHeaders headers) {
        return handle(body, headers, TelemetryHint.PROMETHEUS_REMOTE_WRITE);
    }

    @PostMapping("v1/metrics")
    public BeaconIngestAck otlpMetrics(@RequestBody(required = false) byte[] body, @RequestHeader HttpHeaders headers) {
        return handle(body, headers, TelemetryHint.OTLP_METRICS);
    }

    @PostMapping("v1/logs")
    public BeaconIngestAck otlpLogs(@RequestBody(required = false) byte[] body, @RequestHeader HttpHeaders headers) {
        return handle(body, headers, TelemetryHint.OTLP_LOGS);
    }

    @PostMapping("v1/traces")
    public BeaconIngestAck otlpTraces(@RequestBody(required = false) byte[] body, @RequestHeader HttpHeaders headers) {
        return handle(body, headers, TelemetryHint.OTLP_TRACES);
    }

    private BeaconIngestAck handle(byte[] body, HttpHeaders headers, TelemetryHint hint) {
        String bodyEncoding = headers.getFirst(BODY_ENCODING_HEADER);
        if (bodyEncoding == null) {
            bodyEncoding = headers.getFirst(TRANSFER_ENCODING_HEADER);
        }
        return pipeline.ingest(
                body,
                headers.getFirst(ApiKeyVerifier.API_KEY_HEADER),
                headers.getFirst(HttpHeaders.CONTENT_ENCODING),
                bodyEncoding,
                hint);
    }
}
