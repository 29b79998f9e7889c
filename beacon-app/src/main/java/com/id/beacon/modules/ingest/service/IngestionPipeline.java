package com.id.beacon.modules.ingest.service;

import com.id.beacon.model.BeaconIngestAck;
import com.id.beacon.model.BeaconTelemetryBatch;
import com.id.beacon.modules.alerts.service.AlertDispatcher;
import com.id.beacon.modules.anomaly.logic.MadAnomalyDetector;
import com.id.beacon.modules.anomaly.model.BeaconAnomaly;
import com.id.beacon.modules.decoder.model.TelemetryHint;
import com.id.beacon.modules.decoder.service.TelemetryDecoder;
import com.id.beacon.modules.ingest.exceptions.MalformedPayloadException;
import com.id.beacon.modules.ingest.exceptions.StorageFailureException;
import com.id.beacon.modules.ingest.logic.ApiKeyVerifier;
import com.id.beacon.modules.storage.model.BeaconStorageWriteResult;
import com.id.beacon.modules.storage.service.TelemetryStorageWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * One ingestion call end to end: body check, authentication, decode, store, detect, dispatch.
 */
@Service
@Slf4j
public class IngestionPipeline {

    private final ApiKeyVerifier apiKeyVerifier;
    private final TelemetryDecoder decoder;
    private final TelemetryStorageWriter storageWriter;
    private final MadAnomalyDetector detector;
    private final AlertDispatcher alertDispatcher;

    public IngestionPipeline(ApiKeyVerifier apiKeyVerifier,
                             TelemetryDecoder decoder,
                             TelemetryStorageWriter storageWriter,
                             MadAnomalyDetector detector,
                             AlertDispatcher alertDispatcher) {
        this.apiKeyVerifier = apiKeyVerifier;
        this.decoder = decoder;
        this.storageWriter = storageWriter;
        this.detector = detector;
        this.alertDispatcher = alertDispatcher;
    }

    public BeaconIngestAck ingest(byte[] body, String apiKey, String contentEncoding, String bodyEncoding, TelemetryHint hint) {
        // An empty body is a 400 whatever the headers say
        if (body == null || body.length == 0) {
            log.warn("Rejected request with empty body");
            throw new MalformedPayloadException("Empty request body");
        }
        apiKeyVerifier.verify(apiKey);

        BeaconTelemetryBatch batch = decoder.decode(body, contentEncoding, bodyEncoding, hint);
        if (batch.getRejected() > 0) {
            log.warn("Dropped %d malformed %s records".formatted(batch.getRejected(), batch.getDialect()));
        }

        BeaconStorageWriteResult writeResult = batch.isEmpty()
                ? BeaconStorageWriteResult.builder().build()
                : storageWriter.write(batch);
        if (writeResult.isTotalFailure()) {
            throw new StorageFailureException("None of the %d records could be stored".formatted(writeResult.getAttempted()));
        }
        if (writeResult.getFailed() > 0) {
            log.warn("%d of %d records failed to store".formatted(writeResult.getFailed(), writeResult.getAttempted()));
        }

        List<BeaconAnomaly> anomalies = detector.detect(batch.getSamples());
        if (!anomalies.isEmpty()) {
            // Records are already stored; alerting must not turn the ack into a retry
            try {
                alertDispatcher.dispatch(anomalies);
            } catch (RuntimeException e) {
                log.error("Could not hand %d anomalies to the alert dispatcher".formatted(anomalies.size()), e);
            }
        }

        log.info("Ingested %s batch for cluster '%s': %d received, %d stored, %d failed, %d rejected, %d anomalies".formatted(
                batch.getDialect(), batch.getLastSeenClusterId(), batch.size(), writeResult.getWritten(),
                writeResult.getFailed(), batch.getRejected(), anomalies.size()));

        return BeaconIngestAck.builder()
                .dialect(batch.getDialect())
                .received(batch.size())
                .stored(writeResult.getWritten())
                .failed(writeResult.getFailed())
                .rejected(batch.getRejected())
                .anomalies(anomalies.size())
                .build();
    }
}
