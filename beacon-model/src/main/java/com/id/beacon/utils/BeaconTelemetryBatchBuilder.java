package com.id.beacon.utils;

import com.id.beacon.model.BeaconLogRecord;
import com.id.beacon.model.BeaconMetricSample;
import com.id.beacon.model.BeaconSpan;
import com.id.beacon.model.BeaconTelemetryBatch;
import com.id.beacon.model.BeaconTelemetryDialect;

import java.util.List;

public class BeaconTelemetryBatchBuilder {

    private final BeaconTelemetryBatch batch = new BeaconTelemetryBatch();

    public BeaconTelemetryBatchBuilder(BeaconTelemetryDialect dialect) {
        batch.setDialect(dialect);
    }

    /**
     * Adds a metric sample. Samples without a metric name or with a non-finite timestamp are counted as
     * rejected and dropped.
     *
     * @param sample the decoded sample, already tagged with its cluster id
     * @return this builder
     */
    public BeaconTelemetryBatchBuilder addSample(BeaconMetricSample sample) {
        String name = sample.getMetricName();
        if (name == null || name.isBlank() || !Double.isFinite(sample.getTimestamp())) {
            return reject();
        }
        batch.getSamples().add(sample);
        seen(sample.getClusterId());
        return this;
    }

    public BeaconTelemetryBatchBuilder addLog(BeaconLogRecord log) {
        batch.getLogs().add(log);
        seen(log.getTenantId());
        return this;
    }

    /**
     * Adds a span. Spans that end before they start are counted as rejected and dropped.
     *
     * @param span the decoded span
     * @return this builder
     */
    public BeaconTelemetryBatchBuilder addSpan(BeaconSpan span) {
        if (span.getEndTime() < span.getStartTime()) {
            return reject();
        }
        batch.getSpans().add(span);
        seen(span.getTenantId());
        return this;
    }

    public BeaconTelemetryBatchBuilder addSamples(List<BeaconMetricSample> samples) {
        samples.forEach(this::addSample);
        return this;
    }

    public BeaconTelemetryBatchBuilder reject() {
        batch.setRejected(batch.getRejected() + 1);
        return this;
    }

    /**
     * Returns the built batch. (No further changes should be made after calling build.)
     *
     * @return the batch built so far
     */
    public BeaconTelemetryBatch build() {
        return batch;
    }

    private void seen(String clusterId) {
        if (clusterId != null) {
            batch.setLastSeenClusterId(clusterId);
        }
    }
}
