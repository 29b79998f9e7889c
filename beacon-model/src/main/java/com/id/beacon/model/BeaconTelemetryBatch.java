package com.id.beacon.model;

import com.id.beacon.utils.BeaconTelemetryBatchBuilder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * The canonical records decoded from one request body, in the order they appeared on the wire.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BeaconTelemetryBatch {

    public static final String UNKNOWN_CLUSTER = "unknown";

    private BeaconTelemetryDialect dialect;

    private List<BeaconMetricSample> samples = new ArrayList<>();
    private List<BeaconLogRecord> logs = new ArrayList<>();
    private List<BeaconSpan> spans = new ArrayList<>();

    // records dropped during decoding (no metric name, span ending before it starts...)
    private int rejected;

    // most recently seen cluster, for log lines only
    private String lastSeenClusterId = UNKNOWN_CLUSTER;

    public static BeaconTelemetryBatchBuilder builder(BeaconTelemetryDialect dialect) {
        return new BeaconTelemetryBatchBuilder(dialect);
    }

    public int size() {
        return samples.size() + logs.size() + spans.size();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

}
