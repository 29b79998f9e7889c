package com.id.beacon.modules.decoder.model;

import com.id.beacon.model.BeaconTelemetryDialect;
import lombok.Getter;

/**
 * Format hint derived from the endpoint a payload was posted to. Every hint except {@link #AUTO} pins
 * a single dialect: no fallback is attempted and a parse failure is terminal.
 */
@Getter
public enum TelemetryHint {

    AUTO(null, TelemetrySignal.ANY),
    PROMETHEUS_REMOTE_WRITE(BeaconTelemetryDialect.PROMETHEUS_REMOTE_WRITE, TelemetrySignal.METRICS),
    OTLP_METRICS(BeaconTelemetryDialect.OTLP, TelemetrySignal.METRICS),
    OTLP_LOGS(BeaconTelemetryDialect.OTLP, TelemetrySignal.LOGS),
    OTLP_TRACES(BeaconTelemetryDialect.OTLP, TelemetrySignal.TRACES);

    private final BeaconTelemetryDialect dialect;
    private final TelemetrySignal signal;

    TelemetryHint(BeaconTelemetryDialect dialect, TelemetrySignal signal) {
        this.dialect = dialect;
        this.signal = signal;
    }

    public boolean isPinned() {
        return dialect != null;
    }
}
