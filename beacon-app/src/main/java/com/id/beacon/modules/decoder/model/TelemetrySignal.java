package com.id.beacon.modules.decoder.model;

public enum TelemetrySignal {
    ANY,
    METRICS,
    LOGS,
    TRACES;

    public boolean accepts(TelemetrySignal other) {
        return this == ANY || this == other;
    }
}
