package com.id.beacon.model;

/**
 * Wire encodings understood by the ingestion pipeline, listed in auto-detection priority order.
 */
public enum BeaconTelemetryDialect {

    PROMETHEUS_REMOTE_WRITE,
    OTLP,
    JSON_TIMESERIES,
    FREE_TEXT_LOG

}
