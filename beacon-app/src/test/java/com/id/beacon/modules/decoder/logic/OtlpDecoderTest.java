package com.id.beacon.modules.decoder.logic;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.id.beacon.model.BeaconLogRecord;
import com.id.beacon.model.BeaconMetricSample;
import com.id.beacon.model.BeaconSpan;
import com.id.beacon.model.BeaconTelemetryBatch;
import com.id.beacon.model.BeaconTelemetryDialect;
import com.id.beacon.modules.decoder.model.DecodeResult;
import com.id.beacon.modules.decoder.model.TelemetrySignal;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OtlpDecoderTest {

    private final OtlpDecoder decoder = new OtlpDecoder(new ObjectMapper());

    private BeaconTelemetryBatch decodeOk(byte[] payload, TelemetrySignal signal) {
        DecodeResult result = decoder.decode(payload, signal);
        if (result instanceof DecodeResult.Failure failure) {
            fail(failure.describe());
        }
        return ((DecodeResult.Success) result).batch();
    }

    @Test
    void decodesGaugeAndHistogramPoints() {
        var batch = decodeOk(OtlpFixtures.metricsRequest().toByteArray(), TelemetrySignal.METRICS);

        assertEquals(BeaconTelemetryDialect.OTLP, batch.getDialect());
        assertEquals(4, batch.getSamples().size());

        BeaconMetricSample first = batch.getSamples().get(0);
        assertEquals("queue_depth", first.getMetricName());
        assertEquals(12.5, first.getValue());
        assertEquals(1_700_000_000.0, first.getTimestamp(), 1e-6);
        assertEquals("worker-1", first.getLabels().get("instance"));
        assertEquals("checkout", first.getLabels().get("service.name"));
        assertEquals("checkout", first.getClusterId());

        assertEquals(14.0, batch.getSamples().get(1).getValue());
        assertEquals("request_seconds_count", batch.getSamples().get(2).getMetricName());
        assertEquals(4.0, batch.getSamples().get(2).getValue());
        assertEquals("request_seconds_sum", batch.getSamples().get(3).getMetricName());
        assertEquals(2.0, batch.getSamples().get(3).getValue());
    }

    @Test
    void decodesLogs() {
        var batch = decodeOk(OtlpFixtures.logsRequest().toByteArray(), TelemetrySignal.LOGS);

        assertEquals(2, batch.getLogs().size());
        BeaconLogRecord error = batch.getLogs().get(0);
        assertEquals("ERROR", error.getSeverity());
        assertEquals("card declined", error.getBody());
        assertEquals(OtlpFixtures.T0_NANOS, error.getTimestamp());
        assertEquals("42", error.getAttributes().get("order"));
        assertEquals("payments", error.getTenantId());

        BeaconLogRecord warn = batch.getLogs().get(1);
        assertEquals("WARN", warn.getSeverity());
        assertEquals(OtlpFixtures.T0_NANOS + 5, warn.getTimestamp());
    }

    @Test
    void decodesSpansAndRejectsNegativeDuration() {
        var batch = decodeOk(OtlpFixtures.tracesRequest().toByteArray(), TelemetrySignal.TRACES);

        assertEquals(1, batch.getSpans().size());
        assertEquals(1, batch.getRejected());
        BeaconSpan span = batch.getSpans().get(0);
        assertArrayEquals(OtlpFixtures.TRACE_ID, span.getTraceId());
        assertArrayEquals(OtlpFixtures.PARENT_ID, span.getParentSpanId());
        assertFalse(span.isRoot());
        assertEquals("ERROR", span.getStatusCode());
        assertEquals(2_000_000L, span.duration());
        assertEquals("retry", span.getEvents().get(0).getName());
        assertEquals("gateway", span.getTenantId());
    }

    @Test
    void autoDetectsSignalOfBinaryPayload() {
        assertFalse(decodeOk(OtlpFixtures.logsRequest().toByteArray(), TelemetrySignal.ANY).getLogs().isEmpty());
        assertFalse(decodeOk(OtlpFixtures.tracesRequest().toByteArray(), TelemetrySignal.ANY).getSpans().isEmpty());
        assertFalse(decodeOk(OtlpFixtures.metricsRequest().toByteArray(), TelemetrySignal.ANY).getSamples().isEmpty());
    }

    @Test
    void pinnedSignalDoesNotAcceptOtherSignal() {
        assertFalse(decoder.decode(OtlpFixtures.tracesRequest().toByteArray(), TelemetrySignal.METRICS).isSuccess());
    }

    @Test
    void decodesOtlpJsonWithHexIds() {
        String json = """
                {"resourceSpans":[{"resource":{"attributes":[{"key":"service.name","value":{"stringValue":"web"}}]},
                  "scopeSpans":[{"spans":[{
                    "traceId":"0102030405060708090a0b0c0d0e0f10",
                    "spanId":"0101010101010101",
                    "name":"GET /",
                    "startTimeUnixNano":"1700000000000000000",
                    "endTimeUnixNano":"1700000000000001000",
                    "status":{"code":1}}]}]}]}
                """;

        var batch = decodeOk(json.getBytes(StandardCharsets.UTF_8), TelemetrySignal.ANY);

        assertEquals(1, batch.getSpans().size());
        BeaconSpan span = batch.getSpans().get(0);
        assertArrayEquals(OtlpFixtures.TRACE_ID, span.getTraceId());
        assertTrue(span.isRoot());
        assertEquals("OK", span.getStatusCode());
        assertEquals("web", span.getTenantId());
    }

    @Test
    void decodesOtlpJsonMetrics() {
        String json = """
                {"resourceMetrics":[{"scopeMetrics":[{"metrics":[{"name":"temp",
                  "gauge":{"dataPoints":[{"timeUnixNano":"1700000000000000000","asDouble":21.5,
                    "attributes":[{"key":"cluster_id","value":{"stringValue":"lab"}}]}]}}]}]}]}
                """;

        var batch = decodeOk(json.getBytes(StandardCharsets.UTF_8), TelemetrySignal.METRICS);

        assertEquals(1, batch.getSamples().size());
        assertEquals(Map.of("cluster_id", "lab", "__name__", "temp"), batch.getSamples().get(0).getLabels());
        assertEquals("lab", batch.getSamples().get(0).getClusterId());
    }

    @Test
    void otherJsonIsNotOtlp() {
        var result = decoder.decode("{\"timeseries\":[]}".getBytes(StandardCharsets.UTF_8), TelemetrySignal.ANY);

        assertFalse(result.isSuccess());
    }

    @Test
    void plainTextIsNotOtlp() {
        var result = decoder.decode("2024-05-01T10:00:00Z host app[1]: hello".getBytes(StandardCharsets.UTF_8),
                TelemetrySignal.ANY);

        assertFalse(result.isSuccess());
    }
}
