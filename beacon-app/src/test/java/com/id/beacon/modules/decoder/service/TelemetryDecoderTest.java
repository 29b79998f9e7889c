package com.id.beacon.modules.decoder.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.id.beacon.model.BeaconTelemetryBatch;
import com.id.beacon.model.BeaconTelemetryDialect;
import com.id.beacon.modules.decoder.logic.FreeTextLogDecoder;
import com.id.beacon.modules.decoder.logic.JsonTimeseriesDecoder;
import com.id.beacon.modules.decoder.logic.OtlpDecoder;
import com.id.beacon.modules.decoder.logic.OtlpFixtures;
import com.id.beacon.modules.decoder.logic.PrometheusRemoteWriteDecoder;
import com.id.beacon.modules.decoder.model.TelemetryHint;
import com.id.beacon.modules.ingest.exceptions.AmbiguousPayloadException;
import com.id.beacon.modules.ingest.exceptions.MalformedPayloadException;
import org.junit.jupiter.api.Test;
import org.xerial.snappy.Snappy;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Base64;
import java.util.Map;
import java.util.zip.GZIPOutputStream;

import static com.id.beacon.modules.decoder.logic.RemoteWriteFixtures.series;
import static com.id.beacon.modules.decoder.logic.RemoteWriteFixtures.writeRequest;
import static org.junit.jupiter.api.Assertions.*;

class TelemetryDecoderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private final TelemetryDecoder decoder = new TelemetryDecoder(
            new PayloadDecompressor(),
            new PrometheusRemoteWriteDecoder(),
            new OtlpDecoder(objectMapper),
            new JsonTimeseriesDecoder(objectMapper),
            new FreeTextLogDecoder(Clock.systemUTC()));

    private static final String JSON = "{\"timeseries\":[{\"labels\":{\"__name__\":\"up\"},\"samples\":[{\"timestamp_ms\":1000,\"value\":1}]}]}";
    private static final String SYSLOG = "2024-05-01T10:00:00Z web-1 nginx[1]: started";

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void autoDetectsEachDialect() throws IOException {
        byte[] remoteWrite = writeRequest(series(Map.of("__name__", "up"), 1.0, 1000L));

        assertEquals(BeaconTelemetryDialect.PROMETHEUS_REMOTE_WRITE,
                decoder.decode(Snappy.compress(remoteWrite), "snappy", null, TelemetryHint.AUTO).getDialect());
        assertEquals(BeaconTelemetryDialect.OTLP,
                decoder.decode(OtlpFixtures.logsRequest().toByteArray(), null, null, TelemetryHint.AUTO).getDialect());
        assertEquals(BeaconTelemetryDialect.JSON_TIMESERIES,
                decoder.decode(utf8(JSON), null, null, TelemetryHint.AUTO).getDialect());
        assertEquals(BeaconTelemetryDialect.FREE_TEXT_LOG,
                decoder.decode(utf8(SYSLOG), null, null, TelemetryHint.AUTO).getDialect());
    }

    @Test
    void unwrapsBase64ThenGzip() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new GZIPOutputStream(bytes)) {
            gzip.write(utf8(JSON));
        }
        byte[] envelope = Base64.getEncoder().encode(bytes.toByteArray());

        BeaconTelemetryBatch batch = decoder.decode(envelope, "gzip", "base64", TelemetryHint.AUTO);

        assertEquals(1, batch.getSamples().size());
    }

    @Test
    void pinnedDialectDoesNotFallBack() {
        var e = assertThrows(MalformedPayloadException.class,
                () -> decoder.decode(utf8(JSON), null, null, TelemetryHint.PROMETHEUS_REMOTE_WRITE));
        assertTrue(e.getMessage().contains("PROMETHEUS_REMOTE_WRITE"));

        assertThrows(MalformedPayloadException.class,
                () -> decoder.decode(OtlpFixtures.tracesRequest().toByteArray(), null, null, TelemetryHint.OTLP_METRICS));
    }

    @Test
    void pinnedOtlpSignal() {
        var batch = decoder.decode(OtlpFixtures.tracesRequest().toByteArray(), null, null, TelemetryHint.OTLP_TRACES);

        assertEquals(1, batch.getSpans().size());
    }

    @Test
    void unknownPayloadIsAmbiguous() {
        var e = assertThrows(AmbiguousPayloadException.class,
                () -> decoder.decode(utf8("just some words"), null, null, TelemetryHint.AUTO));

        for (BeaconTelemetryDialect dialect : BeaconTelemetryDialect.values()) {
            assertTrue(e.getMessage().contains(dialect.name()), dialect.name());
        }
    }

    @Test
    void emptyBodyIsMalformed() {
        assertThrows(MalformedPayloadException.class, () -> decoder.decode(new byte[0], null, null, TelemetryHint.AUTO));
    }

    @Test
    void badEnvelopesAreMalformed() {
        assertThrows(MalformedPayloadException.class,
                () -> decoder.decode(utf8(JSON), "brotli", null, TelemetryHint.AUTO));
        assertThrows(MalformedPayloadException.class,
                () -> decoder.decode(utf8("definitely not snappy"), "snappy", null, TelemetryHint.AUTO));
        assertThrows(MalformedPayloadException.class,
                () -> decoder.decode(utf8("@@@not base64@@@"), null, "base64", TelemetryHint.AUTO));
    }
}
