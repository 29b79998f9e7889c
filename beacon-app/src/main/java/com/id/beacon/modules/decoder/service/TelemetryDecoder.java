package com.id.beacon.modules.decoder.service;

import com.id.beacon.model.BeaconTelemetryBatch;
import com.id.beacon.model.BeaconTelemetryDialect;
import com.id.beacon.modules.decoder.logic.FreeTextLogDecoder;
import com.id.beacon.modules.decoder.logic.JsonTimeseriesDecoder;
import com.id.beacon.modules.decoder.logic.OtlpDecoder;
import com.id.beacon.modules.decoder.logic.PrometheusRemoteWriteDecoder;
import com.id.beacon.modules.decoder.logic.TelemetryDialectDecoder;
import com.id.beacon.modules.decoder.model.DecodeResult;
import com.id.beacon.modules.decoder.model.TelemetryHint;
import com.id.beacon.modules.ingest.exceptions.AmbiguousPayloadException;
import com.id.beacon.modules.ingest.exceptions.MalformedPayloadException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns a raw request body into a {@link BeaconTelemetryBatch}.
 * <p>
 * A pinned hint runs exactly one dialect and a failure is terminal. {@link TelemetryHint#AUTO} walks the
 * chain in priority order (remote write, OTLP, JSON time series, free text) and takes the first dialect
 * that decodes.
 */
@Service
@Slf4j
public class TelemetryDecoder {

    private final PayloadDecompressor decompressor;
    private final List<TelemetryDialectDecoder> chain;

    public TelemetryDecoder(PayloadDecompressor decompressor,
                            PrometheusRemoteWriteDecoder remoteWriteDecoder,
                            OtlpDecoder otlpDecoder,
                            JsonTimeseriesDecoder jsonDecoder,
                            FreeTextLogDecoder freeTextDecoder) {
        this.decompressor = decompressor;
        this.chain = List.of(remoteWriteDecoder, otlpDecoder, jsonDecoder, freeTextDecoder);
    }

    public BeaconTelemetryBatch decode(byte[] body, String contentEncoding, String bodyEncoding, TelemetryHint hint) {
        if (body == null || body.length == 0) {
            throw new MalformedPayloadException("Empty request body");
        }
        byte[] payload = decompressor.decompress(decompressor.unwrapBase64(body, bodyEncoding), contentEncoding);
        if (payload.length == 0) {
            throw new MalformedPayloadException("Empty payload after decoding the transport envelope");
        }

        if (hint.isPinned()) {
            TelemetryDialectDecoder decoder = decoderFor(hint.getDialect());
            DecodeResult result = decoder.decode(payload, hint.getSignal());
            if (result instanceof DecodeResult.Success success) {
                return success.batch();
            }
            DecodeResult.Failure failure = (DecodeResult.Failure) result;
            throw new MalformedPayloadException("Malformed %s payload: %s".formatted(hint, failure.reason()));
        }

        List<DecodeResult.Failure> failures = new ArrayList<>();
        for (TelemetryDialectDecoder decoder : chain) {
            DecodeResult result = decoder.decode(payload, hint.getSignal());
            if (result instanceof DecodeResult.Success success) {
                log.debug("Payload of %d bytes detected as %s".formatted(payload.length, decoder.dialect()));
                return success.batch();
            }
            DecodeResult.Failure failure = (DecodeResult.Failure) result;
            log.trace("Dialect rejected payload: %s".formatted(failure.describe()));
            failures.add(failure);
        }
        throw new AmbiguousPayloadException("Payload matches no known dialect (%s)".formatted(
                failures.stream().map(DecodeResult.Failure::describe).collect(Collectors.joining("; "))));
    }

    private TelemetryDialectDecoder decoderFor(BeaconTelemetryDialect dialect) {
        return chain.stream()
                .filter(d -> d.dialect() == dialect)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No decoder registered for " + dialect));
    }
}
