package com.id.beacon.modules.decoder.logic;

import com.google.protobuf.CodedInputStream;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.WireFormat;
import com.id.beacon.model.BeaconMetricSample;
import com.id.beacon.model.BeaconTelemetryBatch;
import com.id.beacon.model.BeaconTelemetryDialect;
import com.id.beacon.modules.decoder.model.DecodeResult;
import com.id.beacon.modules.decoder.model.TelemetrySignal;
import com.id.beacon.utils.BeaconTelemetryBatchBuilder;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes a Prometheus remote-write {@code WriteRequest}.
 * <p>
 * The message is walked field by field instead of through generated classes so that any field carrying
 * an unexpected wire type, or an unknown top-level field, rejects the payload. Protobuf parsers are
 * otherwise happy to read almost any byte string as an empty message, which would break dialect
 * auto-detection.
 */
@Component
public class PrometheusRemoteWriteDecoder implements TelemetryDialectDecoder {

    // WriteRequest
    private static final int WRITE_REQUEST_TIMESERIES = 1;
    private static final int WRITE_REQUEST_METADATA = 3;

    // TimeSeries
    private static final int TIMESERIES_LABELS = 1;
    private static final int TIMESERIES_SAMPLES = 2;
    private static final int TIMESERIES_EXEMPLARS = 3;
    private static final int TIMESERIES_HISTOGRAMS = 4;

    // Label
    private static final int LABEL_NAME = 1;
    private static final int LABEL_VALUE = 2;

    // Sample
    private static final int SAMPLE_VALUE = 1;
    private static final int SAMPLE_TIMESTAMP = 2;

    private record RawSample(double value, long timestampMs) {
    }

    @Override
    public BeaconTelemetryDialect dialect() {
        return BeaconTelemetryDialect.PROMETHEUS_REMOTE_WRITE;
    }

    @Override
    public DecodeResult decode(byte[] payload, TelemetrySignal signal) {
        if (!signal.accepts(TelemetrySignal.METRICS)) {
            return DecodeResult.failure(dialect(), "remote write only carries metrics");
        }
        try {
            BeaconTelemetryBatchBuilder builder = BeaconTelemetryBatch.builder(dialect());
            CodedInputStream in = CodedInputStream.newInstance(payload);
            while (!in.isAtEnd()) {
                int tag = in.readTag();
                int field = WireFormat.getTagFieldNumber(tag);
                if (field == WRITE_REQUEST_TIMESERIES) {
                    expectLengthDelimited(tag, "WriteRequest.timeseries");
                    readNested(in, () -> readTimeSeries(in, builder));
                } else if (field == WRITE_REQUEST_METADATA) {
                    expectLengthDelimited(tag, "WriteRequest.metadata");
                    in.skipField(tag);
                } else {
                    throw new InvalidProtocolBufferException("unexpected WriteRequest field " + field);
                }
            }
            return DecodeResult.success(builder.build());
        } catch (IOException | RuntimeException e) {
            return DecodeResult.failure(dialect(), e.getMessage());
        }
    }

    private void readTimeSeries(CodedInputStream in, BeaconTelemetryBatchBuilder builder) throws IOException {
        Map<String, String> labels = new LinkedHashMap<>();
        List<RawSample> samples = new ArrayList<>();

        while (!in.isAtEnd()) {
            int tag = in.readTag();
            switch (WireFormat.getTagFieldNumber(tag)) {
                case TIMESERIES_LABELS -> {
                    expectLengthDelimited(tag, "TimeSeries.labels");
                    readNested(in, () -> readLabel(in, labels));
                }
                case TIMESERIES_SAMPLES -> {
                    expectLengthDelimited(tag, "TimeSeries.samples");
                    readNested(in, () -> samples.add(readSample(in)));
                }
                case TIMESERIES_EXEMPLARS, TIMESERIES_HISTOGRAMS -> {
                    expectLengthDelimited(tag, "TimeSeries.exemplars/histograms");
                    in.skipField(tag);
                }
                default -> throw new InvalidProtocolBufferException(
                        "unexpected TimeSeries field " + WireFormat.getTagFieldNumber(tag));
            }
        }

        String clusterId = ClusterIdResolver.resolve(labels);
        for (RawSample sample : samples) {
            builder.addSample(BeaconMetricSample.builder()
                    .labels(new LinkedHashMap<>(labels))
                    .timestamp(sample.timestampMs() / 1000.0)
                    .value(sample.value())
                    .clusterId(clusterId)
                    .build());
        }
    }

    private void readLabel(CodedInputStream in, Map<String, String> labels) throws IOException {
        String name = "";
        String value = "";
        while (!in.isAtEnd()) {
            int tag = in.readTag();
            switch (WireFormat.getTagFieldNumber(tag)) {
                case LABEL_NAME -> {
                    expectLengthDelimited(tag, "Label.name");
                    name = in.readStringRequireUtf8();
                }
                case LABEL_VALUE -> {
                    expectLengthDelimited(tag, "Label.value");
                    value = in.readStringRequireUtf8();
                }
                default -> throw new InvalidProtocolBufferException(
                        "unexpected Label field " + WireFormat.getTagFieldNumber(tag));
            }
        }
        if (name.isEmpty()) {
            throw new InvalidProtocolBufferException("label without a name");
        }
        labels.put(name, value);
    }

    private RawSample readSample(CodedInputStream in) throws IOException {
        double value = 0;
        long timestampMs = 0;
        while (!in.isAtEnd()) {
            int tag = in.readTag();
            switch (WireFormat.getTagFieldNumber(tag)) {
                case SAMPLE_VALUE -> {
                    expectWireType(tag, WireFormat.WIRETYPE_FIXED64, "Sample.value");
                    value = in.readDouble();
                }
                case SAMPLE_TIMESTAMP -> {
                    expectWireType(tag, WireFormat.WIRETYPE_VARINT, "Sample.timestamp");
                    timestampMs = in.readInt64();
                }
                default -> throw new InvalidProtocolBufferException(
                        "unexpected Sample field " + WireFormat.getTagFieldNumber(tag));
            }
        }
        return new RawSample(value, timestampMs);
    }

    @FunctionalInterface
    private interface NestedReader {
        void read() throws IOException;
    }

    private static void readNested(CodedInputStream in, NestedReader reader) throws IOException {
        int length = in.readRawVarint32();
        int previousLimit = in.pushLimit(length);
        reader.read();
        in.popLimit(previousLimit);
    }

    private static void expectLengthDelimited(int tag, String field) throws InvalidProtocolBufferException {
        expectWireType(tag, WireFormat.WIRETYPE_LENGTH_DELIMITED, field);
    }

    private static void expectWireType(int tag, int wireType, String field) throws InvalidProtocolBufferException {
        if (WireFormat.getTagWireType(tag) != wireType) {
            throw new InvalidProtocolBufferException(
                    "%s has wire type %d, expected %d".formatted(field, WireFormat.getTagWireType(tag), wireType));
        }
    }
}
