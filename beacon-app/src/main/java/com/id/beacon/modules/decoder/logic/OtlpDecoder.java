package com.id.beacon.modules.decoder.logic;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.io.BaseEncoding;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Message;
import com.google.protobuf.util.JsonFormat;
import com.id.beacon.model.BeaconLogRecord;
import com.id.beacon.model.BeaconMetricSample;
import com.id.beacon.model.BeaconSpan;
import com.id.beacon.model.BeaconSpanEvent;
import com.id.beacon.model.BeaconTelemetryBatch;
import com.id.beacon.model.BeaconTelemetryDialect;
import com.id.beacon.modules.decoder.model.DecodeResult;
import com.id.beacon.modules.decoder.model.TelemetrySignal;
import com.id.beacon.utils.BeaconTelemetryBatchBuilder;
import io.opentelemetry.proto.collector.logs.v1.ExportLogsServiceRequest;
import io.opentelemetry.proto.collector.metrics.v1.ExportMetricsServiceRequest;
import io.opentelemetry.proto.collector.trace.v1.ExportTraceServiceRequest;
import io.opentelemetry.proto.logs.v1.LogRecord;
import io.opentelemetry.proto.logs.v1.ResourceLogs;
import io.opentelemetry.proto.logs.v1.ScopeLogs;
import io.opentelemetry.proto.logs.v1.SeverityNumber;
import io.opentelemetry.proto.metrics.v1.Metric;
import io.opentelemetry.proto.metrics.v1.NumberDataPoint;
import io.opentelemetry.proto.metrics.v1.ResourceMetrics;
import io.opentelemetry.proto.metrics.v1.ScopeMetrics;
import io.opentelemetry.proto.trace.v1.ResourceSpans;
import io.opentelemetry.proto.trace.v1.ScopeSpans;
import io.opentelemetry.proto.trace.v1.Span;
import io.opentelemetry.proto.trace.v1.Status;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Decodes OTLP export requests (metrics, logs, traces) in either the binary protobuf or the OTLP/JSON
 * encoding.
 * <p>
 * A binary payload parses as any of the three requests, so when the signal is not pinned each request
 * type is tried in turn and only accepted if its records are well formed.
 */
@Component
@Slf4j
public class OtlpDecoder implements TelemetryDialectDecoder {

    private static final double NANOS_PER_SECOND = 1_000_000_000.0;
    private static final int TRACE_ID_BYTES = 16;
    private static final int SPAN_ID_BYTES = 8;

    private static final Set<String> ID_FIELDS = Set.of("traceId", "spanId", "parentSpanId");
    private static final Pattern HEX = Pattern.compile("^(?:[0-9a-fA-F]{2})+$");

    private final ObjectMapper objectMapper;
    private final JsonFormat.Parser jsonParser = JsonFormat.parser().ignoringUnknownFields();

    public OtlpDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public BeaconTelemetryDialect dialect() {
        return BeaconTelemetryDialect.OTLP;
    }

    @Override
    public DecodeResult decode(byte[] payload, TelemetrySignal signal) {
        try {
            if (looksLikeJson(payload)) {
                return decodeJson(payload, signal);
            }
            return decodeBinary(payload, signal);
        } catch (IOException | RuntimeException e) {
            return DecodeResult.failure(dialect(), e.getMessage());
        }
    }

    // --- binary ---

    private DecodeResult decodeBinary(byte[] payload, TelemetrySignal signal) {
        List<String> reasons = new ArrayList<>();
        if (signal.accepts(TelemetrySignal.METRICS)) {
            try {
                ExportMetricsServiceRequest request = ExportMetricsServiceRequest.parseFrom(payload);
                if (isWellFormed(request)) {
                    return DecodeResult.success(toBatch(request));
                }
                reasons.add("not a well formed metrics request");
            } catch (InvalidProtocolBufferException e) {
                reasons.add("metrics: " + e.getMessage());
            }
        }
        if (signal.accepts(TelemetrySignal.LOGS)) {
            try {
                ExportLogsServiceRequest request = ExportLogsServiceRequest.parseFrom(payload);
                if (isWellFormed(request)) {
                    return DecodeResult.success(toBatch(request));
                }
                reasons.add("not a well formed logs request");
            } catch (InvalidProtocolBufferException e) {
                reasons.add("logs: " + e.getMessage());
            }
        }
        if (signal.accepts(TelemetrySignal.TRACES)) {
            try {
                ExportTraceServiceRequest request = ExportTraceServiceRequest.parseFrom(payload);
                if (isWellFormed(request)) {
                    return DecodeResult.success(toBatch(request));
                }
                reasons.add("not a well formed traces request");
            } catch (InvalidProtocolBufferException e) {
                reasons.add("traces: " + e.getMessage());
            }
        }
        return DecodeResult.failure(dialect(), String.join(", ", reasons));
    }

    static boolean isWellFormed(ExportMetricsServiceRequest request) {
        if (hasUnknownFields(request)) {
            return false;
        }
        for (ResourceMetrics rm : request.getResourceMetricsList()) {
            if (hasUnknownFields(rm)) {
                return false;
            }
            for (ScopeMetrics sm : rm.getScopeMetricsList()) {
                for (Metric metric : sm.getMetricsList()) {
                    if (hasUnknownFields(metric)
                            || metric.getName().isEmpty()
                            || metric.getDataCase() == Metric.DataCase.DATA_NOT_SET) {
                        return false;
                    }
                }
            }
        }
        return true;
    }

    static boolean isWellFormed(ExportLogsServiceRequest request) {
        if (hasUnknownFields(request)) {
            return false;
        }
        for (ResourceLogs rl : request.getResourceLogsList()) {
            if (hasUnknownFields(rl)) {
                return false;
            }
            for (ScopeLogs sl : rl.getScopeLogsList()) {
                for (LogRecord record : sl.getLogRecordsList()) {
                    if (hasUnknownFields(record)) {
                        return false;
                    }
                }
            }
        }
        return true;
    }

    static boolean isWellFormed(ExportTraceServiceRequest request) {
        if (hasUnknownFields(request)) {
            return false;
        }
        for (ResourceSpans rs : request.getResourceSpansList()) {
            if (hasUnknownFields(rs)) {
                return false;
            }
            for (ScopeSpans ss : rs.getScopeSpansList()) {
                for (Span span : ss.getSpansList()) {
                    if (hasUnknownFields(span)
                            || span.getTraceId().size() != TRACE_ID_BYTES
                            || span.getSpanId().size() != SPAN_ID_BYTES) {
                        return false;
                    }
                }
            }
        }
        return true;
    }

    private static boolean hasUnknownFields(Message message) {
        return !message.getUnknownFields().asMap().isEmpty();
    }

    // --- json ---

    private DecodeResult decodeJson(byte[] payload, TelemetrySignal signal) throws IOException {
        JsonNode root = objectMapper.readTree(payload);
        if (root == null || !root.isObject()) {
            return DecodeResult.failure(dialect(), "OTLP/JSON body must be an object");
        }
        normalizeIds(root);
        String json = objectMapper.writeValueAsString(root);

        if (signal.accepts(TelemetrySignal.METRICS) && (root.has("resourceMetrics") || signal == TelemetrySignal.METRICS)) {
            ExportMetricsServiceRequest.Builder builder = ExportMetricsServiceRequest.newBuilder();
            jsonParser.merge(json, builder);
            return DecodeResult.success(toBatch(builder.build()));
        }
        if (signal.accepts(TelemetrySignal.LOGS) && (root.has("resourceLogs") || signal == TelemetrySignal.LOGS)) {
            ExportLogsServiceRequest.Builder builder = ExportLogsServiceRequest.newBuilder();
            jsonParser.merge(json, builder);
            return DecodeResult.success(toBatch(builder.build()));
        }
        if (signal.accepts(TelemetrySignal.TRACES) && (root.has("resourceSpans") || signal == TelemetrySignal.TRACES)) {
            ExportTraceServiceRequest.Builder builder = ExportTraceServiceRequest.newBuilder();
            jsonParser.merge(json, builder);
            return DecodeResult.success(toBatch(builder.build()));
        }
        return DecodeResult.failure(dialect(), "JSON body has no resourceMetrics, resourceLogs or resourceSpans");
    }

    /**
     * OTLP/JSON renders trace and span ids as hex while the protobuf JSON mapping expects base64 for
     * bytes fields.
     */
    private void normalizeIds(JsonNode node) {
        if (node.isObject()) {
            ObjectNode object = (ObjectNode) node;
            Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
            List<Map.Entry<String, String>> replacements = new ArrayList<>();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode value = field.getValue();
                if (ID_FIELDS.contains(field.getKey()) && value.isTextual()) {
                    String text = value.asText();
                    if (text.isEmpty() || HEX.matcher(text).matches()) {
                        byte[] bytes = BaseEncoding.base16().decode(text.toUpperCase());
                        replacements.add(Map.entry(field.getKey(), BaseEncoding.base64().encode(bytes)));
                    }
                } else {
                    normalizeIds(value);
                }
            }
            replacements.forEach(r -> object.put(r.getKey(), r.getValue()));
        } else if (node.isArray()) {
            ((ArrayNode) node).forEach(this::normalizeIds);
        }
    }

    private static boolean looksLikeJson(byte[] payload) {
        for (byte b : payload) {
            if (!Character.isWhitespace(b)) {
                return b == '{';
            }
        }
        return false;
    }

    // --- mapping ---

    private BeaconTelemetryBatch toBatch(ExportMetricsServiceRequest request) {
        BeaconTelemetryBatchBuilder builder = BeaconTelemetryBatch.builder(dialect());
        for (ResourceMetrics rm : request.getResourceMetricsList()) {
            Map<String, String> resourceAttributes = OtlpValues.toMap(rm.getResource().getAttributesList());
            for (ScopeMetrics sm : rm.getScopeMetricsList()) {
                for (Metric metric : sm.getMetricsList()) {
                    addMetric(builder, metric, resourceAttributes);
                }
            }
        }
        return builder.build();
    }

    private void addMetric(BeaconTelemetryBatchBuilder builder, Metric metric, Map<String, String> resourceAttributes) {
        String name = metric.getName();
        switch (metric.getDataCase()) {
            case GAUGE -> metric.getGauge().getDataPointsList()
                    .forEach(p -> addNumberPoint(builder, name, resourceAttributes, p));
            case SUM -> metric.getSum().getDataPointsList()
                    .forEach(p -> addNumberPoint(builder, name, resourceAttributes, p));
            case HISTOGRAM -> metric.getHistogram().getDataPointsList().forEach(p -> {
                Map<String, String> labels = labels(resourceAttributes, OtlpValues.toMap(p.getAttributesList()));
                builder.addSample(sample(name + "_count", labels, p.getTimeUnixNano(), p.getCount()));
                if (p.hasSum()) {
                    builder.addSample(sample(name + "_sum", labels, p.getTimeUnixNano(), p.getSum()));
                }
            });
            case EXPONENTIAL_HISTOGRAM -> metric.getExponentialHistogram().getDataPointsList().forEach(p -> {
                Map<String, String> labels = labels(resourceAttributes, OtlpValues.toMap(p.getAttributesList()));
                builder.addSample(sample(name + "_count", labels, p.getTimeUnixNano(), p.getCount()));
                if (p.hasSum()) {
                    builder.addSample(sample(name + "_sum", labels, p.getTimeUnixNano(), p.getSum()));
                }
            });
            case SUMMARY -> metric.getSummary().getDataPointsList().forEach(p -> {
                Map<String, String> labels = labels(resourceAttributes, OtlpValues.toMap(p.getAttributesList()));
                builder.addSample(sample(name + "_count", labels, p.getTimeUnixNano(), p.getCount()));
                builder.addSample(sample(name + "_sum", labels, p.getTimeUnixNano(), p.getSum()));
            });
            default -> {
                log.debug("Skipping metric '{}' without data", name);
                builder.reject();
            }
        }
    }

    private void addNumberPoint(BeaconTelemetryBatchBuilder builder, String name,
                                Map<String, String> resourceAttributes, NumberDataPoint point) {
        double value;
        switch (point.getValueCase()) {
            case AS_DOUBLE -> value = point.getAsDouble();
            case AS_INT -> value = point.getAsInt();
            default -> {
                builder.reject();
                return;
            }
        }
        Map<String, String> labels = labels(resourceAttributes, OtlpValues.toMap(point.getAttributesList()));
        builder.addSample(sample(name, labels, point.getTimeUnixNano(), value));
    }

    private static Map<String, String> labels(Map<String, String> resourceAttributes, Map<String, String> pointAttributes) {
        Map<String, String> labels = new LinkedHashMap<>(resourceAttributes);
        labels.putAll(pointAttributes);
        return labels;
    }

    private static BeaconMetricSample sample(String name, Map<String, String> labels, long timeUnixNano, double value) {
        Map<String, String> sampleLabels = new LinkedHashMap<>(labels);
        sampleLabels.put(BeaconMetricSample.NAME_LABEL, name);
        return BeaconMetricSample.builder()
                .labels(sampleLabels)
                .timestamp(timeUnixNano / NANOS_PER_SECOND)
                .value(value)
                .clusterId(ClusterIdResolver.resolve(sampleLabels))
                .build();
    }

    private BeaconTelemetryBatch toBatch(ExportLogsServiceRequest request) {
        BeaconTelemetryBatchBuilder builder = BeaconTelemetryBatch.builder(dialect());
        for (ResourceLogs rl : request.getResourceLogsList()) {
            Map<String, String> resourceAttributes = OtlpValues.toMap(rl.getResource().getAttributesList());
            for (ScopeLogs sl : rl.getScopeLogsList()) {
                for (LogRecord record : sl.getLogRecordsList()) {
                    Map<String, String> attributes = new LinkedHashMap<>(resourceAttributes);
                    OtlpValues.putAll(attributes, record.getAttributesList());
                    if (!record.getTraceId().isEmpty()) {
                        attributes.put("trace_id", OtlpValues.hex(record.getTraceId().toByteArray()));
                    }
                    if (!record.getSpanId().isEmpty()) {
                        attributes.put("span_id", OtlpValues.hex(record.getSpanId().toByteArray()));
                    }
                    builder.addLog(BeaconLogRecord.builder()
                            .timestamp(record.getTimeUnixNano() != 0 ? record.getTimeUnixNano() : record.getObservedTimeUnixNano())
                            .severity(severity(record))
                            .body(OtlpValues.asString(record.getBody()))
                            .attributes(attributes)
                            .tenantId(ClusterIdResolver.resolve(attributes))
                            .build());
                }
            }
        }
        return builder.build();
    }

    private static String severity(LogRecord record) {
        if (!record.getSeverityText().isEmpty()) {
            return record.getSeverityText();
        }
        SeverityNumber number = record.getSeverityNumber();
        if (number == SeverityNumber.SEVERITY_NUMBER_UNSPECIFIED || number == SeverityNumber.UNRECOGNIZED) {
            return "";
        }
        return number.name().substring("SEVERITY_NUMBER_".length());
    }

    private BeaconTelemetryBatch toBatch(ExportTraceServiceRequest request) {
        BeaconTelemetryBatchBuilder builder = BeaconTelemetryBatch.builder(dialect());
        for (ResourceSpans rs : request.getResourceSpansList()) {
            Map<String, String> resourceAttributes = OtlpValues.toMap(rs.getResource().getAttributesList());
            for (ScopeSpans ss : rs.getScopeSpansList()) {
                for (Span span : ss.getSpansList()) {
                    Map<String, String> attributes = new LinkedHashMap<>(resourceAttributes);
                    OtlpValues.putAll(attributes, span.getAttributesList());

                    List<BeaconSpanEvent> events = span.getEventsList().stream()
                            .map(e -> BeaconSpanEvent.builder()
                                    .name(e.getName())
                                    .timestamp(e.getTimeUnixNano())
                                    .attributes(OtlpValues.toMap(e.getAttributesList()))
                                    .build())
                            .collect(Collectors.toCollection(ArrayList::new));

                    builder.addSpan(BeaconSpan.builder()
                            .traceId(span.getTraceId().toByteArray())
                            .spanId(span.getSpanId().toByteArray())
                            .parentSpanId(span.getParentSpanId().toByteArray())
                            .name(span.getName())
                            .startTime(span.getStartTimeUnixNano())
                            .endTime(span.getEndTimeUnixNano())
                            .statusCode(statusCode(span.getStatus()))
                            .attributes(attributes)
                            .events(events)
                            .tenantId(ClusterIdResolver.resolve(attributes))
                            .build());
                }
            }
        }
        return builder.build();
    }

    private static String statusCode(Status status) {
        Status.StatusCode code = status.getCode();
        if (code == Status.StatusCode.UNRECOGNIZED) {
            return "UNSET";
        }
        return code.name().substring("STATUS_CODE_".length());
    }
}
