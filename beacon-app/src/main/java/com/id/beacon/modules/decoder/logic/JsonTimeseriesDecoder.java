package com.id.beacon.modules.decoder.logic;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.id.beacon.model.BeaconMetricSample;
import com.id.beacon.model.BeaconTelemetryBatch;
import com.id.beacon.model.BeaconTelemetryDialect;
import com.id.beacon.modules.decoder.model.DecodeResult;
import com.id.beacon.modules.decoder.model.TelemetrySignal;
import com.id.beacon.utils.BeaconTelemetryBatchBuilder;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decodes the JSON time-series dialect:
 * <pre>
 * {"timeseries":[{"labels":{"__name__":"cpu"}, "samples":[{"timestamp_ms":1700000000000,"value":1.5}]}]}
 * </pre>
 * Labels may also be given as a {@code [{"name":..,"value":..}]} array. The Prometheus instant-vector
 * shape {@code {"metric":{..},"value":[seconds,"value"]}}, alone or in an array, is accepted as well.
 */
@Component
public class JsonTimeseriesDecoder implements TelemetryDialectDecoder {

    private static final String TIMESERIES = "timeseries";

    private final ObjectMapper objectMapper;

    public JsonTimeseriesDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public BeaconTelemetryDialect dialect() {
        return BeaconTelemetryDialect.JSON_TIMESERIES;
    }

    @Override
    public DecodeResult decode(byte[] payload, TelemetrySignal signal) {
        if (!signal.accepts(TelemetrySignal.METRICS)) {
            return DecodeResult.failure(dialect(), "JSON time series only carries metrics");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            return DecodeResult.failure(dialect(), "invalid JSON: " + e.getOriginalMessage());
        } catch (IOException e) {
            return DecodeResult.failure(dialect(), "unreadable JSON: " + e.getMessage());
        }
        if (root == null || root.isMissingNode()) {
            return DecodeResult.failure(dialect(), "no JSON document");
        }

        BeaconTelemetryBatchBuilder builder = BeaconTelemetryBatch.builder(dialect());
        try {
            if (root.isObject() && root.has(TIMESERIES)) {
                JsonNode series = root.get(TIMESERIES);
                if (!series.isArray()) {
                    return DecodeResult.failure(dialect(), "'timeseries' must be an array");
                }
                for (JsonNode ts : series) {
                    decodeSeries(ts, builder);
                }
            } else if (isInstantVector(root)) {
                decodeInstant(root, builder);
            } else if (root.isArray() && root.size() > 0 && allInstantVectors(root)) {
                for (JsonNode node : root) {
                    decodeInstant(node, builder);
                }
            } else {
                return DecodeResult.failure(dialect(), "document has neither 'timeseries' nor instant vectors");
            }
        } catch (IllegalArgumentException e) {
            return DecodeResult.failure(dialect(), e.getMessage());
        }
        return DecodeResult.success(builder.build());
    }

    private void decodeSeries(JsonNode ts, BeaconTelemetryBatchBuilder builder) {
        if (!ts.isObject()) {
            throw new IllegalArgumentException("time series entries must be objects");
        }
        Map<String, String> labels = labels(ts.get("labels"));
        JsonNode samples = ts.path("samples");
        if (!samples.isArray()) {
            throw new IllegalArgumentException("'samples' must be an array");
        }
        for (JsonNode sample : samples) {
            JsonNode timestampMs = sample.get("timestamp_ms");
            JsonNode value = sample.get("value");
            if (timestampMs == null || !timestampMs.canConvertToLong() || value == null) {
                builder.reject();
                continue;
            }
            Double parsed = number(value);
            if (parsed == null) {
                builder.reject();
                continue;
            }
            builder.addSample(sample(labels, timestampMs.asLong() / 1000.0, parsed));
        }
    }

    private void decodeInstant(JsonNode node, BeaconTelemetryBatchBuilder builder) {
        Map<String, String> labels = labels(node.get("metric"));
        JsonNode pair = node.get("value");
        Double seconds = number(pair.get(0));
        Double value = number(pair.get(1));
        if (seconds == null || !Double.isFinite(seconds) || value == null) {
            builder.reject();
            return;
        }
        builder.addSample(sample(labels, seconds, value));
    }

    private static boolean isInstantVector(JsonNode node) {
        return node.isObject()
                && node.path("metric").isObject()
                && node.path("value").isArray()
                && node.path("value").size() == 2;
    }

    private static boolean allInstantVectors(JsonNode array) {
        for (JsonNode node : array) {
            if (!isInstantVector(node)) {
                return false;
            }
        }
        return true;
    }

    private static Map<String, String> labels(JsonNode node) {
        Map<String, String> labels = new LinkedHashMap<>();
        if (node == null || node.isNull()) {
            return labels;
        }
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                labels.put(field.getKey(), field.getValue().asText());
            }
        } else if (node.isArray()) {
            for (JsonNode label : node) {
                if (!label.has("name")) {
                    throw new IllegalArgumentException("label entries need a 'name'");
                }
                labels.put(label.get("name").asText(), label.path("value").asText());
            }
        } else {
            throw new IllegalArgumentException("'labels' must be an object or an array");
        }
        return labels;
    }

    private static Double number(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        if (node.isTextual()) {
            try {
                return Double.parseDouble(node.asText());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static BeaconMetricSample sample(Map<String, String> labels, double seconds, double value) {
        Map<String, String> copy = new LinkedHashMap<>(labels);
        return BeaconMetricSample.builder()
                .labels(copy)
                .timestamp(seconds)
                .value(value)
                .clusterId(ClusterIdResolver.resolve(copy))
                .build();
    }
}
