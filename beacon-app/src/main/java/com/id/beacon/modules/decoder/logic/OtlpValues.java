package com.id.beacon.modules.decoder.logic;

import com.google.common.io.BaseEncoding;
import io.opentelemetry.proto.common.v1.AnyValue;
import io.opentelemetry.proto.common.v1.KeyValue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Flattens OTLP attribute values into the string maps used by the canonical records.
 */
final class OtlpValues {

    private OtlpValues() {
    }

    static Map<String, String> toMap(List<KeyValue> attributes) {
        Map<String, String> result = new LinkedHashMap<>();
        putAll(result, attributes);
        return result;
    }

    static void putAll(Map<String, String> target, List<KeyValue> attributes) {
        for (KeyValue kv : attributes) {
            target.put(kv.getKey(), asString(kv.getValue()));
        }
    }

    static String asString(AnyValue value) {
        return switch (value.getValueCase()) {
            case STRING_VALUE -> value.getStringValue();
            case BOOL_VALUE -> Boolean.toString(value.getBoolValue());
            case INT_VALUE -> Long.toString(value.getIntValue());
            case DOUBLE_VALUE -> Double.toString(value.getDoubleValue());
            case BYTES_VALUE -> BaseEncoding.base16().lowerCase().encode(value.getBytesValue().toByteArray());
            case ARRAY_VALUE -> value.getArrayValue().getValuesList().stream()
                    .map(OtlpValues::asString)
                    .collect(Collectors.joining(", ", "[", "]"));
            case KVLIST_VALUE -> value.getKvlistValue().getValuesList().stream()
                    .map(kv -> kv.getKey() + "=" + asString(kv.getValue()))
                    .collect(Collectors.joining(", ", "{", "}"));
            case VALUE_NOT_SET -> "";
        };
    }

    static String hex(byte[] bytes) {
        return BaseEncoding.base16().lowerCase().encode(bytes);
    }
}
