package com.id.beacon.modules.identity.logic;

import com.google.common.base.Strings;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import com.id.beacon.model.BeaconLogRecord;
import com.id.beacon.model.BeaconMetricSample;
import com.id.beacon.model.BeaconSpan;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Builds the sort-key part of a stored item's composite key.
 * <p>
 * Metric samples are content addressed: {@code {name}#{seconds}#{sha256(sorted, length-prefixed labels)}}, so the same
 * sample delivered twice maps to the same item. Logs and spans get {@code {timestamp}#{uuid}} and are not
 * idempotent across re-delivery.
 */
@Component
public class RecordIdentityBuilder {

    public static final String SEPARATOR = "#";

    public String metricIdentifier(BeaconMetricSample sample) {
        return sample.getMetricName()
                + SEPARATOR + plainSeconds(sample.getTimestamp())
                + SEPARATOR + labelsDigest(sample.getLabels());
    }

    public String logIdentifier(BeaconLogRecord log) {
        return log.getTimestamp() + SEPARATOR + UUID.randomUUID();
    }

    public String spanIdentifier(BeaconSpan span) {
        return span.getStartTime() + SEPARATOR + UUID.randomUUID();
    }

    // Keys and values are length prefixed, so no character inside a label can fake a boundary
    static String labelsDigest(Map<String, String> labels) {
        Hasher hasher = Hashing.sha256().newHasher();
        new TreeMap<>(labels).forEach((key, value) -> {
            putField(hasher, key);
            putField(hasher, Strings.nullToEmpty(value));
        });
        return hasher.hash().toString();
    }

    private static void putField(Hasher hasher, String field) {
        byte[] bytes = field.getBytes(StandardCharsets.UTF_8);
        hasher.putInt(bytes.length).putBytes(bytes);
    }

    static String plainSeconds(double seconds) {
        return BigDecimal.valueOf(seconds).stripTrailingZeros().toPlainString();
    }
}
