package com.id.beacon.modules.identity.logic;

import com.id.beacon.model.BeaconLogRecord;
import com.id.beacon.model.BeaconMetricSample;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class RecordIdentityBuilderTest {

    private final RecordIdentityBuilder builder = new RecordIdentityBuilder();

    private static BeaconMetricSample sample(Map<String, String> labels, double ts) {
        return BeaconMetricSample.builder()
                .labels(new LinkedHashMap<>(labels))
                .timestamp(ts)
                .value(1.0)
                .clusterId("c1")
                .build();
    }

    @Test
    void metricIdentifierHasNameInstantAndDigest() {
        var id = builder.metricIdentifier(sample(Map.of("__name__", "cpu_usage", "instance", "a"), 1700000000.5));

        String[] parts = id.split("#");
        assertEquals(3, parts.length);
        assertEquals("cpu_usage", parts[0]);
        assertEquals("1700000000.5", parts[1]);
        assertTrue(parts[2].matches("[0-9a-f]{64}"));
    }

    @Test
    void wholeSecondsRenderWithoutExponent() {
        var id = builder.metricIdentifier(sample(Map.of("__name__", "up"), 1700000000.0));

        assertEquals("1700000000", id.split("#")[1]);
    }

    @Test
    void labelOrderDoesNotChangeIdentifier() {
        Map<String, String> a = new LinkedHashMap<>();
        a.put("__name__", "mem");
        a.put("job", "node");
        a.put("instance", "h1");
        Map<String, String> b = new LinkedHashMap<>();
        b.put("instance", "h1");
        b.put("__name__", "mem");
        b.put("job", "node");

        assertEquals(builder.metricIdentifier(sample(a, 10.0)), builder.metricIdentifier(sample(b, 10.0)));
    }

    @Test
    void labelSeparatorPreventsPairCollisions() {
        // "a=b" + "c=d" must not collide with a single label whose value swallows the separator
        var split = Map.of("__name__", "m", "a", "b-c=d");
        var joined = Map.of("__name__", "m", "a", "b", "c", "d");

        assertNotEquals(builder.metricIdentifier(sample(split, 1.0)), builder.metricIdentifier(sample(joined, 1.0)));
    }

    @Test
    void equalsSignInKeyOrValueDoesNotCollide() {
        var keyHoldsEquals = Map.of("__name__", "m", "a=b", "c");
        var valueHoldsEquals = Map.of("__name__", "m", "a", "b=c");

        assertNotEquals(builder.metricIdentifier(sample(keyHoldsEquals, 1.0)),
                builder.metricIdentifier(sample(valueHoldsEquals, 1.0)));
    }

    @Test
    void unitSeparatorInsideLabelDoesNotCollide() {
        var embedded = Map.of("__name__", "m", "a", "b\u001Fc=d");
        var separate = Map.of("__name__", "m", "a", "b", "c", "d");

        assertNotEquals(RecordIdentityBuilder.labelsDigest(embedded), RecordIdentityBuilder.labelsDigest(separate));
    }

    @Test
    void randomizedLabelDifferencesAlwaysChangeIdentifier() {
        Random random = new Random(42);
        for (int i = 0; i < 500; i++) {
            Map<String, String> labels = new LinkedHashMap<>();
            labels.put("__name__", "metric_" + random.nextInt(5));
            int n = 1 + random.nextInt(5);
            for (int j = 0; j < n; j++) {
                labels.put("k" + j, Integer.toString(random.nextInt(1000)));
            }
            Map<String, String> changed = new LinkedHashMap<>(labels);
            String key = "k" + random.nextInt(n);
            changed.put(key, changed.get(key) + "x");

            double ts = random.nextInt(1_000_000) / 10.0;
            assertEquals(builder.metricIdentifier(sample(labels, ts)), builder.metricIdentifier(sample(labels, ts)));
            assertNotEquals(builder.metricIdentifier(sample(labels, ts)), builder.metricIdentifier(sample(changed, ts)));
        }
    }

    @Test
    void logIdentifiersAreUniqueForSameTimestamp() {
        var log = BeaconLogRecord.builder().timestamp(123L).tenantId("t").build();

        var first = builder.logIdentifier(log);
        var second = builder.logIdentifier(log);

        assertTrue(first.startsWith("123#"));
        assertNotEquals(first, second);
    }
}
