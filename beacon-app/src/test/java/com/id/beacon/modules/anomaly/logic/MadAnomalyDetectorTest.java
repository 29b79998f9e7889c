package com.id.beacon.modules.anomaly.logic;

import com.id.beacon.model.BeaconMetricSample;
import com.id.beacon.modules.anomaly.model.BeaconAnomaly;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class MadAnomalyDetectorTest {

    private final MadAnomalyDetector detector = new MadAnomalyDetector(3.5);

    private static List<BeaconMetricSample> series(String name, double... values) {
        List<BeaconMetricSample> samples = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            Map<String, String> labels = new LinkedHashMap<>();
            labels.put("__name__", name);
            labels.put("instance", "host-" + i);
            samples.add(BeaconMetricSample.builder()
                    .labels(labels)
                    .timestamp(1700000000 + i)
                    .value(values[i])
                    .clusterId("prod")
                    .build());
        }
        return samples;
    }

    @Test
    void flagsOnlyTheOutlier() {
        List<BeaconAnomaly> anomalies = detector.detect(series("cpu", 10, 11, 9, 10, 200));

        assertEquals(1, anomalies.size());
        BeaconAnomaly anomaly = anomalies.get(0);
        assertEquals(200.0, anomaly.getValue());
        assertEquals("cpu", anomaly.getMetricName());
        assertEquals("host-4", anomaly.getInstance());
        assertEquals("unknown", anomaly.getJob());
        assertEquals("prod", anomaly.getClusterId());
        assertEquals(1700000004.0, anomaly.getTimestamp());
        assertTrue(anomaly.getReason().contains("3.50"));
    }

    @Test
    void zeroMadYieldsNothing() {
        assertTrue(detector.detect(series("cpu", 1, 1, 1, 1, 50)).isEmpty());
        assertTrue(detector.detect(series("cpu", 7, 7, 7, 7)).isEmpty());
    }

    @Test
    void countersAreSkipped() {
        assertTrue(detector.detect(series("http_requests_total", 10, 11, 9, 10, 200)).isEmpty());
    }

    @Test
    void smallGroupsAreSkipped() {
        assertTrue(detector.detect(series("cpu", 1, 1000)).isEmpty());
        assertTrue(detector.detect(series("cpu", 5)).isEmpty());
        assertTrue(detector.detect(List.of()).isEmpty());
    }

    @Test
    void groupFailureDoesNotAffectOtherGroups() {
        List<BeaconMetricSample> samples = new ArrayList<>(series("broken", 1, Double.NaN, 3, 4));
        samples.addAll(series("cpu", 10, 11, 9, 10, 200));

        List<BeaconAnomaly> anomalies = detector.detect(samples);

        assertEquals(1, anomalies.size());
        assertEquals("cpu", anomalies.get(0).getMetricName());
    }

    @Test
    void groupsAreEvaluatedIndependently() {
        List<BeaconMetricSample> samples = new ArrayList<>(series("cpu", 10, 11, 9, 10, 200));
        samples.addAll(series("mem", 500, 510, 490, 505, 495));

        List<BeaconAnomaly> anomalies = detector.detect(samples);

        assertEquals(1, anomalies.size());
        assertEquals("cpu", anomalies.get(0).getMetricName());
    }

    @Test
    void neverFlagsMoreSamplesThanReceived() {
        Random random = new Random(7);
        for (int round = 0; round < 200; round++) {
            int n = random.nextInt(20);
            double[] values = new double[n];
            for (int i = 0; i < n; i++) {
                values[i] = random.nextBoolean() ? random.nextGaussian() * 10 : random.nextInt(3) * 1000;
            }
            List<BeaconMetricSample> samples = series("m" + random.nextInt(3), values);
            assertTrue(detector.detect(samples).size() <= samples.size());
        }
    }

    @Test
    void thresholdMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new MadAnomalyDetector(0));
    }

    @Test
    void medianOfEvenCountAveragesMiddleValues() {
        assertEquals(2.5, MadAnomalyDetector.median(new double[]{4, 1, 3, 2}));
        assertEquals(3.0, MadAnomalyDetector.median(new double[]{5, 3, 1}));
    }
}
