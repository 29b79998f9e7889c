package com.id.beacon.modules.anomaly.logic;

import com.id.beacon.config.AppConfig;
import com.id.beacon.model.BeaconMetricSample;
import com.id.beacon.modules.anomaly.model.BeaconAnomaly;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Robust z-score outlier detector over one batch of samples.
 * <p>
 * Samples are grouped by metric name; for each group the median and the median absolute deviation (MAD)
 * are computed and a sample is flagged when {@code |0.6745 * (v - median) / mad| > threshold}.
 * Monotonic counters ({@code _total}), groups with fewer than {@value #MIN_GROUP_SIZE} samples and groups
 * with zero MAD are skipped. Stateless: nothing is remembered between batches.
 */
@Component
@Slf4j
public class MadAnomalyDetector {

    public static final double CONSISTENCY_CONSTANT = 0.6745;
    public static final int MIN_GROUP_SIZE = 3;
    public static final String COUNTER_SUFFIX = "_total";
    public static final String UNKNOWN = "unknown";

    private final double threshold;

    @Autowired
    public MadAnomalyDetector(AppConfig appConfig) {
        this(appConfig.getDetectorThreshold());
    }

    public MadAnomalyDetector(double threshold) {
        if (!(threshold > 0)) {
            throw new IllegalArgumentException("Threshold must be positive");
        }
        this.threshold = threshold;
    }

    public List<BeaconAnomaly> detect(List<BeaconMetricSample> samples) {
        Map<String, List<BeaconMetricSample>> groups = new LinkedHashMap<>();
        for (BeaconMetricSample sample : samples) {
            String name = sample.getMetricName();
            if (name != null && !name.isEmpty()) {
                groups.computeIfAbsent(name, n -> new ArrayList<>()).add(sample);
            }
        }

        List<BeaconAnomaly> anomalies = new ArrayList<>();
        groups.forEach((name, group) -> {
            if (name.endsWith(COUNTER_SUFFIX) || group.size() < MIN_GROUP_SIZE) {
                return;
            }
            try {
                anomalies.addAll(detectGroup(name, group));
            } catch (RuntimeException e) {
                log.error("Anomaly detection failed for metric '%s': %s".formatted(name, e.getMessage()));
            }
        });
        return anomalies;
    }

    private List<BeaconAnomaly> detectGroup(String name, List<BeaconMetricSample> group) {
        double[] values = group.stream().mapToDouble(BeaconMetricSample::getValue).toArray();
        for (double v : values) {
            if (!Double.isFinite(v)) {
                throw new IllegalArgumentException("non-finite value " + v);
            }
        }

        double median = median(values);
        double mad = median(Arrays.stream(values).map(v -> Math.abs(v - median)).toArray());
        if (mad == 0) {
            log.trace("Skipping metric '%s': zero MAD".formatted(name));
            return List.of();
        }

        List<BeaconAnomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            double score = CONSISTENCY_CONSTANT * (values[i] - median) / mad;
            if (Math.abs(score) > threshold) {
                BeaconMetricSample sample = group.get(i);
                anomalies.add(BeaconAnomaly.builder()
                        .clusterId(sample.getClusterId())
                        .metricName(name)
                        .instance(sample.labelOrDefault(BeaconMetricSample.INSTANCE_LABEL, UNKNOWN))
                        .job(sample.labelOrDefault(BeaconMetricSample.JOB_LABEL, UNKNOWN))
                        .value(values[i])
                        .timestamp(sample.getTimestamp())
                        .reason(String.format(Locale.ROOT, "modified z-score %.2f exceeds threshold %.2f (median %s, MAD %s)",
                                score, threshold, median, mad))
                        .build());
            }
        }
        return anomalies;
    }

    static double median(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
    }
}
