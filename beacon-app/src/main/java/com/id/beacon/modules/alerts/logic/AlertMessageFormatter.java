package com.id.beacon.modules.alerts.logic;

import com.id.beacon.modules.anomaly.model.BeaconAnomaly;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders the anomalies of one cluster as a single Markdown message, one section per metric.
 * Names and values go inside code spans so that underscores are not read as emphasis.
 */
@Component
public class AlertMessageFormatter {

    private static final DateTimeFormatter UTC_FORMAT = DateTimeFormatter
            .ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'", Locale.ROOT)
            .withZone(ZoneOffset.UTC);

    public String format(String clusterId, List<BeaconAnomaly> anomalies) {
        Map<String, List<BeaconAnomaly>> byMetric = new LinkedHashMap<>();
        anomalies.forEach(a -> byMetric.computeIfAbsent(a.getMetricName(), k -> new ArrayList<>()).add(a));

        StringBuilder sb = new StringBuilder();
        sb.append("🚨 *Anomaly Alert* for cluster `").append(code(clusterId)).append("`\n");
        sb.append(anomalies.size()).append(anomalies.size() == 1 ? " sample" : " samples")
                .append(" flagged across ").append(byMetric.size()).append(byMetric.size() == 1 ? " metric" : " metrics")
                .append(".\n");

        byMetric.forEach((metric, items) -> {
            sb.append("\n*Metric* `").append(code(metric)).append("`\n");
            for (BeaconAnomaly a : items) {
                sb.append("• instance `").append(code(a.getInstance()))
                        .append("`, job `").append(code(a.getJob()))
                        .append("`: value `").append(a.getValue())
                        .append("` at ").append(formatTimestamp(a.getTimestamp()))
                        .append('\n');
            }
        });

        sb.append("\nThese values sit far outside the typical spread of their metric in this batch "
                + "(robust z-score based on the median absolute deviation).");
        return sb.toString();
    }

    static String formatTimestamp(double epochSeconds) {
        long millis = Math.round(epochSeconds * 1000.0);
        return UTC_FORMAT.format(Instant.ofEpochMilli(millis));
    }

    // backticks cannot be escaped inside a Markdown code span
    private static String code(String value) {
        return value == null ? "" : value.replace('`', '\'');
    }
}
