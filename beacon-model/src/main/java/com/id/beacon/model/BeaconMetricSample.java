package com.id.beacon.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BeaconMetricSample {

    public static final String NAME_LABEL = "__name__";
    public static final String INSTANCE_LABEL = "instance";
    public static final String JOB_LABEL = "job";

    @Builder.Default
    private Map<String, String> labels = new LinkedHashMap<>();

    /**
     * Seconds since epoch.
     */
    private double timestamp;

    private double value;

    private String clusterId;

    public String getMetricName() {
        return labels == null ? null : labels.get(NAME_LABEL);
    }

    public String labelOrDefault(String key, String defaultValue) {
        if (labels == null) {
            return defaultValue;
        }
        String value = labels.get(key);
        return value == null || value.isEmpty() ? defaultValue : value;
    }

}
