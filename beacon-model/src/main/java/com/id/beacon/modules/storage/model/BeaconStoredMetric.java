package com.id.beacon.modules.storage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A persisted metric sample as read back from the store.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BeaconStoredMetric {

    private String partitionKey;
    private String sortKey;
    private String metricName;

    @Builder.Default
    private Map<String, String> labels = new LinkedHashMap<>();

    private double timestamp;
    private double value;
    private String instance;
    private String job;

    /**
     * Epoch seconds after which the store may reclaim the item.
     */
    private long ttl;

}
