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
public class BeaconLogRecord {

    /**
     * Nanoseconds since epoch. Only meaningful for ordering inside one batch.
     */
    private long timestamp;

    @Builder.Default
    private String severity = "";

    @Builder.Default
    private String body = "";

    @Builder.Default
    private Map<String, String> attributes = new LinkedHashMap<>();

    private String tenantId;

}
