package com.id.beacon.modules.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BeaconAnomaly {

    private String clusterId;
    private String metricName;
    private String instance;
    private String job;
    private double value;

    /**
     * Seconds since epoch, as decoded.
     */
    private double timestamp;

    private String reason;

}
