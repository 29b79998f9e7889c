package com.id.beacon.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Write-only acknowledgement returned to producers. Carries counts, never the records themselves.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BeaconIngestAck {

    @Builder.Default
    private String status = "accepted";

    private BeaconTelemetryDialect dialect;

    private long received;
    private long stored;
    private long failed;
    private long rejected;
    private long anomalies;

}
