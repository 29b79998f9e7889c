package com.id.beacon.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single span. Identifiers are kept as the raw bytes received on the wire; they are only rendered
 * as hex when the span is persisted.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BeaconSpan {

    private byte[] traceId;
    private byte[] spanId;

    /**
     * Empty for root spans.
     */
    @Builder.Default
    private byte[] parentSpanId = new byte[0];

    private String name;

    private long startTime;
    private long endTime;

    @Builder.Default
    private String statusCode = "UNSET";

    @Builder.Default
    private Map<String, String> attributes = new LinkedHashMap<>();

    @Builder.Default
    private List<BeaconSpanEvent> events = new ArrayList<>();

    private String tenantId;

    public long duration() {
        return endTime - startTime;
    }

    public boolean isRoot() {
        return parentSpanId == null || parentSpanId.length == 0;
    }

}
