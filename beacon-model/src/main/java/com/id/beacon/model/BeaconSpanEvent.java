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
public class BeaconSpanEvent {

    private String name;

    private long timestamp;

    @Builder.Default
    private Map<String, String> attributes = new LinkedHashMap<>();

}
