package com.id.beacon.modules.storage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Stored span. Ids are lowercase hex; an empty parent id marks a root span.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class SpanItemEntity extends StoredItemEntity {

    private String traceId;
    private String spanId;
    private String parentSpanId;
    private String name;
    private long startTime;
    private long endTime;
    private String statusCode;

    @Builder.Default
    private List<StoredLabelEntity> attributes = new ArrayList<>();

    @Builder.Default
    private List<Event> events = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Event {
        private String name;
        private long timestamp;
        private List<StoredLabelEntity> attributes;
    }
}
