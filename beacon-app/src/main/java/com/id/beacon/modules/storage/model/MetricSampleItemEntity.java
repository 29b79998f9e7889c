package com.id.beacon.modules.storage.model;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;

@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class MetricSampleItemEntity extends StoredItemEntity {

    public static final String METRIC_NAME = "metricName";
    public static final String TIMESTAMP = "timestamp";

    private String metricName;

    @Builder.Default
    private List<StoredLabelEntity> labels = new ArrayList<>();

    private double timestamp;
    private double value;
    private String instance;
    private String job;

}
