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
public class LogRecordItemEntity extends StoredItemEntity {

    private long timestamp;
    private String severity;
    private String body;

    @Builder.Default
    private List<StoredLabelEntity> attributes = new ArrayList<>();

}
