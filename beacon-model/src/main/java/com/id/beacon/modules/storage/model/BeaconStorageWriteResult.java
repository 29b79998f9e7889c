package com.id.beacon.modules.storage.model;

import lombok.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BeaconStorageWriteResult {

    @Builder.Default
    private long chunks = 0;
    @Builder.Default
    private long attempted = 0;
    @Builder.Default
    private long written = 0;
    @Builder.Default
    private List<String> failedIds = new ArrayList<>();
    @Builder.Default
    private Duration duration = Duration.ZERO;

    public long getFailed() {
        return failedIds.size();
    }

    public boolean isTotalFailure() {
        return attempted > 0 && written == 0;
    }

    public BeaconStorageWriteResult merge(BeaconStorageWriteResult other) {
        List<String> ids = new ArrayList<>(failedIds);
        ids.addAll(other.getFailedIds());
        return BeaconStorageWriteResult.builder()
                .chunks(chunks + other.getChunks())
                .attempted(attempted + other.getAttempted())
                .written(written + other.getWritten())
                .failedIds(ids)
                .duration(duration.plus(other.getDuration()))
                .build();
    }

}
