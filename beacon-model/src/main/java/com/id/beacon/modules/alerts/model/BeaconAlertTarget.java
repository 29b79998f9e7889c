package com.id.beacon.modules.alerts.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BeaconAlertTarget {

    private String clusterId;
    private String chatId;

    @Builder.Default
    private String description = "";

}
