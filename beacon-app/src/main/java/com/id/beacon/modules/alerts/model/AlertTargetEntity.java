package com.id.beacon.modules.alerts.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document(collection = "BeaconAlertTarget")
public class AlertTargetEntity {

    public static final String CLUSTER_ID = "clusterId";
    public static final String CHAT_ID = "chatId";
    public static final String DESCRIPTION = "description";

    @Id
    @Field("_id")
    private String clusterId;

    private String chatId;
    private String description;

}
