package com.id.beacon.modules.storage.model;

import lombok.Data;
import lombok.experimental.SuperBuilder;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Field;

import java.util.Date;

/**
 * Key and expiry attributes shared by every stored record kind. The document id is
 * {@code partitionKey|sortKey}.
 */
@Data
@SuperBuilder
@NoArgsConstructor
public abstract class StoredItemEntity {

    public static final String ID = "_id";
    public static final String PARTITION_KEY = "partitionKey";
    public static final String SORT_KEY = "sortKey";
    public static final String TTL = "ttl";
    public static final String EXPIRE_AT = "expireAt";

    public static final String KEY_IDX = "partition_sort_idx";
    public static final String EXPIRE_IDX = "expire_at_ttl_idx";

    public static final String KEY_SEPARATOR = "|";

    @Id
    @Field("_id")
    private String id;

    private String partitionKey;
    private String sortKey;

    /**
     * Epoch seconds.
     */
    private long ttl;

    // mirrors ttl as a date so the TTL index can reclaim the item
    private Date expireAt;

    public static String compositeId(String partitionKey, String sortKey) {
        return partitionKey + KEY_SEPARATOR + sortKey;
    }
}
