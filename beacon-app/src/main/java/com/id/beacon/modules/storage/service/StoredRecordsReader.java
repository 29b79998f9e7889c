package com.id.beacon.modules.storage.service;

import com.id.beacon.config.AppConfig;
import com.id.beacon.modules.storage.model.BeaconStoredMetric;
import com.id.beacon.modules.storage.model.MetricSampleItemEntity;
import com.id.beacon.modules.storage.model.StoredItemEntity;
import com.id.beacon.modules.storage.model.StoredLabelEntity;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;
import static org.springframework.data.mongodb.core.query.Query.query;

/**
 * Keyed reads over stored metric samples.
 */
@Service
public class StoredRecordsReader {

    public static final int MAX_LIMIT = 1000;

    private final AppConfig appConfig;
    private final MongoTemplate mongoTemplate;

    public StoredRecordsReader(AppConfig appConfig, MongoTemplate mongoTemplate) {
        this.appConfig = appConfig;
        this.mongoTemplate = mongoTemplate;
    }

    public Optional<BeaconStoredMetric> findMetric(String clusterId, String sortKey) {
        return Optional.ofNullable(mongoTemplate.findById(
                        StoredItemEntity.compositeId(clusterId, sortKey),
                        MetricSampleItemEntity.class,
                        appConfig.getMetricsCollection()))
                .map(StoredRecordsReader::toModel);
    }

    /**
     * Lists the most recent samples of a cluster, newest first.
     *
     * @param clusterId partition to scan
     * @param limit     max number of items, capped at {@link #MAX_LIMIT}
     * @return the samples
     */
    public List<BeaconStoredMetric> latestMetrics(String clusterId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive");
        }
        var q = query(where(StoredItemEntity.PARTITION_KEY).is(clusterId))
                .with(Sort.by(Sort.Direction.DESC, MetricSampleItemEntity.TIMESTAMP))
                .limit(Math.min(limit, MAX_LIMIT));
        return mongoTemplate.find(q, MetricSampleItemEntity.class, appConfig.getMetricsCollection()).stream()
                .map(StoredRecordsReader::toModel)
                .toList();
    }

    private static BeaconStoredMetric toModel(MetricSampleItemEntity entity) {
        return BeaconStoredMetric.builder()
                .partitionKey(entity.getPartitionKey())
                .sortKey(entity.getSortKey())
                .metricName(entity.getMetricName())
                .labels(StoredLabelEntity.toMap(entity.getLabels()))
                .timestamp(entity.getTimestamp())
                .value(entity.getValue())
                .instance(entity.getInstance())
                .job(entity.getJob())
                .ttl(entity.getTtl())
                .build();
    }
}
