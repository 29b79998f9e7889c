package com.id.beacon.modules.storage.service;

import com.google.common.collect.Lists;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.id.beacon.config.AppConfig;
import com.id.beacon.model.BeaconLogRecord;
import com.id.beacon.model.BeaconMetricSample;
import com.id.beacon.model.BeaconSpan;
import com.id.beacon.model.BeaconTelemetryBatch;
import com.id.beacon.modules.identity.logic.RecordIdentityBuilder;
import com.id.beacon.modules.storage.model.BeaconStorageWriteResult;
import com.id.beacon.modules.storage.model.LogRecordItemEntity;
import com.id.beacon.modules.storage.model.MetricSampleItemEntity;
import com.id.beacon.modules.storage.model.SpanItemEntity;
import com.id.beacon.modules.storage.model.StoredItemEntity;
import com.id.beacon.modules.storage.model.StoredLabelEntity;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.HexFormat;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.springframework.data.mongodb.core.query.Criteria.where;
import static org.springframework.data.mongodb.core.query.Query.query;

/**
 * Persists canonical records as immutable, expiring items.
 * <p>
 * Items are grouped in chunks and each chunk is one unordered bulk upsert that only sets fields on
 * insert, so a re-delivered item never changes the stored one. Chunks run concurrently on a bounded
 * pool; a chunk that fails is reported as failed for every item in it.
 */
@Service
@Slf4j
public class TelemetryStorageWriter {

    private final AppConfig appConfig;
    private final MongoTemplate mongoTemplate;
    private final RecordIdentityBuilder identityBuilder;
    private final Clock clock;

    // This task queue logs a warning when the number of enqueued tasks exceeds the given warningThreshold
    static class WarningLinkedBlockingQueue<E> extends LinkedBlockingQueue<E> {

        private final int warningThreshold;
        private final long warningIntervalMillis;
        private final AtomicLong lastWarningTime = new AtomicLong(0);

        WarningLinkedBlockingQueue(int capacity, int warningThreshold, long warningIntervalMillis) {
            super(capacity);
            this.warningThreshold = warningThreshold;
            this.warningIntervalMillis = warningIntervalMillis;
        }

        @Override
        public boolean offer(E e) {
            int currentSize = size();
            long now = System.currentTimeMillis();
            long last = lastWarningTime.get();
            if (currentSize >= warningThreshold && now - last >= warningIntervalMillis
                    && lastWarningTime.compareAndSet(last, now)) {
                log.warn("Storage queue size is %d (>= %d)".formatted(currentSize, warningThreshold));
            }
            return super.offer(e);
        }
    }

    private final ExecutorService executor;

    public TelemetryStorageWriter(AppConfig appConfig, MongoTemplate mongoTemplate,
                                  RecordIdentityBuilder identityBuilder, Clock clock) {
        this.appConfig = appConfig;
        this.mongoTemplate = mongoTemplate;
        this.identityBuilder = identityBuilder;
        this.clock = clock;

        executor = new ThreadPoolExecutor(
                appConfig.getStorageWriteThreads(),
                appConfig.getStorageWriteThreads(),
                0L, TimeUnit.MILLISECONDS,
                new WarningLinkedBlockingQueue<>(appConfig.getStorageQueueSize(), appConfig.getStorageQueueSize() / 2, 60000),
                new ThreadFactoryBuilder().setNameFormat("beacon-storage-%d").setDaemon(true).build(),
                new ThreadPoolExecutor.AbortPolicy()
        );
    }

    @PostConstruct
    public void ensureIndexes() {
        for (String collection : List.of(
                appConfig.getMetricsCollection(),
                appConfig.getLogsCollection(),
                appConfig.getSpansCollection())) {
            var indexOps = mongoTemplate.indexOps(collection);
            indexOps.ensureIndex(new Index()
                    .on(StoredItemEntity.PARTITION_KEY, Sort.Direction.ASC)
                    .on(StoredItemEntity.SORT_KEY, Sort.Direction.ASC)
                    .unique()
                    .named(StoredItemEntity.KEY_IDX));
            indexOps.ensureIndex(new Index()
                    .on(StoredItemEntity.EXPIRE_AT, Sort.Direction.ASC)
                    .expire(0, TimeUnit.SECONDS)
                    .named(StoredItemEntity.EXPIRE_IDX));
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
    }

    public BeaconStorageWriteResult write(BeaconTelemetryBatch batch) {
        Instant start = Instant.now(clock);
        Instant expireAt = start.plus(Duration.ofDays(appConfig.getRetentionDays()));

        List<CompletableFuture<BeaconStorageWriteResult>> futures = new ArrayList<>();
        futures.addAll(submit(appConfig.getMetricsCollection(),
                batch.getSamples().stream().map(s -> toItem(s, expireAt)).toList()));
        futures.addAll(submit(appConfig.getLogsCollection(),
                batch.getLogs().stream().map(l -> toItem(l, expireAt)).toList()));
        futures.addAll(submit(appConfig.getSpansCollection(),
                batch.getSpans().stream().map(s -> toItem(s, expireAt)).toList()));

        BeaconStorageWriteResult result = futures.stream()
                .map(CompletableFuture::join)
                .reduce(BeaconStorageWriteResult.builder().build(), BeaconStorageWriteResult::merge);
        result.setDuration(Duration.between(start, Instant.now(clock)));

        log.debug("Stored %d/%d items in %d chunks (%d ms)".formatted(
                result.getWritten(), result.getAttempted(), result.getChunks(), result.getDuration().toMillis()));
        return result;
    }

    private List<CompletableFuture<BeaconStorageWriteResult>> submit(String collection, List<? extends StoredItemEntity> items) {
        return Lists.partition(items, Math.max(1, appConfig.getStorageChunkSize())).stream()
                .map(chunk -> submitChunk(collection, chunk))
                .toList();
    }

    private CompletableFuture<BeaconStorageWriteResult> submitChunk(String collection, List<? extends StoredItemEntity> chunk) {
        try {
            return CompletableFuture.supplyAsync(() -> writeChunk(collection, chunk), executor);
        } catch (RejectedExecutionException e) {
            // queue full or pool shut down
            log.warn("Storage pool refused a chunk of %d items for '%s'".formatted(chunk.size(), collection));
            return CompletableFuture.completedFuture(failedChunk(chunk));
        }
    }

    BeaconStorageWriteResult writeChunk(String collection, List<? extends StoredItemEntity> chunk) {
        try {
            BulkOperations ops = mongoTemplate.bulkOps(BulkOperations.BulkMode.UNORDERED, collection);
            for (StoredItemEntity item : chunk) {
                ops.upsert(query(where(StoredItemEntity.ID).is(item.getId())), insertOnly(item));
            }
            ops.execute();
            return BeaconStorageWriteResult.builder()
                    .chunks(1)
                    .attempted(chunk.size())
                    .written(chunk.size())
                    .build();
        } catch (RuntimeException e) {
            log.warn("Failed to write chunk of %d items to '%s': %s".formatted(chunk.size(), collection, e.getMessage()));
            return failedChunk(chunk);
        }
    }

    private static BeaconStorageWriteResult failedChunk(List<? extends StoredItemEntity> chunk) {
        return BeaconStorageWriteResult.builder()
                .chunks(1)
                .attempted(chunk.size())
                .failedIds(chunk.stream().map(StoredItemEntity::getId).toList())
                .build();
    }

    private Update insertOnly(StoredItemEntity item) {
        Document document = new Document();
        mongoTemplate.getConverter().write(item, document);
        Update update = new Update();
        document.forEach((key, value) -> {
            if (!StoredItemEntity.ID.equals(key)) {
                update.setOnInsert(key, value);
            }
        });
        return update;
    }

    // --- mapping ---

    MetricSampleItemEntity toItem(BeaconMetricSample sample, Instant expireAt) {
        String sortKey = identityBuilder.metricIdentifier(sample);
        return MetricSampleItemEntity.builder()
                .id(StoredItemEntity.compositeId(sample.getClusterId(), sortKey))
                .partitionKey(sample.getClusterId())
                .sortKey(sortKey)
                .ttl(expireAt.getEpochSecond())
                .expireAt(Date.from(expireAt))
                .metricName(sample.getMetricName())
                .labels(StoredLabelEntity.fromMap(sample.getLabels()))
                .timestamp(sample.getTimestamp())
                .value(sample.getValue())
                .instance(sample.labelOrDefault(BeaconMetricSample.INSTANCE_LABEL, "unknown"))
                .job(sample.labelOrDefault(BeaconMetricSample.JOB_LABEL, "unknown"))
                .build();
    }

    LogRecordItemEntity toItem(BeaconLogRecord record, Instant expireAt) {
        String sortKey = identityBuilder.logIdentifier(record);
        return LogRecordItemEntity.builder()
                .id(StoredItemEntity.compositeId(record.getTenantId(), sortKey))
                .partitionKey(record.getTenantId())
                .sortKey(sortKey)
                .ttl(expireAt.getEpochSecond())
                .expireAt(Date.from(expireAt))
                .timestamp(record.getTimestamp())
                .severity(record.getSeverity())
                .body(record.getBody())
                .attributes(StoredLabelEntity.fromMap(record.getAttributes()))
                .build();
    }

    SpanItemEntity toItem(BeaconSpan span, Instant expireAt) {
        String sortKey = identityBuilder.spanIdentifier(span);
        HexFormat hex = HexFormat.of();
        return SpanItemEntity.builder()
                .id(StoredItemEntity.compositeId(span.getTenantId(), sortKey))
                .partitionKey(span.getTenantId())
                .sortKey(sortKey)
                .ttl(expireAt.getEpochSecond())
                .expireAt(Date.from(expireAt))
                .traceId(hex.formatHex(span.getTraceId()))
                .spanId(hex.formatHex(span.getSpanId()))
                .parentSpanId(span.getParentSpanId() == null ? "" : hex.formatHex(span.getParentSpanId()))
                .name(span.getName())
                .startTime(span.getStartTime())
                .endTime(span.getEndTime())
                .statusCode(span.getStatusCode())
                .attributes(StoredLabelEntity.fromMap(span.getAttributes()))
                .events(span.getEvents().stream()
                        .map(e -> new SpanItemEntity.Event(e.getName(), e.getTimestamp(), StoredLabelEntity.fromMap(e.getAttributes())))
                        .toList())
                .build();
    }
}
