package com.id.beacon.config;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

@Configuration
@Getter
public class AppConfig {

    @Value("${beacon.security.api-key:dev-test-key-123}")
    private String apiKey;

    @Value("${beacon.storage.metrics-collection:BeaconMetricSamples}")
    private String metricsCollection;

    @Value("${beacon.storage.logs-collection:BeaconLogRecords}")
    private String logsCollection;

    @Value("${beacon.storage.spans-collection:BeaconSpans}")
    private String spansCollection;

    @Value("${beacon.storage.chunk-size:25}")
    private int storageChunkSize;

    @Value("${beacon.storage.write-threads:8}")
    private int storageWriteThreads;

    @Value("${beacon.storage.queue-size:512}")
    private int storageQueueSize;

    @Value("${beacon.storage.retention-days:7}")
    private int retentionDays;

    @Value("${beacon.detector.threshold:3.5}")
    private double detectorThreshold;

    @Value("${beacon.alerts.telegram.base-url:https://api.telegram.org}")
    private String telegramBaseUrl;

    @Value("${beacon.alerts.telegram.bot-token:}")
    private String telegramBotToken;

    @Value("${beacon.alerts.telegram.timeout-ms:5000}")
    private long telegramTimeoutMs;

    @Value("${beacon.alerts.default-chat-id:}")
    private String defaultChatId;
}
