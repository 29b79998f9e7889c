package com.id.beacon.modules.alerts.service;

import com.id.beacon.config.AppConfig;
import com.id.beacon.modules.alerts.logic.AlertMessageFormatter;
import com.id.beacon.modules.alerts.model.BeaconAlertTarget;
import com.id.beacon.modules.anomaly.model.BeaconAnomaly;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Routes anomalies to their cluster's chat, one message per cluster. Without a target or a bot token
 * the anomalies are only logged. Runs off the request thread and never propagates errors.
 */
@Service
@Slf4j
public class AlertDispatcher {

    private final AlertTargetsService alertTargetsService;
    private final TelegramAlertSender sender;
    private final AlertMessageFormatter formatter;
    private final AppConfig appConfig;

    public AlertDispatcher(AlertTargetsService alertTargetsService,
                           TelegramAlertSender sender,
                           AlertMessageFormatter formatter,
                           AppConfig appConfig) {
        this.alertTargetsService = alertTargetsService;
        this.sender = sender;
        this.formatter = formatter;
        this.appConfig = appConfig;
    }

    @Async
    public void dispatch(List<BeaconAnomaly> anomalies) {
        if (anomalies == null || anomalies.isEmpty()) {
            return;
        }
        Map<String, List<BeaconAnomaly>> byCluster = new LinkedHashMap<>();
        anomalies.forEach(a -> byCluster.computeIfAbsent(a.getClusterId(), k -> new ArrayList<>()).add(a));

        byCluster.forEach((clusterId, clusterAnomalies) -> {
            try {
                dispatchCluster(clusterId, clusterAnomalies);
            } catch (Exception e) {
                log.error("Alert dispatch failed for cluster '%s'".formatted(clusterId), e);
            }
        });
    }

    private void dispatchCluster(String clusterId, List<BeaconAnomaly> anomalies) {
        Optional<String> chatId = resolveChatId(clusterId);
        if (chatId.isEmpty() || !sender.isConfigured()) {
            log.warn("No alert channel for cluster '%s' (%s); logging %d anomalies".formatted(
                    clusterId, chatId.isEmpty() ? "no target" : "no bot token", anomalies.size()));
            anomalies.forEach(a -> log.warn("ALERT [%s] %s instance=%s job=%s value=%s: %s".formatted(
                    clusterId, a.getMetricName(), a.getInstance(), a.getJob(), a.getValue(), a.getReason())));
            return;
        }
        sender.send(chatId.get(), formatter.format(clusterId, anomalies));
    }

    Optional<String> resolveChatId(String clusterId) {
        Optional<String> configured = alertTargetsService.findByClusterId(clusterId)
                .map(BeaconAlertTarget::getChatId)
                .filter(StringUtils::hasText);
        if (configured.isPresent()) {
            return configured;
        }
        return Optional.ofNullable(appConfig.getDefaultChatId()).filter(StringUtils::hasText);
    }
}
