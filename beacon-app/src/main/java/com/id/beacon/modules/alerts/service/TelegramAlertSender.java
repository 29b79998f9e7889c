package com.id.beacon.modules.alerts.service;

import com.id.beacon.config.AppConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * Delivers alert text through the Telegram Bot API {@code sendMessage} method.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TelegramAlertSender {

    private final RestTemplate restTemplate;
    private final AppConfig appConfig;

    public boolean isConfigured() {
        return StringUtils.hasText(appConfig.getTelegramBotToken());
    }

    /**
     * Sends one message. Never throws: delivery errors are logged and reported as {@code false}.
     *
     * @param chatId target chat
     * @param text   Markdown message body
     * @return whether the API accepted the message
     */
    public boolean send(String chatId, String text) {
        if (!isConfigured()) {
            log.warn("Telegram bot token is not configured; cannot send alert to chat {}", chatId);
            return false;
        }
        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);

            Map<String, String> payload = Map.of(
                    "chat_id", chatId,
                    "text", text,
                    "parse_mode", "Markdown");
            String url = "%s/bot%s/sendMessage".formatted(appConfig.getTelegramBaseUrl(), appConfig.getTelegramBotToken());
            restTemplate.postForEntity(url, new HttpEntity<>(payload, headers), String.class);
            log.info("Telegram alert sent to chat {}", chatId);
            return true;
        } catch (Exception ex) {
            log.warn("Failed to send Telegram alert to chat {}: {}", chatId, ex.getMessage());
            return false;
        }
    }
}
