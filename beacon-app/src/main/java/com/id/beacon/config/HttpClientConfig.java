package com.id.beacon.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class HttpClientConfig {

    /**
     * Client used for alert delivery, with bounded connect and read timeouts.
     */
    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, AppConfig appConfig) {
        Duration timeout = Duration.ofMillis(appConfig.getTelegramTimeoutMs());
        return builder
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
