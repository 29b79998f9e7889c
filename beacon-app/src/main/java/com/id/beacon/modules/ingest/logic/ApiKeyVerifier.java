package com.id.beacon.modules.ingest.logic;

import com.id.beacon.config.AppConfig;
import com.id.beacon.modules.ingest.exceptions.ApiKeyRejectedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

@Component
@Slf4j
public class ApiKeyVerifier {

    public static final String API_KEY_HEADER = "x-api-key";

    private final AppConfig appConfig;

    public ApiKeyVerifier(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    /**
     * Exact, constant-time comparison against the configured key.
     *
     * @param presented value of the {@value #API_KEY_HEADER} header, may be null
     * @throws ApiKeyRejectedException when the key is missing or does not match
     */
    public void verify(String presented) {
        String expected = appConfig.getApiKey();
        if (presented == null || expected == null || expected.isEmpty()
                || !MessageDigest.isEqual(
                presented.getBytes(StandardCharsets.UTF_8),
                expected.getBytes(StandardCharsets.UTF_8))) {
            log.warn("Rejected request with %s API key".formatted(presented == null ? "missing" : "invalid"));
            throw new ApiKeyRejectedException("Invalid or missing API key");
        }
    }
}
