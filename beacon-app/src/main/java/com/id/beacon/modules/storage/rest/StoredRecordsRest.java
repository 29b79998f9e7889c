package com.id.beacon.modules.storage.rest;

import com.id.beacon.modules.ingest.logic.ApiKeyVerifier;
import com.id.beacon.modules.storage.model.BeaconStoredMetric;
import com.id.beacon.modules.storage.service.StoredRecordsReader;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("records")
public class StoredRecordsRest {

    private final StoredRecordsReader reader;
    private final ApiKeyVerifier apiKeyVerifier;

    public StoredRecordsRest(StoredRecordsReader reader, ApiKeyVerifier apiKeyVerifier) {
        this.reader = reader;
        this.apiKeyVerifier = apiKeyVerifier;
    }

    @GetMapping("metrics/{clusterId}")
    public List<BeaconStoredMetric> latestMetrics(@PathVariable("clusterId") String clusterId,
                                                  @RequestParam(value = "limit", defaultValue = "50") int limit,
                                                  @RequestHeader(value = ApiKeyVerifier.API_KEY_HEADER, required = false) String apiKey) {
        apiKeyVerifier.verify(apiKey);
        try {
            return reader.latestMetrics(clusterId, limit);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }

    @GetMapping("metrics/{clusterId}/item")
    public BeaconStoredMetric getMetric(@PathVariable("clusterId") String clusterId,
                                        @RequestParam("sortKey") String sortKey,
                                        @RequestHeader(value = ApiKeyVerifier.API_KEY_HEADER, required = false) String apiKey) {
        apiKeyVerifier.verify(apiKey);
        return reader.findMetric(clusterId, sortKey)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Item not found: " + sortKey));
    }
}
