package com.id.beacon.modules.alerts.rest;

import com.id.beacon.modules.alerts.model.AlertTargetRequest;
import com.id.beacon.modules.alerts.model.BeaconAlertTarget;
import com.id.beacon.modules.alerts.service.AlertTargetsService;
import com.id.beacon.modules.ingest.logic.ApiKeyVerifier;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("alert-targets")
public class AlertTargetsRest {

    private final AlertTargetsService alertTargetsService;
    private final ApiKeyVerifier apiKeyVerifier;

    public AlertTargetsRest(AlertTargetsService alertTargetsService, ApiKeyVerifier apiKeyVerifier) {
        this.alertTargetsService = alertTargetsService;
        this.apiKeyVerifier = apiKeyVerifier;
    }

    @GetMapping
    public List<BeaconAlertTarget> listTargets(@RequestHeader(value = ApiKeyVerifier.API_KEY_HEADER, required = false) String apiKey) {
        apiKeyVerifier.verify(apiKey);
        return alertTargetsService.findAll();
    }

    @GetMapping("{clusterId}")
    public BeaconAlertTarget getTarget(@PathVariable("clusterId") String clusterId,
                                       @RequestHeader(value = ApiKeyVerifier.API_KEY_HEADER, required = false) String apiKey) {
        apiKeyVerifier.verify(apiKey);
        return alertTargetsService.findByClusterId(clusterId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "No alert target for cluster: " + clusterId));
    }

    @PutMapping("{clusterId}")
    public BeaconAlertTarget putTarget(@PathVariable("clusterId") String clusterId,
                                       @Valid @RequestBody AlertTargetRequest request,
                                       @RequestHeader(value = ApiKeyVerifier.API_KEY_HEADER, required = false) String apiKey) {
        apiKeyVerifier.verify(apiKey);
        try {
            return alertTargetsService.save(clusterId, BeaconAlertTarget.builder()
                    .clusterId(clusterId)
                    .chatId(request.getChatId())
                    .description(request.getDescription() == null ? "" : request.getDescription())
                    .build());
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }

    @DeleteMapping("{clusterId}")
    public ResponseEntity<Void> deleteTarget(@PathVariable("clusterId") String clusterId,
                                             @RequestHeader(value = ApiKeyVerifier.API_KEY_HEADER, required = false) String apiKey) {
        apiKeyVerifier.verify(apiKey);
        if (!alertTargetsService.delete(clusterId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No alert target for cluster: " + clusterId);
        }
        return ResponseEntity.noContent().build();
    }
}
