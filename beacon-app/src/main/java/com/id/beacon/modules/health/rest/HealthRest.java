package com.id.beacon.modules.health.rest;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class HealthRest {

    @GetMapping("health")
    public Map<String, String> health() {
        return Map.of("status", "UP");
    }
}
