package com.gembridge.controller;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Unauthenticated liveness probe for container orchestration.
 */
@RestController
public class HealthController {

    static final String SERVICE_NAME = "gembridge";

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "healthy", "service", SERVICE_NAME);
    }
}
