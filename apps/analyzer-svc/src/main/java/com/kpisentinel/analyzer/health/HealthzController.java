package com.kpisentinel.analyzer.health;

import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness check for load balancers. Actuator stays available for richer checks.
 */
@RestController
public class HealthzController {

    @GetMapping(path = "/healthz", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, String> healthz() {
        return Map.of("status", "UP", "service", "analyzer-svc");
    }
}
