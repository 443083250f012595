package com.cratedownloads.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final ReadinessHealthIndicator readinessHealthIndicator;

    @Value("${app.downloads.read-only:false}")
    private boolean readOnly;

    public HealthController(ReadinessHealthIndicator readinessHealthIndicator) {
        this.readinessHealthIndicator = readinessHealthIndicator;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Health dbHealth = readinessHealthIndicator.health();

        Map<String, Object> response = new HashMap<>();
        response.put("status", dbHealth.getStatus().getCode());
        response.put("timestamp", Instant.now().toString());
        response.put("downloadCounting", readOnly ? "DISABLED" : "ENABLED");

        Map<String, Object> checks = new HashMap<>();
        checks.put("db", dbHealth.getDetails().getOrDefault("database", "UP"));
        response.put("checks", checks);

        HttpStatus status = Status.UP.equals(dbHealth.getStatus()) ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(response);
    }
}
