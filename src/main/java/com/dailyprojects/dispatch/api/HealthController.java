package com.dailyprojects.dispatch.api;

import com.dailyprojects.core.health.HealthCheckService;
import com.dailyprojects.core.health.HealthStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for system health status.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private final HealthCheckService healthCheckService;

    public HealthController(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    /**
     * GET /api/v1/health — Component health. The service keeps answering
     * through either outage, so a degraded component still returns 200.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        boolean anyDegraded = false;

        Map<String, Object> components = new LinkedHashMap<>();
        for (var check : healthCheckService.checkAll()) {
            Map<String, Object> componentInfo = new LinkedHashMap<>();
            componentInfo.put("status", check.status().name());
            componentInfo.put("detail", check.detail());
            if (!check.metadata().isEmpty()) {
                componentInfo.put("metadata", check.metadata());
            }
            components.put(check.component(), componentInfo);

            anyDegraded |= check.status() != HealthStatus.Status.UP;
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", anyDegraded ? "DEGRADED" : "UP");
        result.put("components", components);
        return ResponseEntity.ok(result);
    }

    /**
     * GET /api/v1/health/live — 200 whenever the process can answer.
     */
    @GetMapping("/live")
    public ResponseEntity<Map<String, Object>> live() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", "alive");
        result.put("timestamp", Instant.now().toString());
        return ResponseEntity.ok(result);
    }

    /**
     * GET /api/v1/health/ready — 200 when the cache store answers a ping, 503 otherwise.
     */
    @GetMapping("/ready")
    public ResponseEntity<Map<String, Object>> ready() {
        HealthStatus cache = healthCheckService.checkReadiness();
        boolean ready = cache.status() == HealthStatus.Status.UP;

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", ready ? "ready" : "not_ready");
        result.put("detail", cache.detail());
        result.put("timestamp", Instant.now().toString());
        return ready ? ResponseEntity.ok(result)
                     : ResponseEntity.status(503).body(result);
    }
}
