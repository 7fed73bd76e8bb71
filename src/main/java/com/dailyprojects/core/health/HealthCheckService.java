package com.dailyprojects.core.health;

import com.dailyprojects.core.cache.CacheProperties;
import com.dailyprojects.core.cache.CacheStore;
import com.dailyprojects.core.llm.LlmProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Reports the state of the engine's external dependencies. Neither of them is
 * required to answer requests, so {@link #checkAll()} reports an outage as
 * DEGRADED. {@link #checkReadiness()} is stricter: an unreachable cache store
 * means the instance should not take traffic, and reports DOWN.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final CacheStore cacheStore;
    private final CacheProperties cacheProperties;
    private final LlmProperties llmProperties;

    public HealthCheckService(CacheStore cacheStore, CacheProperties cacheProperties, LlmProperties llmProperties) {
        this.cacheStore = cacheStore;
        this.cacheProperties = cacheProperties;
        this.llmProperties = llmProperties;
    }

    public List<HealthStatus> checkAll() {
        return List.of(checkCache(), checkLlm());
    }

    /** Cache reachability for readiness checks: UP or DOWN. */
    public HealthStatus checkReadiness() {
        HealthStatus cache = checkCache();
        if (cache.status() == HealthStatus.Status.UP) {
            return cache;
        }
        return new HealthStatus(cache.component(), HealthStatus.Status.DOWN, cache.detail(), cache.metadata());
    }

    private HealthStatus checkCache() {
        Map<String, String> metadata = Map.of("provider", cacheProperties.getProvider());
        try {
            if (cacheStore.ping()) {
                return new HealthStatus("cache", HealthStatus.Status.UP,
                        "Cache store reachable", metadata);
            }
            return new HealthStatus("cache", HealthStatus.Status.DEGRADED,
                    "Cache store did not answer ping, serving uncached", metadata);
        } catch (RuntimeException e) {
            log.warn("Cache health check failed: {}", e.getMessage());
            return new HealthStatus("cache", HealthStatus.Status.DEGRADED,
                    "Cache error: " + e.getMessage(), metadata);
        }
    }

    private HealthStatus checkLlm() {
        Map<String, String> metadata = Map.of(
                "provider", llmProperties.getProvider(),
                "model", llmProperties.getModel());
        if (llmProperties.hasApiKey()) {
            return new HealthStatus("llm", HealthStatus.Status.UP,
                    "API key configured", metadata);
        }
        return new HealthStatus("llm", HealthStatus.Status.DEGRADED,
                "No API key configured, serving templates", metadata);
    }
}
