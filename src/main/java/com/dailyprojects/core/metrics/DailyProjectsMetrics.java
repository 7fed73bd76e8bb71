package com.dailyprojects.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for project generation and caching.
 */
@Service
public class DailyProjectsMetrics {

    private final MeterRegistry registry;

    public DailyProjectsMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param result "hit", "miss", "corrupt" or "unavailable"
     */
    public void recordCacheLookup(String result) {
        Counter.builder("dailyprojects.cache.lookups")
                .tag("result", result)
                .register(registry)
                .increment();
    }

    public void recordBatchGenerated(String source, boolean degraded) {
        Counter.builder("dailyprojects.batches.generated")
                .tag("source", source)
                .tag("degraded", String.valueOf(degraded))
                .register(registry)
                .increment();
    }

    public void recordGenerationDuration(String outcome, long ms) {
        Timer.builder("dailyprojects.generation.duration")
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordFallback(String reason) {
        Counter.builder("dailyprojects.fallbacks.total")
                .description("Generations answered from the template catalog")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordRateLimitDecision(boolean allowed, boolean degraded) {
        Counter.builder("dailyprojects.ratelimit.decisions")
                .tag("allowed", String.valueOf(allowed))
                .tag("degraded", String.valueOf(degraded))
                .register(registry)
                .increment();
    }

    /**
     * Records how a request that lost the generation lock was resolved.
     *
     * @param outcome "published", "took_over" or "gave_up"
     */
    public void recordLockWait(String outcome) {
        Counter.builder("dailyprojects.lock.waits")
                .description("Requests that waited on another request's generation")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
