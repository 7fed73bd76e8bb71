package com.dailyprojects.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Snapshot of the generation counters kept in the cache store.
 */
public record ProjectStats(
    @JsonProperty("total_generated") long totalGenerated,
    @JsonProperty("ai_sourced") long aiSourced,
    @JsonProperty("fallback_sourced") long fallbackSourced,
    @JsonProperty("cache_hits") long cacheHits,
    @JsonProperty("cache_misses") long cacheMisses,
    @JsonProperty("cache_hit_ratio") double cacheHitRatio,
    @JsonProperty("cache_available") boolean cacheAvailable
) {

    public static ProjectStats unavailable() {
        return new ProjectStats(0, 0, 0, 0, 0, 0.0, false);
    }
}
