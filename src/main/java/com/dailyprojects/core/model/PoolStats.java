package com.dailyprojects.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PoolStats(
    @JsonProperty("pool_size") long poolSize,
    @JsonProperty("pool_available") boolean poolAvailable,
    @JsonProperty("cache_available") boolean cacheAvailable
) {

    public static PoolStats of(long size) {
        return new PoolStats(size, size > 0, true);
    }

    public static PoolStats unavailable() {
        return new PoolStats(0, false, false);
    }
}
