package com.dailyprojects.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of seeding the pool.
 *
 * @param requested number of projects asked for
 * @param generated number of projects generated, template padding included
 * @param added     number of model-written projects that went into the pool
 * @param poolSize  pool size after seeding; 0 when the cache is unreachable
 */
public record PoolSeedResult(
    int requested,
    @JsonProperty("projects_generated") int generated,
    @JsonProperty("projects_added") int added,
    @JsonProperty("pool_size") long poolSize
) {}
