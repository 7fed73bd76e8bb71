package com.dailyprojects.core.engine;

import com.dailyprojects.core.cache.CacheKeys;
import com.dailyprojects.core.cache.CacheProperties;
import com.dailyprojects.core.cache.CacheStore;
import com.dailyprojects.core.cache.CacheUnavailableException;
import com.dailyprojects.core.model.Project;
import com.dailyprojects.core.model.ProjectSource;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Rolling list of model-written projects kept under {@link CacheKeys#POOL}.
 * Template projects never enter it. Entries older than the pool TTL are
 * pruned whenever new ones are added.
 */
class ProjectPool {

    private static final Logger log = LoggerFactory.getLogger(ProjectPool.class);

    private final CacheStore cacheStore;
    private final CacheProperties cacheProperties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    ProjectPool(CacheStore cacheStore, CacheProperties cacheProperties, ObjectMapper objectMapper, Clock clock) {
        this.cacheStore = cacheStore;
        this.cacheProperties = cacheProperties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Adds the AI-sourced projects and prunes stale entries. A cache outage is
     * logged and reported as nothing added.
     *
     * @return number of projects added
     */
    int add(List<Project> projects) {
        List<String> encoded = new ArrayList<>();
        for (Project project : projects) {
            if (project.source() == ProjectSource.AI) {
                encoded.add(encode(project));
            }
        }
        if (encoded.isEmpty()) {
            return 0;
        }
        try {
            long size = cacheStore.listPush(CacheKeys.POOL, encoded, cacheProperties.getPoolTtl());
            log.info("Added {} project(s) to the pool, size now {}", encoded.size(), size);
            prune();
            return encoded.size();
        } catch (CacheUnavailableException e) {
            log.warn("Could not add projects to the pool: {}", e.getMessage());
            return 0;
        }
    }

    /** Up to {@code count} distinct pooled projects in random order. */
    List<Project> sample(int count) {
        List<String> raw = new ArrayList<>(cacheStore.listRange(CacheKeys.POOL));
        Collections.shuffle(raw, ThreadLocalRandom.current());
        List<Project> picked = new ArrayList<>(Math.min(count, raw.size()));
        for (String json : raw) {
            if (picked.size() == count) {
                break;
            }
            decode(json).ifPresent(picked::add);
        }
        return picked;
    }

    long size() {
        return cacheStore.listLength(CacheKeys.POOL);
    }

    /** @return number of projects that were in the pool */
    long clear() {
        long size = size();
        cacheStore.delete(CacheKeys.POOL);
        return size;
    }

    /**
     * Removes entries generated longer ago than the pool TTL, along with
     * entries that cannot be read back.
     *
     * @return number of entries removed
     */
    int prune() {
        Instant cutoff = clock.instant().minus(cacheProperties.getPoolTtl());
        int removed = 0;
        for (String json : cacheStore.listRange(CacheKeys.POOL)) {
            Optional<Project> project = decode(json);
            boolean stale = project.map(p -> p.generatedAt() == null || p.generatedAt().isBefore(cutoff))
                    .orElse(true);
            if (stale) {
                removed += (int) cacheStore.listRemove(CacheKeys.POOL, json);
            }
        }
        if (removed > 0) {
            log.info("Pruned {} stale pool entr{}", removed, removed == 1 ? "y" : "ies");
        }
        return removed;
    }

    private String encode(Project project) {
        try {
            return objectMapper.writeValueAsString(project);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize project " + project.id(), e);
        }
    }

    private Optional<Project> decode(String json) {
        try {
            return Optional.ofNullable(objectMapper.readValue(json, Project.class));
        } catch (JsonProcessingException e) {
            log.warn("Skipping unreadable pool entry: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
