package com.dailyprojects.core.engine;

import com.dailyprojects.core.model.DailyBatch;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * JSON form of a {@link DailyBatch} as stored under its daily key.
 */
class DailyBatchCodec {

    private static final Logger log = LoggerFactory.getLogger(DailyBatchCodec.class);

    private final ObjectMapper objectMapper;

    DailyBatchCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    String encode(DailyBatch batch) {
        try {
            return objectMapper.writeValueAsString(batch);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize batch for " + batch.date(), e);
        }
    }

    /**
     * Returns empty for entries that cannot be read back or whose shape does not
     * match the key they were stored under.
     */
    Optional<DailyBatch> decode(String key, String json, int expectedCount) {
        DailyBatch batch;
        try {
            batch = objectMapper.readValue(json, DailyBatch.class);
        } catch (JsonProcessingException e) {
            log.warn("Corrupt cache entry at {}: {}", key, e.getOriginalMessage());
            return Optional.empty();
        }
        if (batch == null || batch.date() == null) {
            log.warn("Corrupt cache entry at {}: no batch", key);
            return Optional.empty();
        }
        if (batch.projects().size() != expectedCount) {
            log.warn("Cache entry at {} holds {} project(s), expected {}", key, batch.projects().size(), expectedCount);
            return Optional.empty();
        }
        return Optional.of(batch);
    }
}
