package com.dailyprojects.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * A project idea before it is placed in a batch: no id, timestamp or source yet.
 * Produced by the AI generation path and by the template catalog.
 */
public record ProjectDraft(
    String title,
    String description,
    DifficultyLevel difficulty,
    @JsonProperty("estimated_time") String estimatedTime,
    String category,
    List<Technology> technologies,
    List<String> features
) implements Serializable {

    public ProjectDraft {
        technologies = technologies != null ? List.copyOf(technologies) : List.of();
        features = features != null ? List.copyOf(features) : List.of();
    }
}
