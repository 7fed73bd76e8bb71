package com.dailyprojects.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * A published project idea. Daily ids have the form {@code <YYYY-MM-DD>-<n>}
 * where {@code n} is the 1-based position in the batch.
 */
public record Project(
    String id,
    String title,
    String description,
    DifficultyLevel difficulty,
    @JsonProperty("estimated_time") String estimatedTime,
    String category,
    List<Technology> technologies,
    List<String> features,
    @JsonProperty("generated_at") Instant generatedAt,
    ProjectSource source
) implements Serializable {

    public Project {
        technologies = technologies != null ? List.copyOf(technologies) : List.of();
        features = features != null ? List.copyOf(features) : List.of();
    }

    public static Project from(ProjectDraft draft, String id, Instant generatedAt, ProjectSource source) {
        return new Project(id, draft.title(), draft.description(), draft.difficulty(),
                draft.estimatedTime(), draft.category(), draft.technologies(), draft.features(),
                generatedAt, source);
    }
}
