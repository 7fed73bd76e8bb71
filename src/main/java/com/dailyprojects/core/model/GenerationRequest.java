package com.dailyprojects.core.model;

import java.util.Set;

/**
 * Parameters for one generation. Not persisted.
 *
 * @param count                number of projects (1..max-count)
 * @param difficultyPreference preferred difficulties; empty means a balanced mix
 * @param categoryPreference   preferred category; nullable
 * @param forceRegenerate      skip the cached batch for daily requests
 */
public record GenerationRequest(
    int count,
    Set<DifficultyLevel> difficultyPreference,
    String categoryPreference,
    boolean forceRegenerate
) {

    public GenerationRequest {
        difficultyPreference = difficultyPreference != null ? Set.copyOf(difficultyPreference) : Set.of();
        if (categoryPreference != null && categoryPreference.isBlank()) {
            categoryPreference = null;
        }
    }

    public static GenerationRequest daily(int count, boolean forceRegenerate) {
        return new GenerationRequest(count, Set.of(), null, forceRegenerate);
    }

    public boolean hasDifficultyPreference() {
        return !difficultyPreference.isEmpty();
    }

    public boolean hasCategoryPreference() {
        return categoryPreference != null;
    }
}
