package com.dailyprojects.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * How demanding a project idea is, serialized in lower case.
 */
public enum DifficultyLevel {
    BEGINNER,
    INTERMEDIATE,
    ADVANCED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DifficultyLevel fromValue(String value) {
        return parse(value).orElseThrow(() ->
                new IllegalArgumentException("Unknown difficulty: " + value));
    }

    /**
     * Lenient lookup used when validating model output.
     */
    public static Optional<DifficultyLevel> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (DifficultyLevel level : values()) {
            if (level.name().equals(normalized)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }
}
