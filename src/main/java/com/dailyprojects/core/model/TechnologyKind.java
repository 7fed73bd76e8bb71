package com.dailyprojects.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Area of the stack a {@link Technology} belongs to.
 */
public enum TechnologyKind {
    FRONTEND,
    BACKEND,
    DATABASE,
    DEVOPS,
    MOBILE,
    OTHER;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Unknown or missing kinds collapse to {@link #OTHER}; models tend to invent
     * their own labels ("framework", "library", "tool").
     */
    @JsonCreator
    public static TechnologyKind fromValue(String value) {
        if (value == null || value.isBlank()) {
            return OTHER;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (TechnologyKind kind : values()) {
            if (kind.name().equals(normalized)) {
                return kind;
            }
        }
        return OTHER;
    }
}
