package com.dailyprojects.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Where a project (or a whole batch) came from.
 */
public enum ProjectSource {
    AI,
    FALLBACK;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ProjectSource fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
