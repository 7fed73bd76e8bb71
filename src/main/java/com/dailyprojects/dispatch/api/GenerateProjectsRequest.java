package com.dailyprojects.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/projects/generate.
 *
 * @param count                number of projects; nullable, defaults to 5
 * @param difficultyPreference difficulties to favour (beginner, intermediate, advanced); nullable
 * @param categoryPreference   category to favour, at most 50 characters; nullable
 */
public record GenerateProjectsRequest(
    Integer count,
    @JsonProperty("difficulty_preference") List<String> difficultyPreference,
    @JsonProperty("category_preference") String categoryPreference
) {}
