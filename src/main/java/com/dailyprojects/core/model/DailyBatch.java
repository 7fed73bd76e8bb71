package com.dailyprojects.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * The projects cached under one {@code (date, count)} key.
 *
 * @param date     calendar day the batch belongs to
 * @param count    number of projects requested
 * @param projects ordered projects, all sharing one {@code generated_at}
 * @param source   {@code ai} when generation succeeded, {@code fallback} when the
 *                 whole batch came from templates
 * @param degraded true when part of the batch was padded from templates or the
 *                 template filter had to be widened
 */
public record DailyBatch(
    LocalDate date,
    int count,
    List<Project> projects,
    ProjectSource source,
    boolean degraded
) implements Serializable {

    public DailyBatch {
        projects = projects != null ? List.copyOf(projects) : List.of();
    }

    public List<String> ids() {
        return projects.stream().map(Project::id).toList();
    }

    public Instant generatedAt() {
        return projects.isEmpty() ? null : projects.get(0).generatedAt();
    }
}
