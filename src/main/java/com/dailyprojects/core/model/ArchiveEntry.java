package com.dailyprojects.core.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Summary of a past day's batch: the first few projects plus the batch size.
 */
public record ArchiveEntry(
    LocalDate date,
    List<Project> projects,
    int total
) {}
