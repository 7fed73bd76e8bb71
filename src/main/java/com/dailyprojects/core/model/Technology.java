package com.dailyprojects.core.model;

import java.io.Serializable;

/**
 * A technology recommended for a project.
 *
 * @param name   e.g. "React", "PostgreSQL"
 * @param kind   part of the stack it covers
 * @param reason why it fits this particular project
 */
public record Technology(
    String name,
    TechnologyKind kind,
    String reason
) implements Serializable {}
