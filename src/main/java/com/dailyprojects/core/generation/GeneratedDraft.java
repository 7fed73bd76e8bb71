package com.dailyprojects.core.generation;

import com.dailyprojects.core.model.ProjectDraft;
import com.dailyprojects.core.model.ProjectSource;

/**
 * A draft together with where it came from.
 */
public record GeneratedDraft(ProjectDraft draft, ProjectSource source) {}
