package com.dailyprojects.core.fallback;

import com.dailyprojects.core.model.ProjectDraft;

import java.util.List;

/**
 * Drafts picked from the template catalog.
 *
 * @param drafts  exactly the requested number of drafts
 * @param widened true when the difficulty/category filter did not leave enough
 *                candidates and the rest of the catalog was used
 */
public record FallbackSelection(
    List<ProjectDraft> drafts,
    boolean widened
) {}
