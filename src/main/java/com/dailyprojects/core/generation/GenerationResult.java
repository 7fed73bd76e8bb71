package com.dailyprojects.core.generation;

import com.dailyprojects.core.model.ProjectSource;

import java.util.List;

/**
 * Output of a successful generation.
 *
 * @param drafts   exactly the requested number of drafts, in order
 * @param degraded true when some drafts were padded from templates
 */
public record GenerationResult(
    List<GeneratedDraft> drafts,
    boolean degraded
) {

    public GenerationResult {
        drafts = List.copyOf(drafts);
    }

    public long countFrom(ProjectSource source) {
        return drafts.stream().filter(d -> d.source() == source).count();
    }
}
