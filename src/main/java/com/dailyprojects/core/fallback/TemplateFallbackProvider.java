package com.dailyprojects.core.fallback;

import com.dailyprojects.core.model.GenerationRequest;
import com.dailyprojects.core.model.ProjectDraft;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Random;

/**
 * Picks projects from the {@link TemplateCatalog} when generation fails.
 * <p>
 * Selection is seeded by the date, so every fallback on the same day returns
 * the same projects. Preferences filter the catalog the same way the prompt
 * constrains the model; when too few templates match, the remainder comes from
 * the rest of the catalog and the selection is marked as widened.
 */
@Component
public class TemplateFallbackProvider {

    private static final Logger log = LoggerFactory.getLogger(TemplateFallbackProvider.class);

    private final List<ProjectDraft> catalog;

    public TemplateFallbackProvider() {
        this(TemplateCatalog.PROJECTS);
    }

    TemplateFallbackProvider(List<ProjectDraft> catalog) {
        if (catalog.isEmpty()) {
            throw new IllegalArgumentException("Template catalog must not be empty");
        }
        this.catalog = List.copyOf(catalog);
    }

    public FallbackSelection sample(int count, GenerationRequest constraints, LocalDate date) {
        var random = new Random(date.toEpochDay());

        List<ProjectDraft> matching = new ArrayList<>();
        List<ProjectDraft> others = new ArrayList<>();
        for (ProjectDraft draft : catalog) {
            if (matches(draft, constraints)) {
                matching.add(draft);
            } else {
                others.add(draft);
            }
        }
        Collections.shuffle(matching, random);
        Collections.shuffle(others, random);

        boolean widened = matching.size() < count;
        if (widened) {
            log.warn("Only {} template(s) match the preferences for {} requested; widening the filter",
                    matching.size(), count);
        }

        List<ProjectDraft> ordered = new ArrayList<>(matching);
        ordered.addAll(others);

        List<ProjectDraft> selected = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            selected.add(ordered.get(i % ordered.size()));
        }
        log.info("Selected {} template project(s) for {}", selected.size(), date);
        return new FallbackSelection(List.copyOf(selected), widened);
    }

    private boolean matches(ProjectDraft draft, GenerationRequest constraints) {
        if (constraints == null) {
            return true;
        }
        if (constraints.hasDifficultyPreference()
                && !constraints.difficultyPreference().contains(draft.difficulty())) {
            return false;
        }
        if (constraints.hasCategoryPreference()) {
            String wanted = constraints.categoryPreference().toLowerCase(Locale.ROOT);
            String category = draft.category().toLowerCase(Locale.ROOT);
            return category.contains(wanted) || wanted.contains(category);
        }
        return true;
    }
}
