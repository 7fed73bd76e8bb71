package com.dailyprojects.core.generation;

import com.dailyprojects.core.llm.LlmParseException;
import com.dailyprojects.core.model.DifficultyLevel;
import com.dailyprojects.core.model.ProjectDraft;
import com.dailyprojects.core.model.Technology;
import com.dailyprojects.core.model.TechnologyKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns raw model output into {@link ProjectDraft}s, one entry at a time.
 * <p>
 * The JSON array is located inside whatever the model wrapped it in (markdown
 * fences, a leading sentence). Entries that do not match the project shape are
 * skipped and counted; only a response with no array at all is an error.
 */
public class ProjectDraftParser {

    private static final Logger log = LoggerFactory.getLogger(ProjectDraftParser.class);

    private final ObjectMapper mapper;

    public record Outcome(List<ProjectDraft> drafts, int rejected) {}

    public ProjectDraftParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Outcome parse(String raw) {
        String json = extractArray(raw);
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new LlmParseException("Model response is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (!root.isArray()) {
            throw new LlmParseException("Model response must be a JSON array of projects");
        }

        List<ProjectDraft> drafts = new ArrayList<>();
        int rejected = 0;
        for (int i = 0; i < root.size(); i++) {
            Optional<ProjectDraft> draft = toDraft(root.get(i), i);
            if (draft.isPresent()) {
                drafts.add(draft.get());
            } else {
                rejected++;
            }
        }
        return new Outcome(drafts, rejected);
    }

    static String extractArray(String raw) {
        if (raw == null) {
            throw new LlmParseException("Model response is empty");
        }
        String cleaned = raw.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        int start = cleaned.indexOf('[');
        int end = cleaned.lastIndexOf(']');
        if (start < 0 || end <= start) {
            throw new LlmParseException("No JSON array found in model response");
        }
        return cleaned.substring(start, end + 1);
    }

    private Optional<ProjectDraft> toDraft(JsonNode node, int index) {
        if (node == null || !node.isObject()) {
            return reject(index, "not an object");
        }
        String title = text(node, "title");
        String description = text(node, "description");
        String estimatedTime = text(node, "estimated_time");
        if (estimatedTime == null) {
            estimatedTime = text(node, "estimatedTime");
        }
        String category = text(node, "category");
        if (title == null) return reject(index, "missing title");
        if (description == null) return reject(index, "missing description");
        if (estimatedTime == null) return reject(index, "missing estimated_time");
        if (category == null) return reject(index, "missing category");

        Optional<DifficultyLevel> difficulty = DifficultyLevel.parse(text(node, "difficulty"));
        if (difficulty.isEmpty()) {
            return reject(index, "invalid difficulty");
        }

        List<Technology> technologies = new ArrayList<>();
        JsonNode techNode = node.get("technologies");
        if (techNode != null && techNode.isArray()) {
            for (JsonNode t : techNode) {
                String name = text(t, "name");
                if (name == null) {
                    continue;
                }
                String kind = text(t, "kind");
                if (kind == null) {
                    kind = text(t, "type");
                }
                String reason = text(t, "reason");
                technologies.add(new Technology(name, TechnologyKind.fromValue(kind), reason != null ? reason : ""));
            }
        }
        if (technologies.isEmpty()) {
            return reject(index, "no technologies");
        }

        List<String> features = new ArrayList<>();
        JsonNode featureNode = node.get("features");
        if (featureNode != null && featureNode.isArray()) {
            for (JsonNode f : featureNode) {
                if (f.isTextual() && !f.asText().isBlank()) {
                    features.add(f.asText().trim());
                }
            }
        }
        if (features.isEmpty()) {
            return reject(index, "no features");
        }

        return Optional.of(new ProjectDraft(title, description, difficulty.get(), estimatedTime, category,
                technologies, features));
    }

    private static Optional<ProjectDraft> reject(int index, String why) {
        log.warn("Skipping project #{} from model response: {}", index, why);
        return Optional.empty();
    }

    private static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            return null;
        }
        return value.asText().trim();
    }
}
