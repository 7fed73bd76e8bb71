package com.dailyprojects.core.generation;

import com.dailyprojects.core.model.DifficultyLevel;
import com.dailyprojects.core.model.GenerationRequest;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

@Component
public class ProjectPromptBuilder {

    static final String SYSTEM_PROMPT = """
            You are a senior software architect and mentor with fifteen years of experience.
            You design practical, motivating project ideas for developers of every level.

            Respond ONLY with a valid JSON array, with no text before or after it.

            Your projects:
            - solve real problems
            - use current, relevant technologies
            - have a scope that fits their difficulty
            - list specific, concrete features

            Difficulty levels:
            - beginner: 1-3 days, core concepts, few technologies
            - intermediate: 3-7 days, integrating several systems
            - advanced: 1-3 weeks, complex architecture and optimization
            """;

    static final List<String> SUGGESTED_CATEGORIES = List.of(
            "Web Applications", "Mobile Apps", "Developer Tools", "APIs & Microservices",
            "Data Analysis", "Automation Tools", "Games", "DevOps Tools", "AI/ML Applications");

    public String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    public String userPrompt(GenerationRequest request, int year) {
        int count = request.count();
        String categoryHint = request.hasCategoryPreference()
                ? "Preferably in: " + request.categoryPreference()
                : "Vary between: " + String.join(", ", SUGGESTED_CATEGORIES);

        return """
                Generate exactly %d unique and creative software project ideas for %d.

                DIFFICULTY MIX: %s
                CATEGORIES: %s

                Return a JSON array where every element has exactly this shape:
                {
                  "title": "short, memorable project name",
                  "description": "2-3 sentences on the problem it solves and why it is worth building",
                  "difficulty": "beginner|intermediate|advanced",
                  "estimated_time": "realistic estimate, e.g. 2-3 days, 1 week, 2-3 weeks",
                  "category": "specific category",
                  "technologies": [
                    {"name": "technology name", "kind": "frontend|backend|database|devops|mobile|other", "reason": "why it fits"}
                  ],
                  "features": ["concrete feature 1", "concrete feature 2", "concrete feature 3"]
                }

                Requirements:
                1. Between 2 and 5 technologies per project
                2. Between 3 and 6 concrete features per project
                3. Unique titles
                4. Technologies appropriate to the difficulty

                RESPOND ONLY WITH THE JSON ARRAY.
                """.formatted(count, year, difficultyMix(request), categoryHint);
    }

    static String difficultyMix(GenerationRequest request) {
        if (request.hasDifficultyPreference()) {
            return "preferably " + request.difficultyPreference().stream()
                    .sorted()
                    .map(DifficultyLevel::value)
                    .collect(Collectors.joining(", "));
        }
        int count = request.count();
        if (count == 5) {
            return "1 beginner, 2 intermediate, 2 advanced";
        }
        if (count <= 3) {
            return "balanced";
        }
        return "balanced across the " + count + " projects";
    }
}
