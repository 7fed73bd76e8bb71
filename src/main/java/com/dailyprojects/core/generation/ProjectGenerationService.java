package com.dailyprojects.core.generation;

import com.dailyprojects.core.fallback.FallbackSelection;
import com.dailyprojects.core.fallback.TemplateFallbackProvider;
import com.dailyprojects.core.llm.LlmCallException;
import com.dailyprojects.core.llm.LlmEmptyResponseException;
import com.dailyprojects.core.llm.LlmParseException;
import com.dailyprojects.core.llm.LlmProperties;
import com.dailyprojects.core.llm.LlmService;
import com.dailyprojects.core.model.GenerationRequest;
import com.dailyprojects.core.model.ProjectDraft;
import com.dailyprojects.core.model.ProjectSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Generates project drafts with the model and normalizes whatever comes back.
 * <p>
 * Timeouts and upstream errors are retried once after a short backoff;
 * quota exhaustion, missing configuration and unusable payloads are not. A
 * partially valid answer is kept and padded from the template catalog up to
 * the requested count. When nothing usable is produced a
 * {@link GenerationUnavailableException} is thrown.
 */
@Service
public class ProjectGenerationService {

    private static final Logger log = LoggerFactory.getLogger(ProjectGenerationService.class);

    private final LlmService llmService;
    private final ProjectPromptBuilder promptBuilder;
    private final TemplateFallbackProvider fallbackProvider;
    private final LlmProperties properties;
    private final ProjectDraftParser parser;

    public ProjectGenerationService(LlmService llmService,
                                    ProjectPromptBuilder promptBuilder,
                                    TemplateFallbackProvider fallbackProvider,
                                    LlmProperties properties,
                                    ObjectMapper objectMapper) {
        this.llmService = llmService;
        this.promptBuilder = promptBuilder;
        this.fallbackProvider = fallbackProvider;
        this.properties = properties;
        this.parser = new ProjectDraftParser(objectMapper);
    }

    public GenerationResult generate(GenerationRequest request, LocalDate date) {
        int count = request.count();
        String raw = callWithRetry(promptBuilder.systemPrompt(), promptBuilder.userPrompt(request, date.getYear()));

        ProjectDraftParser.Outcome outcome;
        try {
            outcome = parser.parse(raw);
        } catch (LlmParseException e) {
            throw new GenerationUnavailableException(GenerationUnavailableException.Reason.MALFORMED_RESPONSE,
                    e.getMessage(), e);
        }
        if (outcome.drafts().isEmpty()) {
            throw new GenerationUnavailableException(GenerationUnavailableException.Reason.MALFORMED_RESPONSE,
                    "No valid projects in model response (" + outcome.rejected() + " rejected)", null);
        }

        List<GeneratedDraft> drafts = new ArrayList<>(count);
        for (ProjectDraft draft : outcome.drafts()) {
            if (drafts.size() == count) {
                log.info("Model returned {} projects, trimming to {}", outcome.drafts().size(), count);
                break;
            }
            drafts.add(new GeneratedDraft(draft, ProjectSource.AI));
        }

        boolean degraded = false;
        if (drafts.size() < count) {
            int missing = count - drafts.size();
            log.warn("Model returned {} valid project(s) for {} requested; padding {} from templates",
                    drafts.size(), count, missing);
            FallbackSelection padding = fallbackProvider.sample(missing, request, date);
            padding.drafts().forEach(d -> drafts.add(new GeneratedDraft(d, ProjectSource.FALLBACK)));
            degraded = true;
        }
        return new GenerationResult(drafts, degraded);
    }

    private String callWithRetry(String systemPrompt, String userPrompt) {
        int attempts = 1 + Math.max(0, properties.getMaxRetries());
        for (int attempt = 1; ; attempt++) {
            try {
                return llmService.complete(systemPrompt, userPrompt);
            } catch (LlmEmptyResponseException e) {
                throw new GenerationUnavailableException(GenerationUnavailableException.Reason.MALFORMED_RESPONSE,
                        e.getMessage(), e);
            } catch (LlmCallException e) {
                if (!e.failure().retryable() || attempt >= attempts) {
                    throw unavailable(e);
                }
                log.warn("LLM attempt {}/{} failed ({}), retrying", attempt, attempts, e.failure());
                backoff(attempt, e);
            }
        }
    }

    private void backoff(int attempt, LlmCallException cause) {
        long millis = properties.getRetryBackoff().toMillis() * attempt;
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw unavailable(cause);
        }
    }

    private static GenerationUnavailableException unavailable(LlmCallException e) {
        GenerationUnavailableException.Reason reason = switch (e.failure()) {
            case TIMEOUT -> GenerationUnavailableException.Reason.TIMEOUT;
            case QUOTA_EXHAUSTED -> GenerationUnavailableException.Reason.QUOTA_EXHAUSTED;
            case NOT_CONFIGURED -> GenerationUnavailableException.Reason.NOT_CONFIGURED;
            case TRANSIENT, FATAL -> GenerationUnavailableException.Reason.UPSTREAM_ERROR;
        };
        return new GenerationUnavailableException(reason, e.getMessage(), e);
    }
}
