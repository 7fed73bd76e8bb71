package com.dailyprojects.core.llm;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;

import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Thin wrapper around Spring AI's {@link ChatClient}: one system + user prompt
 * in, raw model text out.
 * <p>
 * Each call runs on a small dedicated pool so the configured timeout can be
 * enforced regardless of the underlying HTTP client settings. Provider errors
 * are translated into {@link LlmCallException} with a {@link LlmCallException.Failure}
 * that tells the caller whether a retry makes sense.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatClient chatClient;
    private final LlmProperties properties;
    private final ExecutorService executor;

    public LlmService(ChatClient.Builder builder,
                      LlmProperties properties,
                      @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this.chatClient = builder.build();
        this.properties = properties;
        this.executor = Executors.newFixedThreadPool(Math.max(1, properties.getMaxConcurrentCalls()));
        log.info("LlmService initialized — provider: {}, model: {}, base-url: {}",
                properties.getProvider(), properties.getModel(), baseUrl);
    }

    /**
     * Sends a system + user prompt to the model and returns the text it produced.
     *
     * @throws LlmCallException          if the call fails, times out or is not configured
     * @throws LlmEmptyResponseException if the model answered with blank content
     */
    public String complete(String systemPrompt, String userPrompt) {
        if (!isConfigured()) {
            throw new LlmCallException(LlmCallException.Failure.NOT_CONFIGURED,
                    "No API key configured for provider " + properties.getProvider());
        }
        log.info("LLM call started → {}", properties.getModel());
        long start = System.currentTimeMillis();
        Future<String> future = executor.submit(() -> chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt)
                .call()
                .content());

        String response;
        try {
            response = future.get(properties.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new LlmCallException(LlmCallException.Failure.TIMEOUT,
                    "LLM call timed out after " + properties.getTimeout().toSeconds() + "s", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new LlmCallException(LlmCallException.Failure.TRANSIENT, "Interrupted while waiting for LLM", e);
        } catch (ExecutionException e) {
            throw translate(e.getCause() != null ? e.getCause() : e);
        }

        long elapsed = System.currentTimeMillis() - start;
        log.info("LLM call complete ({}s)", String.format("%.1f", elapsed / 1000.0));
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content from " + properties.getModel()
                    + ". Check that the model is running and supports JSON output.");
        }
        return response;
    }

    public boolean isConfigured() {
        return properties.hasApiKey();
    }

    static LlmCallException translate(Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        if (cause instanceof LlmCallException llm) {
            return llm;
        }
        if (cause instanceof TransientAiException || cause instanceof ResourceAccessException) {
            log.warn("Transient LLM failure: {}", message);
            return new LlmCallException(LlmCallException.Failure.TRANSIENT, message, cause);
        }
        if (cause instanceof NonTransientAiException) {
            if (looksLikeQuotaExhausted(message)) {
                log.warn("LLM provider reports exhausted quota: {}", message);
                return new LlmCallException(LlmCallException.Failure.QUOTA_EXHAUSTED, message, cause);
            }
            log.error("LLM provider rejected the request: {}", message);
            return new LlmCallException(LlmCallException.Failure.FATAL, message, cause);
        }
        log.error("Unexpected LLM failure: {}", message, cause);
        return new LlmCallException(LlmCallException.Failure.FATAL, message, cause);
    }

    private static boolean looksLikeQuotaExhausted(String message) {
        String m = message.toLowerCase(Locale.ROOT);
        return m.contains("402") || m.contains("429") || m.contains("insufficient")
                || m.contains("quota") || m.contains("balance");
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }
}
