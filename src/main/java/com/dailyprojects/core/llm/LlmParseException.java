package com.dailyprojects.core.llm;

/**
 * Thrown when LLM output does not contain the JSON structure that was asked for.
 */
public class LlmParseException extends RuntimeException {
    public LlmParseException(String message) {
        super(message);
    }

    public LlmParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
