package com.dailyprojects.core.llm;

/**
 * Thrown when a call to the model provider fails before any content comes back.
 * The {@link Failure} tells callers whether trying again can help.
 */
public class LlmCallException extends RuntimeException {

    public enum Failure {
        /** No response within the configured timeout. */
        TIMEOUT,
        /** 5xx, connection reset, DNS failure and similar. */
        TRANSIENT,
        /** Provider reports no balance, quota or rate allowance left. */
        QUOTA_EXHAUSTED,
        /** No API key configured; the call was never attempted. */
        NOT_CONFIGURED,
        /** Anything else the provider rejected (auth, bad request). */
        FATAL;

        public boolean retryable() {
            return this == TIMEOUT || this == TRANSIENT;
        }
    }

    private final Failure failure;

    public LlmCallException(Failure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public LlmCallException(Failure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public Failure failure() {
        return failure;
    }
}
