package com.dailyprojects.core.generation;

/**
 * Thrown when the model produced nothing usable. Daily and custom requests are
 * answered with templates instead; pool seeding has no template substitute and
 * lets it through to the caller.
 */
public class GenerationUnavailableException extends RuntimeException {

    public enum Reason {
        TIMEOUT,
        UPSTREAM_ERROR,
        QUOTA_EXHAUSTED,
        NOT_CONFIGURED,
        MALFORMED_RESPONSE
    }

    private final Reason reason;

    public GenerationUnavailableException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
