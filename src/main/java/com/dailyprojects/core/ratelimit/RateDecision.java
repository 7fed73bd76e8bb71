package com.dailyprojects.core.ratelimit;

/**
 * Outcome of admitting one request.
 *
 * @param allowed           whether the request may proceed
 * @param retryAfterSeconds seconds until the current window rolls over; 0 when allowed
 * @param degraded          the counter store was unreachable and the request was let through
 */
public record RateDecision(boolean allowed, long retryAfterSeconds, boolean degraded) {

    public static RateDecision allow() {
        return new RateDecision(true, 0, false);
    }

    public static RateDecision allowDegraded() {
        return new RateDecision(true, 0, true);
    }

    public static RateDecision reject(long retryAfterSeconds) {
        return new RateDecision(false, Math.max(1, retryAfterSeconds), false);
    }
}
