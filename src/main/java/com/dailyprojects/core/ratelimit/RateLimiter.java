package com.dailyprojects.core.ratelimit;

import com.dailyprojects.core.cache.CacheKeys;
import com.dailyprojects.core.cache.CacheStore;
import com.dailyprojects.core.cache.CacheUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;

/**
 * Fixed-window request counter per caller key.
 * <p>
 * The window id is {@code epochSecond / windowSeconds}; each window gets its own
 * counter key which expires with the window. When the counter store is down,
 * requests are admitted.
 */
@Service
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final CacheStore cacheStore;
    private final RateLimitProperties properties;
    private final Clock clock;

    public RateLimiter(CacheStore cacheStore, RateLimitProperties properties, Clock clock) {
        this.cacheStore = cacheStore;
        this.properties = properties;
        this.clock = clock;
    }

    public RateDecision admit(String callerKey) {
        if (!properties.isEnabled()) {
            return RateDecision.allow();
        }
        long windowSeconds = Math.max(1, properties.getWindow().toSeconds());
        long nowSeconds = clock.instant().getEpochSecond();
        long windowId = nowSeconds / windowSeconds;

        long count;
        try {
            count = cacheStore.increment(CacheKeys.rateWindow(callerKey, windowId), Duration.ofSeconds(windowSeconds));
        } catch (CacheUnavailableException e) {
            log.warn("Rate limit store unavailable, admitting {}: {}", callerKey, e.getMessage());
            return RateDecision.allowDegraded();
        }

        if (count > properties.getMaxRequests()) {
            long retryAfter = (windowId + 1) * windowSeconds - nowSeconds;
            log.info("Rate limit exceeded for {} ({} requests in window {}), retry after {}s",
                    callerKey, count, windowId, retryAfter);
            return RateDecision.reject(retryAfter);
        }
        return RateDecision.allow();
    }
}
