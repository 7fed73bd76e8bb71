package com.dailyprojects.core.ratelimit;

import com.dailyprojects.core.MutableClock;
import com.dailyprojects.core.cache.CacheStore;
import com.dailyprojects.core.cache.CacheUnavailableException;
import com.dailyprojects.core.cache.InMemoryCacheStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RateLimiterTest {

    private MutableClock clock;
    private RateLimitProperties properties;
    private RateLimiter limiter;

    @BeforeEach
    void setUp() {
        // 20 seconds into a 60-second window
        clock = new MutableClock(Instant.ofEpochSecond(1_757_750_420L));
        properties = new RateLimitProperties();
        properties.setMaxRequests(3);
        properties.setWindow(Duration.ofSeconds(60));
        limiter = new RateLimiter(new InMemoryCacheStore(clock), properties, clock);
    }

    @Test
    @DisplayName("accepts the max-th call and rejects the next one")
    void acceptsUpToMax() {
        assertTrue(limiter.admit("10.0.0.1").allowed());
        assertTrue(limiter.admit("10.0.0.1").allowed());
        assertTrue(limiter.admit("10.0.0.1").allowed());

        RateDecision rejected = limiter.admit("10.0.0.1");
        assertFalse(rejected.allowed());
        assertEquals(40, rejected.retryAfterSeconds());
    }

    @Test
    @DisplayName("counter resets when the window rolls over")
    void resetsAfterRollover() {
        for (int i = 0; i < 4; i++) {
            limiter.admit("10.0.0.1");
        }
        assertFalse(limiter.admit("10.0.0.1").allowed());

        clock.advance(Duration.ofSeconds(40));
        assertTrue(limiter.admit("10.0.0.1").allowed());
    }

    @Test
    @DisplayName("callers are counted separately")
    void perCaller() {
        for (int i = 0; i < 3; i++) {
            limiter.admit("10.0.0.1");
        }
        assertFalse(limiter.admit("10.0.0.1").allowed());
        assertTrue(limiter.admit("10.0.0.2").allowed());
    }

    @Test
    @DisplayName("retry-after is at least one second at the window edge")
    void retryAfterMinimum() {
        clock.set(Instant.ofEpochSecond(1_757_750_459L));
        for (int i = 0; i < 3; i++) {
            limiter.admit("10.0.0.1");
        }
        assertEquals(1, limiter.admit("10.0.0.1").retryAfterSeconds());
    }

    @Test
    @DisplayName("unreachable store admits the request as degraded")
    void failsOpen() {
        CacheStore broken = mock(CacheStore.class);
        when(broken.increment(anyString(), any(Duration.class)))
                .thenThrow(new CacheUnavailableException("connection refused"));
        var degradedLimiter = new RateLimiter(broken, properties, clock);

        RateDecision decision = degradedLimiter.admit("10.0.0.1");
        assertTrue(decision.allowed());
        assertTrue(decision.degraded());
    }

    @Test
    @DisplayName("disabled limiter admits everything")
    void disabled() {
        properties.setEnabled(false);
        for (int i = 0; i < 10; i++) {
            assertTrue(limiter.admit("10.0.0.1").allowed());
        }
    }
}
