package com.dailyprojects.core.cache;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "dailyprojects.cache")
public class CacheProperties {

    /** "redis" or "memory". */
    private String provider = "redis";
    private Duration dailyTtl = Duration.ofDays(7);
    /** Shorter than {@link #dailyTtl} so a template batch gets replaced by AI output sooner. */
    private Duration fallbackTtl = Duration.ofHours(1);
    private Duration lockTtl = Duration.ofSeconds(90);
    private Duration pollInterval = Duration.ofMillis(500);
    /** 0 derives the cap from lockTtl / pollInterval. */
    private int pollMaxAttempts = 0;
    private Duration statsTtl = Duration.ofDays(30);
    /** TTL of the pool list, refreshed on every add; also the age at which pooled projects are pruned. */
    private Duration poolTtl = Duration.ofDays(7);

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }
    public Duration getDailyTtl() { return dailyTtl; }
    public void setDailyTtl(Duration dailyTtl) { this.dailyTtl = dailyTtl; }
    public Duration getFallbackTtl() { return fallbackTtl; }
    public void setFallbackTtl(Duration fallbackTtl) { this.fallbackTtl = fallbackTtl; }
    public Duration getLockTtl() { return lockTtl; }
    public void setLockTtl(Duration lockTtl) { this.lockTtl = lockTtl; }
    public Duration getPollInterval() { return pollInterval; }
    public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
    public int getPollMaxAttempts() { return pollMaxAttempts; }
    public void setPollMaxAttempts(int pollMaxAttempts) { this.pollMaxAttempts = pollMaxAttempts; }
    public Duration getStatsTtl() { return statsTtl; }
    public void setStatsTtl(Duration statsTtl) { this.statsTtl = statsTtl; }
    public Duration getPoolTtl() { return poolTtl; }
    public void setPoolTtl(Duration poolTtl) { this.poolTtl = poolTtl; }

    /**
     * Number of polls a waiter makes before giving up on the lock holder. By
     * default this covers the full lock TTL, so a waiter only gives up once the
     * holder's lock would have expired anyway.
     */
    public int effectivePollAttempts() {
        if (pollMaxAttempts > 0) {
            return pollMaxAttempts;
        }
        long interval = Math.max(1, pollInterval.toMillis());
        return (int) Math.max(1, (lockTtl.toMillis() + interval - 1) / interval);
    }
}
