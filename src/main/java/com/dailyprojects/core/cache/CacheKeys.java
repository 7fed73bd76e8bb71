package com.dailyprojects.core.cache;

import java.time.LocalDate;

/**
 * Key layout shared by every component that touches the cache store.
 */
public final class CacheKeys {

    public static final String DAILY_PREFIX = "daily:";
    public static final String LOCK_PREFIX = "lock:";
    public static final String RATE_PREFIX = "rate:";
    public static final String STATS_PREFIX = "stats:";

    /** List of recently generated AI projects, newest first. */
    public static final String POOL = "pool:projects";

    public static final String STATS_TOTAL_GENERATED = STATS_PREFIX + "total_generated";
    public static final String STATS_AI_SOURCED = STATS_PREFIX + "ai_sourced";
    public static final String STATS_FALLBACK_SOURCED = STATS_PREFIX + "fallback_sourced";
    public static final String STATS_CACHE_HITS = STATS_PREFIX + "cache_hits";
    public static final String STATS_CACHE_MISSES = STATS_PREFIX + "cache_misses";

    private CacheKeys() {}

    /** {@code daily:<date>:<count>} */
    public static String daily(LocalDate date, int count) {
        return DAILY_PREFIX + date + ":" + count;
    }

    /** {@code lock:daily:<date>:<count>} */
    public static String dailyLock(LocalDate date, int count) {
        return LOCK_PREFIX + daily(date, count);
    }

    /** Matches every count cached for the date. */
    public static String dailyPattern(LocalDate date) {
        return DAILY_PREFIX + date + ":*";
    }

    public static String allDailyPattern() {
        return DAILY_PREFIX + "*";
    }

    /** {@code rate:<callerKey>:<windowId>} */
    public static String rateWindow(String callerKey, long windowId) {
        return RATE_PREFIX + callerKey + ":" + windowId;
    }

    /**
     * Extracts the count from a {@code daily:<date>:<count>} key, or -1 if the key
     * does not have that shape.
     */
    public static int countOf(String dailyKey) {
        int idx = dailyKey.lastIndexOf(':');
        if (!dailyKey.startsWith(DAILY_PREFIX) || idx < 0) {
            return -1;
        }
        try {
            return Integer.parseInt(dailyKey.substring(idx + 1));
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
