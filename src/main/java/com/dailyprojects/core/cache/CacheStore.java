package com.dailyprojects.core.cache;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Key/value store with per-key TTL and atomic counters. The only shared mutable
 * resource of the engine: batches, generation locks, rate windows and stats
 * counters all live here.
 * <p>
 * Every method throws {@link CacheUnavailableException} when the backing store
 * cannot be reached. Callers degrade (serve without cache, fail open) rather
 * than propagate it.
 */
public interface CacheStore {

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    /**
     * Stores the value only when the key is absent.
     *
     * @return true if this call created the key
     */
    boolean setIfAbsent(String key, String value, Duration ttl);

    /**
     * Atomically adds {@code delta} to the counter at {@code key}. A missing key is
     * created with value {@code delta} and the given TTL; an existing key keeps
     * its remaining TTL.
     *
     * @return the counter value after the increment
     */
    long increment(String key, long delta, Duration ttl);

    default long increment(String key, Duration ttl) {
        return increment(key, 1, ttl);
    }

    /**
     * Deletes the key only if it still holds {@code expectedValue}.
     *
     * @return true if the key was deleted
     */
    boolean compareAndDelete(String key, String expectedValue);

    /**
     * @return number of keys removed (0 or 1)
     */
    long delete(String key);

    /**
     * Deletes every key matching a glob pattern ({@code *} and {@code ?}).
     *
     * @return number of keys removed
     */
    long deletePattern(String pattern);

    Set<String> keys(String pattern);

    /**
     * Prepends the values to the list at {@code key} and resets the list's TTL.
     *
     * @return length of the list after the push
     */
    long listPush(String key, List<String> values, Duration ttl);

    /** Every element of the list at {@code key}, head first; empty when absent. */
    List<String> listRange(String key);

    long listLength(String key);

    /**
     * Removes the first occurrence of {@code value} from the list.
     *
     * @return number of elements removed (0 or 1)
     */
    long listRemove(String key, String value);

    boolean ping();
}
