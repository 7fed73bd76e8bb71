package com.dailyprojects.core.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Redis-backed {@link CacheStore} built on Spring Data Redis.
 * <p>
 * Locks use {@code SET key value NX PX ttl}. Counters and lock release run as
 * Lua scripts so that "increment and set TTL on creation" and "delete only if
 * still owned" are each a single atomic step on the server. Pattern lookups
 * walk the keyspace with {@code SCAN} rather than the blocking {@code KEYS}.
 */
public class RedisCacheStore implements CacheStore {

    private static final Logger log = LoggerFactory.getLogger(RedisCacheStore.class);

    static final RedisScript<Long> INCREMENT_SCRIPT = new DefaultRedisScript<>("""
            local existed = redis.call('EXISTS', KEYS[1])
            local value = redis.call('INCRBY', KEYS[1], ARGV[1])
            if existed == 0 and tonumber(ARGV[2]) > 0 then
                redis.call('PEXPIRE', KEYS[1], ARGV[2])
            end
            return value
            """, Long.class);

    static final RedisScript<Long> COMPARE_AND_DELETE_SCRIPT = new DefaultRedisScript<>("""
            if redis.call('GET', KEYS[1]) == ARGV[1] then
                return redis.call('DEL', KEYS[1])
            end
            return 0
            """, Long.class);

    static final long SCAN_BATCH = 500;

    private final StringRedisTemplate redis;

    public RedisCacheStore(StringRedisTemplate redis) {
        this.redis = redis;
    }

    @Override
    public Optional<String> get(String key) {
        return run("GET", key, () -> Optional.ofNullable(redis.opsForValue().get(key)));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        run("SET", key, () -> {
            redis.opsForValue().set(key, value, ttl);
            return null;
        });
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        return run("SETNX", key, () -> Boolean.TRUE.equals(redis.opsForValue().setIfAbsent(key, value, ttl)));
    }

    @Override
    public long increment(String key, long delta, Duration ttl) {
        long ttlMillis = ttl != null ? ttl.toMillis() : 0;
        Long value = run("INCRBY", key, () -> redis.execute(INCREMENT_SCRIPT, List.of(key),
                String.valueOf(delta), String.valueOf(ttlMillis)));
        if (value == null) {
            throw new CacheUnavailableException("Redis returned no value for INCRBY " + key);
        }
        return value;
    }

    @Override
    public boolean compareAndDelete(String key, String expectedValue) {
        Long deleted = run("CAD", key, () -> redis.execute(COMPARE_AND_DELETE_SCRIPT, List.of(key), expectedValue));
        return deleted != null && deleted > 0;
    }

    @Override
    public long delete(String key) {
        return run("DEL", key, () -> Boolean.TRUE.equals(redis.delete(key)) ? 1L : 0L);
    }

    @Override
    public long deletePattern(String pattern) {
        return run("DEL", pattern, () -> {
            Set<String> matched = scan(pattern);
            if (matched.isEmpty()) {
                return 0L;
            }
            Long removed = redis.delete(matched);
            return removed != null ? removed : 0L;
        });
    }

    @Override
    public Set<String> keys(String pattern) {
        return run("SCAN", pattern, () -> scan(pattern));
    }

    @Override
    public long listPush(String key, List<String> values, Duration ttl) {
        if (values.isEmpty()) {
            return listLength(key);
        }
        return run("LPUSH", key, () -> {
            Long length = redis.opsForList().leftPushAll(key, values);
            if (ttl != null && !ttl.isZero() && !ttl.isNegative()) {
                redis.expire(key, ttl);
            }
            return length != null ? length : 0L;
        });
    }

    @Override
    public List<String> listRange(String key) {
        return run("LRANGE", key, () -> {
            List<String> values = redis.opsForList().range(key, 0, -1);
            return values != null ? values : List.of();
        });
    }

    @Override
    public long listLength(String key) {
        return run("LLEN", key, () -> {
            Long size = redis.opsForList().size(key);
            return size != null ? size : 0L;
        });
    }

    @Override
    public long listRemove(String key, String value) {
        return run("LREM", key, () -> {
            Long removed = redis.opsForList().remove(key, 1, value);
            return removed != null ? removed : 0L;
        });
    }

    private Set<String> scan(String pattern) {
        Set<String> matched = new HashSet<>();
        ScanOptions options = ScanOptions.scanOptions().match(pattern).count(SCAN_BATCH).build();
        try (Cursor<String> cursor = redis.scan(options)) {
            while (cursor.hasNext()) {
                matched.add(cursor.next());
            }
        }
        return matched;
    }

    @Override
    public boolean ping() {
        try {
            String pong = redis.execute((RedisCallback<String>) RedisConnection::ping);
            return "PONG".equalsIgnoreCase(pong);
        } catch (DataAccessException e) {
            log.warn("Redis ping failed: {}", e.getMessage());
            return false;
        }
    }

    private <T> T run(String operation, String key, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.warn("Redis {} {} failed: {}", operation, key, e.getMessage());
            throw new CacheUnavailableException("Redis " + operation + " failed for " + key, e);
        }
    }
}
