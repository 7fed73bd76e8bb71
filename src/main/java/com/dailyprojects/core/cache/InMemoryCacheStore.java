package com.dailyprojects.core.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Single-process cache store backed by a {@link ConcurrentHashMap}.
 * <p>
 * Expiry is evaluated lazily against the injected {@link Clock}, so tests can
 * move time forward without sleeping. Each mutation runs inside
 * {@code compute}, which makes it atomic per key.
 */
public class InMemoryCacheStore implements CacheStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCacheStore.class);

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    /** {@code list} is non-null only for list entries; {@code value} only for strings. */
    private record Entry(String value, List<String> list, long expiresAtMillis) {
        Entry(String value, long expiresAtMillis) {
            this(value, null, expiresAtMillis);
        }

        boolean expired(long now) {
            return expiresAtMillis > 0 && now >= expiresAtMillis;
        }
    }

    public InMemoryCacheStore(Clock clock) {
        this.clock = clock;
        log.info("Using in-memory cache store (single process only)");
    }

    @Override
    public Optional<String> get(String key) {
        Entry entry = live(key);
        if (entry != null && entry.list() != null) {
            throw new IllegalStateException("Value at " + key + " is a list");
        }
        return entry != null ? Optional.of(entry.value()) : Optional.empty();
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        entries.put(key, new Entry(value, expiry(ttl)));
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        var created = new AtomicBoolean(false);
        long now = clock.millis();
        entries.compute(key, (k, existing) -> {
            if (existing != null && !existing.expired(now)) {
                return existing;
            }
            created.set(true);
            return new Entry(value, expiry(ttl));
        });
        return created.get();
    }

    @Override
    public long increment(String key, long delta, Duration ttl) {
        var result = new AtomicLong();
        long now = clock.millis();
        entries.compute(key, (k, existing) -> {
            if (existing == null || existing.expired(now)) {
                result.set(delta);
                return new Entry(String.valueOf(delta), expiry(ttl));
            }
            if (existing.list() != null) {
                throw new IllegalStateException("Value at " + key + " is a list");
            }
            long next;
            try {
                next = Long.parseLong(existing.value()) + delta;
            } catch (NumberFormatException e) {
                throw new IllegalStateException("Value at " + key + " is not an integer");
            }
            result.set(next);
            return new Entry(String.valueOf(next), existing.expiresAtMillis());
        });
        return result.get();
    }

    @Override
    public boolean compareAndDelete(String key, String expectedValue) {
        var deleted = new AtomicBoolean(false);
        long now = clock.millis();
        entries.computeIfPresent(key, (k, existing) -> {
            if (!existing.expired(now) && expectedValue.equals(existing.value())) {
                deleted.set(true);
                return null;
            }
            return existing.expired(now) ? null : existing;
        });
        return deleted.get();
    }

    @Override
    public long delete(String key) {
        Entry removed = entries.remove(key);
        return removed != null && !removed.expired(clock.millis()) ? 1 : 0;
    }

    @Override
    public long deletePattern(String pattern) {
        long removed = 0;
        for (String key : keys(pattern)) {
            removed += delete(key);
        }
        return removed;
    }

    @Override
    public Set<String> keys(String pattern) {
        Pattern regex = globToRegex(pattern);
        long now = clock.millis();
        return entries.entrySet().stream()
                .filter(e -> !e.getValue().expired(now))
                .map(java.util.Map.Entry::getKey)
                .filter(k -> regex.matcher(k).matches())
                .collect(Collectors.toSet());
    }

    @Override
    public long listPush(String key, List<String> values, Duration ttl) {
        var length = new AtomicLong();
        long now = clock.millis();
        entries.compute(key, (k, existing) -> {
            List<String> list = new ArrayList<>();
            if (existing != null && !existing.expired(now)) {
                if (existing.list() == null) {
                    throw new IllegalStateException("Value at " + key + " is not a list");
                }
                list.addAll(existing.list());
            }
            for (String value : values) {
                list.add(0, value);
            }
            length.set(list.size());
            return new Entry(null, List.copyOf(list), expiry(ttl));
        });
        return length.get();
    }

    @Override
    public List<String> listRange(String key) {
        Entry entry = live(key);
        if (entry == null) {
            return List.of();
        }
        if (entry.list() == null) {
            throw new IllegalStateException("Value at " + key + " is not a list");
        }
        return entry.list();
    }

    @Override
    public long listLength(String key) {
        return listRange(key).size();
    }

    @Override
    public long listRemove(String key, String value) {
        var removed = new AtomicBoolean(false);
        long now = clock.millis();
        entries.computeIfPresent(key, (k, existing) -> {
            if (existing.expired(now)) {
                return null;
            }
            if (existing.list() == null) {
                return existing;
            }
            List<String> list = new ArrayList<>(existing.list());
            removed.set(list.remove(value));
            if (list.isEmpty()) {
                return null;
            }
            return new Entry(null, List.copyOf(list), existing.expiresAtMillis());
        });
        return removed.get() ? 1 : 0;
    }

    @Override
    public boolean ping() {
        return true;
    }

    private Entry live(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.expired(clock.millis())) {
            entries.remove(key, entry);
            return null;
        }
        return entry;
    }

    private long expiry(Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return 0;
        }
        return clock.millis() + ttl.toMillis();
    }

    static Pattern globToRegex(String glob) {
        var sb = new StringBuilder();
        for (char c : glob.toCharArray()) {
            switch (c) {
                case '*' -> sb.append(".*");
                case '?' -> sb.append('.');
                default -> sb.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(sb.toString());
    }
}
