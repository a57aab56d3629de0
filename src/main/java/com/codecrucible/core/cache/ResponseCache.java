package com.codecrucible.core.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory TTL cache for successful backend responses.
 *
 * Eviction is TTL only: an expired entry is removed when it is next read,
 * and every write sweeps all expired entries.
 * Only non-null values are stored; callers never put failures here.
 */
@Component
public class ResponseCache {

    private static final Logger log = LoggerFactory.getLogger(ResponseCache.class);

    private final ConcurrentHashMap<String, Entry> cache = new ConcurrentHashMap<>();
    private final Clock clock;

    public ResponseCache(Clock clock) {
        this.clock = clock;
    }

    public Optional<String> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        Entry entry = cache.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            cache.remove(key, entry);
            log.debug("[Cache] Expired entry evicted: {}", key);
            return Optional.empty();
        }
        return Optional.of(entry.value);
    }

    public void put(String key, String value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return;
        }
        Instant now = clock.instant();
        cache.put(key, new Entry(value, now.plus(ttl)));
        purgeExpired(now);
    }

    /** Entries currently held, including expired ones not yet swept. */
    public int size() {
        return cache.size();
    }

    public void clear() {
        cache.clear();
        log.debug("[Cache] Cleared");
    }

    private void purgeExpired(Instant now) {
        cache.forEach((key, entry) -> {
            if (entry.isExpired(now)) {
                cache.remove(key, entry);
            }
        });
    }

    private static final class Entry {
        final String  value;
        final Instant expiresAt;

        Entry(String value, Instant expiresAt) {
            this.value     = value;
            this.expiresAt = expiresAt;
        }

        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
