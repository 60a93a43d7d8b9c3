package com.scanq.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

/**
 * Caffeine-backed key/value cache with a per-entry TTL, timed by the injected {@link Clock}. An
 * entry is served up to and including its expiry instant. Concurrent misses on the same key may
 * both invoke the fetch function of {@link #getOrSet(String, Callable, long)}; the last write wins.
 */
@Component
public class ResultCache {

    private static final Logger log = LoggerFactory.getLogger(ResultCache.class);

    private final Cache<String, CacheEntry> store;

    public ResultCache(Clock clock) {
        this.store = Caffeine.newBuilder()
                .expireAfter(new PerEntryExpiry())
                .ticker(clockTicker(clock))
                .executor(Runnable::run)
                .recordStats()
                .build();
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<T> get(String key) {
        CacheEntry entry = store.getIfPresent(key);
        if (entry == null) {
            log.debug("Cache MISS: {}", key);
            return Optional.empty();
        }
        log.debug("Cache HIT: {}", key);
        return Optional.ofNullable((T) entry.value());
    }

    public void set(String key, Object value, long ttlSeconds) {
        if (key == null) {
            throw new IllegalArgumentException("Cache key must not be null");
        }
        if (ttlSeconds < 0) {
            throw new IllegalArgumentException("ttlSeconds must be >= 0");
        }
        // Caffeine expires once the deadline is reached; the entry stays readable at the deadline itself
        long ttlNanos = TimeUnit.SECONDS.toNanos(ttlSeconds);
        store.put(key, new CacheEntry(value, ttlNanos == Long.MAX_VALUE ? ttlNanos : ttlNanos + 1));
        log.debug("Cache SET: {} (ttl {}s)", key, ttlSeconds);
    }

    public <T> T getOrSet(String key, Callable<T> fetch, long ttlSeconds) throws Exception {
        Optional<T> cached = get(key);
        if (cached.isPresent()) {
            return cached.get();
        }
        T value = fetch.call();
        set(key, value, ttlSeconds);
        return value;
    }

    public void delete(String key) {
        store.invalidate(key);
        log.debug("Cache DELETE: {}", key);
    }

    public void clear() {
        store.invalidateAll();
        log.info("Cache cleared");
    }

    public int size() {
        store.cleanUp();
        return (int) store.estimatedSize();
    }

    public long hitCount() {
        return store.stats().hitCount();
    }

    public long missCount() {
        return store.stats().missCount();
    }

    public CacheStats getStats() {
        store.cleanUp();
        List<String> keys = List.copyOf(store.asMap().keySet());
        return new CacheStats(keys.size(), keys, hitCount(), missCount());
    }

    private static Ticker clockTicker(Clock clock) {
        return () -> {
            Instant now = clock.instant();
            return TimeUnit.SECONDS.toNanos(now.getEpochSecond()) + now.getNano();
        };
    }

    private record CacheEntry(Object value, long ttlNanos) {
    }

    private static final class PerEntryExpiry implements Expiry<String, CacheEntry> {

        @Override
        public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
