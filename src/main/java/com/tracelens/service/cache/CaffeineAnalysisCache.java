package com.tracelens.service.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Caffeine-backed cache. Each entry remembers its own time-to-live; eviction is lazy on access
 * plus Caffeine's maintenance cycle.
 */
@Slf4j
public class CaffeineAnalysisCache<K, V> implements AnalysisCache<K, V> {

    private final Cache<K, Entry<V>> cache;
    private final Duration defaultTtl;

    public CaffeineAnalysisCache(Duration defaultTtl, long maximumSize) {
        this(defaultTtl, maximumSize, Ticker.systemTicker(), null);
    }

    CaffeineAnalysisCache(Duration defaultTtl, long maximumSize, Ticker ticker, Executor executor) {
        this.defaultTtl = defaultTtl;
        Caffeine<Object, Object> builder = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .ticker(ticker)
                .recordStats();
        if (executor != null) {
            builder.executor(executor);
        }
        this.cache = builder.expireAfter(new Expiry<K, Entry<V>>() {
            @Override
            public long expireAfterCreate(K key, Entry<V> entry, long currentTime) {
                return entry.ttl.toNanos();
            }

            @Override
            public long expireAfterUpdate(K key, Entry<V> entry, long currentTime, long currentDuration) {
                return entry.ttl.toNanos();
            }

            @Override
            public long expireAfterRead(K key, Entry<V> entry, long currentTime, long currentDuration) {
                return currentDuration;
            }
        }).build();
        log.info("Analysis cache initialized: ttl={}, maximumSize={}", defaultTtl, maximumSize);
    }

    @Override
    public Optional<V> get(K key) {
        Entry<V> entry = cache.getIfPresent(key);
        return entry != null ? Optional.of(entry.value) : Optional.empty();
    }

    @Override
    public void put(K key, V value, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
        cache.put(key, new Entry<>(value, ttl));
    }

    @Override
    public void put(K key, V value) {
        put(key, value, defaultTtl);
    }

    @Override
    public void invalidate(K key) {
        cache.invalidate(key);
    }

    @Override
    public void clear() {
        cache.invalidateAll();
    }

    @Override
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public CacheStats stats() {
        return cache.stats();
    }

    private static final class Entry<V> {
        final V value;
        final Duration ttl;

        Entry(V value, Duration ttl) {
            this.value = value;
            this.ttl = ttl;
        }
    }
}
