package com.tracelens.service.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Cache that never holds anything, used when caching is switched off.
 */
public class NoOpAnalysisCache<K, V> implements AnalysisCache<K, V> {

    @Override
    public Optional<V> get(K key) {
        return Optional.empty();
    }

    @Override
    public void put(K key, V value, Duration ttl) {
        // nothing to store
    }

    @Override
    public void put(K key, V value) {
        // nothing to store
    }

    @Override
    public void invalidate(K key) {
        // nothing to invalidate
    }

    @Override
    public void clear() {
        // nothing to clear
    }

    @Override
    public long size() {
        return 0;
    }
}
