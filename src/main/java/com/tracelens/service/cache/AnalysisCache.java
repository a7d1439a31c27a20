package com.tracelens.service.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Bounded cache of analysis results with per-entry expiry. A miss only means the result is recomputed.
 */
public interface AnalysisCache<K, V> {

    Optional<V> get(K key);

    void put(K key, V value, Duration ttl);

    /**
     * Stores the value with the cache's default time-to-live.
     */
    void put(K key, V value);

    void invalidate(K key);

    void clear();

    long size();
}
