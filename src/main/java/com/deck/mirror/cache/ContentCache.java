package com.deck.mirror.cache;

import java.util.Optional;

/**
 * Content-addressed key/value store for expensive model results.
 * Keys come from {@link CacheKeys#derive}; entries are immutable once written.
 *
 * @param <V> cached value type
 */
public interface ContentCache<V> {

    /**
     * Gets a cached value.
     *
     * @param key content-addressed key
     * @return the cached value, or empty on a miss
     */
    Optional<V> get(String key);

    /**
     * Stores a value. A key that is already present keeps its first value.
     */
    void put(String key, V value);

    /**
     * Persists pending writes. Failures are logged, never thrown.
     */
    void flush();

    /**
     * Name of the cache domain (embeddings, classifications, gradings).
     */
    String domain();

    /**
     * Returns cache statistics.
     */
    CacheStats getStats();
}
