package com.deck.mirror.cache;

import java.util.Optional;

/**
 * No-op cache implementation. All operations are no-ops.
 * Used when caching is disabled.
 */
public class NoOpContentCache<V> implements ContentCache<V> {

    private final String domain;

    public NoOpContentCache(String domain) {
        this.domain = domain;
    }

    @Override
    public Optional<V> get(String key) {
        return Optional.empty();
    }

    @Override
    public void put(String key, V value) {
        // no-op
    }

    @Override
    public void flush() {
        // no-op
    }

    @Override
    public String domain() {
        return domain;
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
