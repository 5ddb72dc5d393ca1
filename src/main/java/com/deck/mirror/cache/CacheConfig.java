package com.deck.mirror.cache;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Configuration for the persisted content caches.
 *
 * <p>Each domain keeps every entry of its file in memory for the lifetime of the run.</p>
 *
 * @param directory directory holding one JSON file per cache domain
 * @param enabled   whether caching is enabled
 */
public record CacheConfig(Path directory, boolean enabled) {

    public CacheConfig {
        Objects.requireNonNull(directory, "directory is required");
    }

    /**
     * Enabled cache configuration rooted at {@code directory}.
     */
    public static CacheConfig defaults(Path directory) {
        return new CacheConfig(directory, true);
    }

    /**
     * Disabled cache configuration.
     */
    public static CacheConfig disabled() {
        return new CacheConfig(Path.of("."), false);
    }
}
