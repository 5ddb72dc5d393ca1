package com.deck.mirror.cache;

import com.deck.mirror.metrics.MetricsService;
import com.deck.mirror.metrics.NoOpMetricsService;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Caffeine-backed content cache persisted as a flat key to value JSON document.
 *
 * <p>The whole file is loaded when the cache is opened and rewritten on {@link #flush()}.
 * Entries are never evicted, so a flush writes back everything that was loaded.
 * An unreadable file leaves the cache empty; an unwritable file drops the write.
 * Both are logged at WARN and never fail the caller.</p>
 */
public class JsonFileContentCache<V> implements ContentCache<V> {
    private static final Logger log = LoggerFactory.getLogger(JsonFileContentCache.class);

    private final String domain;
    private final Path file;
    private final ObjectMapper objectMapper;
    private final JavaType mapType;
    private final MetricsService metricsService;
    private final Cache<String, V> cache;
    private boolean dirty;

    public JsonFileContentCache(String domain, Path file, Class<V> valueType,
                                ObjectMapper objectMapper) {
        this(domain, file, valueType, objectMapper, new NoOpMetricsService());
    }

    public JsonFileContentCache(String domain, Path file, Class<V> valueType,
                                ObjectMapper objectMapper, MetricsService metricsService) {
        this.domain = domain;
        this.file = file;
        this.objectMapper = objectMapper;
        this.mapType = objectMapper.getTypeFactory().constructMapType(LinkedHashMap.class, String.class, valueType);
        this.metricsService = metricsService;
        // Unbounded: flush rewrites the file from this map, so an evicted entry would be lost on disk.
        this.cache = Caffeine.newBuilder()
                .recordStats()
                .build();

        try {
            Map<String, V> persisted = readFile();
            cache.putAll(persisted);
            log.debug("cache.loaded domain={} entries={} file={}", domain, persisted.size(), file);
        } catch (CacheIOException e) {
            log.warn("cache.load_failed domain={} file={} error={} - starting empty",
                    domain, file, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        }
    }

    @Override
    public Optional<V> get(String key) {
        V value = cache.getIfPresent(key);
        if (value != null) {
            metricsService.recordCacheHit(domain);
        } else {
            metricsService.recordCacheMiss(domain);
        }
        return Optional.ofNullable(value);
    }

    @Override
    public void put(String key, V value) {
        if (value == null) {
            return;
        }
        V existing = cache.asMap().putIfAbsent(key, value);
        if (existing == null) {
            dirty = true;
        }
    }

    @Override
    public void flush() {
        if (!dirty) {
            return;
        }
        try {
            writeFile(new TreeMap<>(cache.asMap()));
            dirty = false;
            log.debug("cache.flushed domain={} entries={}", domain, cache.estimatedSize());
        } catch (CacheIOException e) {
            log.warn("cache.flush_failed domain={} file={} error={} - write dropped",
                    domain, file, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        }
    }

    @Override
    public String domain() {
        return domain;
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(caffeineStats.hitCount(), caffeineStats.missCount(), cache.estimatedSize());
    }

    private Map<String, V> readFile() {
        if (!Files.exists(file)) {
            return Map.of();
        }
        try {
            Map<String, V> values = objectMapper.readValue(file.toFile(), mapType);
            return values != null ? values : Map.of();
        } catch (IOException | RuntimeException e) {
            throw new CacheIOException("Cannot read cache file " + file, e);
        }
    }

    private void writeFile(Map<String, V> entries) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path tmp = Files.createTempFile(parent, "." + domain + "-", ".tmp");
            try {
                objectMapper.writeValue(tmp.toFile(), entries);
                try {
                    Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException | RuntimeException e) {
            throw new CacheIOException("Cannot write cache file " + file, e);
        }
    }
}
