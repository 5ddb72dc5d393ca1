package com.deck.mirror.cache;

import com.deck.mirror.core.model.Classification;
import com.deck.mirror.core.model.PairClassification;
import com.deck.mirror.core.model.QualityGrade;
import com.deck.mirror.metrics.MicrometerMetricsService;
import com.deck.mirror.metrics.NoOpMetricsService;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileContentCacheTest {

    @TempDir
    Path dir;

    private final ObjectMapper mapper = new ObjectMapper();

    private JsonFileContentCache<PairClassification> classifications(Path file) {
        return new JsonFileContentCache<>("classifications", file, PairClassification.class,
                mapper);
    }

    @Nested
    @DisplayName("In-memory behavior")
    class MemoryTests {

        @Test
        @DisplayName("Should return empty on a miss and the value on a hit")
        void testGetPut() {
            var cache = classifications(dir.resolve("c.json"));
            assertTrue(cache.get("k").isEmpty());

            cache.put("k", new PairClassification(Classification.DUPLICATE, "same"));

            assertEquals(Optional.of(new PairClassification(Classification.DUPLICATE, "same")), cache.get("k"));
            CacheStats stats = cache.getStats();
            assertEquals(1, stats.hitCount());
            assertEquals(1, stats.missCount());
            assertEquals(0.5, stats.hitRate());
        }

        @Test
        @DisplayName("Should keep the first value written for a key")
        void testFirstWriteWins() {
            var cache = classifications(dir.resolve("c.json"));
            cache.put("k", new PairClassification(Classification.DUPLICATE, "first"));
            cache.put("k", new PairClassification(Classification.COMPLEMENTARY, "second"));

            assertEquals("first", cache.get("k").orElseThrow().reasoning());
        }

        @Test
        @DisplayName("Should report hits and misses to the metrics service")
        void testMetrics() {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            var cache = new JsonFileContentCache<>("gradings", dir.resolve("g.json"), QualityGrade.class,
                    mapper, new MicrometerMetricsService(registry));

            cache.get("missing");
            cache.put("k", QualityGrade.of(8, "good"));
            cache.get("k");

            assertEquals(1.0, registry.find("deck.cache.hit").tag("domain", "gradings").counter().count());
            assertEquals(1.0, registry.find("deck.cache.miss").tag("domain", "gradings").counter().count());
        }
    }

    @Nested
    @DisplayName("Persistence")
    class PersistenceTests {

        @Test
        @DisplayName("Should survive a flush and reopen")
        void testReopen() {
            Path file = dir.resolve("classifications.json");
            var cache = classifications(file);
            cache.put("k1", new PairClassification(Classification.COMPLEMENTARY, "different angles"));
            cache.flush();

            var reopened = classifications(file);

            assertEquals(Classification.COMPLEMENTARY, reopened.get("k1").orElseThrow().classification());
        }

        @Test
        @DisplayName("Should persist float vectors")
        void testEmbeddings() {
            Path file = dir.resolve("embeddings.json");
            var cache = new JsonFileContentCache<>("embeddings", file, float[].class, mapper);
            cache.put("k", new float[]{0.25f, -1.0f});
            cache.flush();

            var reopened = new JsonFileContentCache<>("embeddings", file, float[].class, mapper);

            assertArrayEquals(new float[]{0.25f, -1.0f}, reopened.get("k").orElseThrow());
        }

        @Test
        @DisplayName("Should keep every loaded entry across repeated flushes")
        void testLargeFileSurvivesFlushes() {
            Path file = dir.resolve("classifications.json");
            var cache = classifications(file);
            for (int i = 0; i < 5_000; i++) {
                cache.put("k" + i, PairClassification.unclear("r" + i));
            }
            cache.flush();

            var second = classifications(file);
            second.put("extra", new PairClassification(Classification.DUPLICATE, "new"));
            second.flush();

            var reopened = classifications(file);
            for (int i = 0; i < 5_000; i++) {
                assertEquals("r" + i, reopened.get("k" + i).orElseThrow().reasoning(), "k" + i);
            }
            assertTrue(reopened.get("extra").isPresent());
            assertEquals(5_001, reopened.getStats().size());
        }

        @Test
        @DisplayName("Should not write the file when nothing changed")
        void testNoDirtyFlush() {
            Path file = dir.resolve("c.json");
            classifications(file).flush();
            assertFalse(Files.exists(file));
        }

        @Test
        @DisplayName("Should start empty when the file is corrupt")
        void testCorruptFile() throws Exception {
            Path file = Files.writeString(dir.resolve("c.json"), "{ not json");

            var cache = classifications(file);

            assertTrue(cache.get("k").isEmpty());
            cache.put("k", PairClassification.unclear("x"));
            cache.flush();
            assertTrue(classifications(file).get("k").isPresent());
        }

        @Test
        @DisplayName("Should drop writes it cannot persist without failing")
        void testUnwritable() throws Exception {
            Path blocker = Files.writeString(dir.resolve("blocker"), "file, not a directory");
            var cache = classifications(blocker.resolve("c.json"));
            cache.put("k", PairClassification.unclear("x"));

            assertDoesNotThrow(cache::flush);
            assertTrue(cache.get("k").isPresent());
        }
    }

    @Test
    @DisplayName("Disabled caches never hold values")
    void testDisabled() {
        try (CurationCaches caches = CurationCaches.open(CacheConfig.disabled(), new NoOpMetricsService())) {
            caches.gradings().put("k", QualityGrade.of(9, "fine"));
            assertTrue(caches.gradings().get("k").isEmpty());
            assertEquals("gradings", caches.gradings().domain());
        }
    }
}
