package com.deck.mirror.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordCacheHit("embeddings");
                noOp.recordCacheMiss("embeddings");
                noOp.recordLlmCall("complete", true, Duration.ofMillis(10));
                noOp.incrementRemoteMutation("create");
                noOp.recordCandidatePairs(3);
                noOp.recordWindowSize(10);
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should count cache hits and misses per domain")
        void cacheCounters() {
            metrics.recordCacheHit("embeddings");
            metrics.recordCacheHit("embeddings");
            metrics.recordCacheMiss("gradings");

            Counter hits = registry.find("deck.cache.hit").tag("domain", "embeddings").counter();
            Counter misses = registry.find("deck.cache.miss").tag("domain", "gradings").counter();

            assertNotNull(hits);
            assertEquals(2.0, hits.count());
            assertNotNull(misses);
            assertEquals(1.0, misses.count());
        }

        @Test
        @DisplayName("Should time LLM calls by operation and outcome")
        void llmTimer() {
            metrics.recordLlmCall("complete", true, Duration.ofMillis(100));
            metrics.recordLlmCall("complete", true, Duration.ofMillis(300));
            metrics.recordLlmCall("embed", false, Duration.ofMillis(50));

            Timer success = registry.find("deck.llm.duration")
                    .tag("operation", "complete")
                    .tag("outcome", "success")
                    .timer();
            Timer failure = registry.find("deck.llm.duration")
                    .tag("operation", "embed")
                    .tag("outcome", "failure")
                    .timer();

            assertNotNull(success);
            assertEquals(2, success.count());
            assertNotNull(failure);
            assertEquals(1, failure.count());
        }

        @Test
        @DisplayName("Should count remote mutations by kind")
        void remoteMutations() {
            metrics.incrementRemoteMutation("create");
            metrics.incrementRemoteMutation("delete");
            metrics.incrementRemoteMutation("create");

            assertEquals(2.0, registry.find("deck.remote.mutation").tag("kind", "create").counter().count());
            assertEquals(1.0, registry.find("deck.remote.mutation").tag("kind", "delete").counter().count());
        }

        @Test
        @DisplayName("Should summarize candidate pairs and window sizes")
        void summaries() {
            metrics.recordCandidatePairs(4);
            metrics.recordWindowSize(10);
            metrics.recordWindowSize(3);

            DistributionSummary pairs = registry.find("deck.candidate.pairs").summary();
            DistributionSummary windows = registry.find("deck.window.size").summary();

            assertNotNull(pairs);
            assertEquals(4.0, pairs.totalAmount());
            assertNotNull(windows);
            assertEquals(2, windows.count());
            assertEquals(10.0, windows.max());
        }
    }
}
