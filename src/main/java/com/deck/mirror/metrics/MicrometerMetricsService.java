package com.deck.mirror.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code deck.cache.hit} / {@code deck.cache.miss} - Counter (tag: domain)</li>
 *   <li>{@code deck.llm.duration} - Timer (tags: operation, outcome)</li>
 *   <li>{@code deck.remote.mutation} - Counter (tag: kind)</li>
 *   <li>{@code deck.candidate.pairs} - DistributionSummary</li>
 *   <li>{@code deck.window.size} - DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary candidatePairsSummary;
    private final DistributionSummary windowSizeSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.candidatePairsSummary = DistributionSummary.builder("deck.candidate.pairs")
                .description("Candidate near-duplicate pairs per dedupe run")
                .register(registry);
        this.windowSizeSummary = DistributionSummary.builder("deck.window.size")
                .description("Requests issued per concurrent window")
                .register(registry);
    }

    @Override
    public void recordCacheHit(String domain) {
        counter("deck.cache.hit", "domain", domain, "Content cache hits").increment();
    }

    @Override
    public void recordCacheMiss(String domain) {
        counter("deck.cache.miss", "domain", domain, "Content cache misses").increment();
    }

    @Override
    public void recordLlmCall(String operation, boolean success, Duration duration) {
        String outcome = success ? "success" : "failure";
        String key = operation + ":" + outcome;
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("deck.llm.duration")
                        .description("Duration of LLM and embedding provider calls")
                        .tag("operation", operation)
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementRemoteMutation(String kind) {
        counter("deck.remote.mutation", "kind", kind, "Mutations applied to the remote card service").increment();
    }

    @Override
    public void recordCandidatePairs(int count) {
        candidatePairsSummary.record(count);
    }

    @Override
    public void recordWindowSize(int size) {
        windowSizeSummary.record(size);
    }

    private Counter counter(String name, String tagKey, String tagValue, String description) {
        return counterCache.computeIfAbsent(name + ":" + tagValue, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
