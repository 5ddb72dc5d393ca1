package com.deck.mirror.metrics;

import java.time.Duration;

/**
 * No-op metrics implementation used when no registry is configured.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordCacheHit(String domain) {
    }

    @Override
    public void recordCacheMiss(String domain) {
    }

    @Override
    public void recordLlmCall(String operation, boolean success, Duration duration) {
    }

    @Override
    public void incrementRemoteMutation(String kind) {
    }

    @Override
    public void recordCandidatePairs(int count) {
    }

    @Override
    public void recordWindowSize(int size) {
    }
}
