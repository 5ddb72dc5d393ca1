package com.deck.mirror.metrics;

import java.time.Duration;

/**
 * Interface for recording operational metrics.
 * The default {@link NoOpMetricsService} does nothing, so components work
 * without any registry configured.
 */
public interface MetricsService {

    void recordCacheHit(String domain);

    void recordCacheMiss(String domain);

    void recordLlmCall(String operation, boolean success, Duration duration);

    void incrementRemoteMutation(String kind);

    void recordCandidatePairs(int count);

    void recordWindowSize(int size);
}
