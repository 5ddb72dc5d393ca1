package com.deck.mirror.curation;

/**
 * Callback interface for tracking progress of batched model requests.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * Called after each window completes.
     *
     * @param processed the number of requests finished so far
     * @param total     the total number of requests
     * @param message   optional progress message
     */
    void onProgress(long processed, long total, String message);

    /**
     * A no-op progress callback.
     */
    ProgressCallback NOOP = (processed, total, message) -> {};
}
