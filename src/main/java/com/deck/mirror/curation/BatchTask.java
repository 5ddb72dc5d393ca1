package com.deck.mirror.curation;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * One request in a windowed batch, identified by its key. Results are correlated
 * back to requests through this key, never through completion order.
 */
public record BatchTask<R>(String key, Supplier<R> work) {

    public BatchTask {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(work, "work is required");
    }
}
