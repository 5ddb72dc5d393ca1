package com.deck.mirror.curation;

import java.nio.file.Path;

/**
 * Outcome of a dedupe run.
 *
 * @param candidatePairs pairs above the similarity threshold
 * @param complementary  pairs the model judged complementary, skipped without review
 * @param removed        cards removed from the file
 */
public record DedupeReport(Path file, Status status, int cards, int candidatePairs, int complementary, int removed) {

    public enum Status {
        NOT_ENOUGH_CARDS,
        NO_CANDIDATES,
        NO_CHANGES,
        ABORTED,
        WRITTEN
    }

    static DedupeReport of(Path file, Status status, int cards) {
        return new DedupeReport(file, status, cards, 0, 0, 0);
    }
}
