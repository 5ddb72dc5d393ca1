package com.deck.mirror.curation;

import java.nio.file.Path;

/**
 * Outcome of a curate run.
 *
 * @param graded         cards graded successfully
 * @param failed         cards whose grading request failed
 * @param belowThreshold cards scoring under the quality threshold
 * @param averageScore   mean score of successfully graded cards, 0 when none
 */
public record CurationReport(
        Path file,
        Status status,
        int cards,
        int graded,
        int failed,
        int belowThreshold,
        int rewritten,
        int deleted,
        double averageScore
) {
    public enum Status {
        EMPTY,
        ALL_ABOVE_THRESHOLD,
        NO_CHANGES,
        ABORTED,
        WRITTEN
    }
}
