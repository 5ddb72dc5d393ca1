package com.deck.mirror.reconcile;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of pulling one deck.
 *
 * @param file      the local deck file
 * @param cards     cards written to the file
 * @param merged    true when an existing file was merged rather than created
 * @param aborted   true when the user declined to write
 * @param conflicts conflicts kept in favour of the local side
 */
public record PullReport(Path file, int cards, boolean merged, boolean aborted, List<MergeConflict> conflicts) {

    public PullReport {
        conflicts = List.copyOf(conflicts);
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }
}
