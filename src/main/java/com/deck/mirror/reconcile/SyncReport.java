package com.deck.mirror.reconcile;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a push or sync of one deck file.
 *
 * @param file          the deck file, after any rename
 * @param deckId        the remote deck id
 * @param status        how the run ended
 * @param created       cards created remotely
 * @param updated       cards updated remotely
 * @param deletedRemote cards deleted remotely
 * @param deletedLocal  cards removed from the local file
 * @param duplicates    id-less cards whose content already exists remotely
 */
public record SyncReport(
        Path file,
        String deckId,
        Status status,
        int created,
        int updated,
        int deletedRemote,
        int deletedLocal,
        List<DuplicateMatch> duplicates
) {
    public enum Status {
        APPLIED,
        UP_TO_DATE,
        ABORTED,
        BLOCKED_BY_DUPLICATES,
        /** The file failed validation or a remote call; only reported by batch push. */
        FAILED
    }

    public SyncReport {
        duplicates = List.copyOf(duplicates);
    }

    static SyncReport withoutChanges(Path file, String deckId, Status status, List<DuplicateMatch> duplicates) {
        return new SyncReport(file, deckId, status, 0, 0, 0, 0, duplicates);
    }

    public boolean isApplied() {
        return status == Status.APPLIED;
    }
}
