package com.deck.mirror.reconcile;

import com.deck.mirror.core.model.Card;

import java.util.List;

/**
 * Result of a three-way merge.
 *
 * @param merged         the new local deck
 * @param newBase        the new base snapshot (the freshly fetched remote deck)
 * @param conflicts      conflicts resolved in favour of the local side
 * @param acceptedRemote cards whose remote version replaced the local one
 * @param addedRemote    cards new on the remote side
 * @param droppedLocally remote cards dropped because they were deleted locally
 * @param droppedRemotely local cards dropped because they were deleted remotely
 */
public record MergeOutcome(
        List<Card> merged,
        List<Card> newBase,
        List<MergeConflict> conflicts,
        int acceptedRemote,
        int addedRemote,
        int droppedLocally,
        int droppedRemotely
) {
    public MergeOutcome {
        merged = List.copyOf(merged);
        newBase = List.copyOf(newBase);
        conflicts = List.copyOf(conflicts);
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }
}
