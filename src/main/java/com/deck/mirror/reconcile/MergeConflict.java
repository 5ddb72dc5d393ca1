package com.deck.mirror.reconcile;

import com.deck.mirror.core.model.Card;

/**
 * A card edited on both sides during a three-way merge. The local version always wins;
 * the conflict is reported so the user can review the remote edit.
 *
 * @param cardId remote id of the card
 * @param kind   what diverged
 * @param local  the local version that was kept
 * @param remote the remote version that was discarded, null when it was deleted remotely
 */
public record MergeConflict(String cardId, Kind kind, Card local, Card remote) {

    public enum Kind {
        /** Local and remote both changed the card since the base snapshot. */
        BOTH_CHANGED,

        /** No base snapshot entry and the two sides differ. */
        NO_COMMON_BASE,

        /** Changed locally but deleted remotely. The local card is kept as a new card. */
        MODIFIED_LOCALLY_DELETED_REMOTELY
    }
}
