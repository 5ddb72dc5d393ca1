package com.deck.mirror.reconcile;

import com.deck.mirror.core.model.Card;

import java.util.List;

/**
 * Raised by push when local cards carry remote ids that the remote deck no longer has.
 * Push never reconciles remote deletions; the caller must run sync instead.
 */
public class InconsistencyException extends RuntimeException {

    private final List<Card> missingCards;

    public InconsistencyException(List<Card> missingCards) {
        super("Push failed: " + missingCards.size() + " local card(s) not found remotely");
        this.missingCards = List.copyOf(missingCards);
    }

    public List<Card> getMissingCards() {
        return missingCards;
    }
}
