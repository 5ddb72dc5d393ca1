package com.deck.mirror.core.model;

import java.util.Objects;

/**
 * Reference to a deck: remote id (null while the deck does not exist remotely) and name.
 */
public record DeckRef(String deckId, String deckName) {

    public DeckRef {
        Objects.requireNonNull(deckName, "deckName is required");
    }

    public boolean isCreated() {
        return deckId != null;
    }
}
