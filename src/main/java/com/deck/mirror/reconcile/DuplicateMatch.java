package com.deck.mirror.reconcile;

import com.deck.mirror.core.model.Card;

/**
 * A local card without an id whose content hash equals an existing remote card.
 */
public record DuplicateMatch(Card localCard, String remoteCardId) {
}
