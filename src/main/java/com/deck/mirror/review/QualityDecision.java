package com.deck.mirror.review;

/**
 * Decision on a low-scoring card.
 */
public enum QualityDecision {
    /** Replace the card with the proposed rewrite. */
    ACCEPT,
    KEEP,
    DELETE,
    SKIP,
    /** Stop and discard every decision; nothing is written. */
    QUIT
}
