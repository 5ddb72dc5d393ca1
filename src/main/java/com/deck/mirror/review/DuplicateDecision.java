package com.deck.mirror.review;

/**
 * Decision on a duplicate candidate pair.
 */
public enum DuplicateDecision {
    /** Keep the first card, remove the second. */
    KEEP_FIRST,
    /** Keep the second card, remove the first. */
    KEEP_SECOND,
    KEEP_BOTH,
    SKIP,
    /** Stop and discard every decision; nothing is written. */
    ABORT
}
