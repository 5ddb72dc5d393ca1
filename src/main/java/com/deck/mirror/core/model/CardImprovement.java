package com.deck.mirror.core.model;

import java.util.Objects;

/**
 * Rewritten question/answer proposed for a low-scoring card.
 */
public record CardImprovement(String question, String answer) {

    public CardImprovement {
        Objects.requireNonNull(question, "question is required");
        Objects.requireNonNull(answer, "answer is required");
    }

    /**
     * Applies the rewrite to a card, keeping its id, tags and archived flag.
     */
    public Card applyTo(Card card) {
        return card.withContent(question, answer);
    }
}
