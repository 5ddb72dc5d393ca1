package com.deck.mirror.remote;

import com.deck.mirror.core.model.Card;

import java.util.List;
import java.util.Map;

/**
 * Optional card fields sent on create and update.
 *
 * <ul>
 *   <li>{@code tags} - sent as {@code tags} only when non-empty</li>
 *   <li>{@code archived} - sent as {@code archived?} only when true</li>
 * </ul>
 */
public record CardOptions(List<String> tags, boolean archived) {

    public CardOptions {
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    public static CardOptions none() {
        return new CardOptions(List.of(), false);
    }

    public static CardOptions from(Card card) {
        return new CardOptions(List.copyOf(card.tags()), card.archived());
    }

    /**
     * Adds the recognized fields to a request body.
     */
    void applyTo(Map<String, Object> body) {
        if (!tags.isEmpty()) {
            body.put("tags", tags);
        }
        if (archived) {
            body.put("archived?", true);
        }
    }
}
