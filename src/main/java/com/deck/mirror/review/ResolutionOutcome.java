package com.deck.mirror.review;

import com.deck.mirror.core.model.Card;
import com.deck.mirror.core.model.CardImprovement;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decisions collected by the {@link InteractiveResolver}.
 *
 * @param removed  indices of cards to remove
 * @param rewrites accepted rewrites keyed by card index
 * @param aborted  true when the user quit or declined; nothing may be written
 */
public record ResolutionOutcome(Set<Integer> removed, Map<Integer, CardImprovement> rewrites, boolean aborted) {

    public ResolutionOutcome {
        removed = Set.copyOf(removed);
        rewrites = Map.copyOf(rewrites);
    }

    public static ResolutionOutcome abort() {
        return new ResolutionOutcome(Set.of(), Map.of(), true);
    }

    public boolean hasChanges() {
        return !aborted && (!removed.isEmpty() || !rewrites.isEmpty());
    }

    /**
     * Applies the decisions, keeping the remaining cards in their original order.
     */
    public List<Card> applyTo(List<Card> cards) {
        if (aborted) {
            throw new IllegalStateException("Cannot apply an aborted resolution");
        }
        List<Card> result = new ArrayList<>(cards.size() - removed.size());
        for (int i = 0; i < cards.size(); i++) {
            if (removed.contains(i)) {
                continue;
            }
            CardImprovement rewrite = rewrites.get(i);
            result.add(rewrite != null ? rewrite.applyTo(cards.get(i)) : cards.get(i));
        }
        return result;
    }
}
