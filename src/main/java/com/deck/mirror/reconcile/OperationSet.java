package com.deck.mirror.reconcile;

import com.deck.mirror.core.model.Card;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Result of reconciling a local deck against the remote deck.
 *
 * <p>The four operation lists are disjoint: a card appears in at most one of them.
 * Duplicate candidates are reported separately and are never part of {@code toCreate}.</p>
 *
 * @param toCreate       local cards without an id to create remotely
 * @param toUpdate       local cards whose content differs from their remote copy
 * @param toDeleteRemote remote cards no longer present locally
 * @param toDeleteLocal  local cards whose remote copy was deleted (sync only)
 * @param duplicates     id-less local cards whose content already exists remotely
 */
public record OperationSet(
        List<Card> toCreate,
        List<Card> toUpdate,
        List<Card> toDeleteRemote,
        List<Card> toDeleteLocal,
        List<DuplicateMatch> duplicates
) {
    public OperationSet {
        toCreate = List.copyOf(toCreate);
        toUpdate = List.copyOf(toUpdate);
        toDeleteRemote = List.copyOf(toDeleteRemote);
        toDeleteLocal = List.copyOf(toDeleteLocal);
        duplicates = List.copyOf(duplicates);
        checkDisjoint(toCreate, toUpdate, toDeleteRemote, toDeleteLocal);
    }

    public static OperationSet empty() {
        return new OperationSet(List.of(), List.of(), List.of(), List.of(), List.of());
    }

    /**
     * True when nothing would be mutated on either side.
     */
    public boolean isEmpty() {
        return toCreate.isEmpty() && toUpdate.isEmpty() && toDeleteRemote.isEmpty() && toDeleteLocal.isEmpty();
    }

    public boolean hasDuplicates() {
        return !duplicates.isEmpty();
    }

    public int mutationCount() {
        return toCreate.size() + toUpdate.size() + toDeleteRemote.size() + toDeleteLocal.size();
    }

    private static void checkDisjoint(List<Card> toCreate, List<Card> toUpdate,
                                      List<Card> toDeleteRemote, List<Card> toDeleteLocal) {
        for (Card card : toCreate) {
            if (card.hasId()) {
                throw new IllegalStateException("Card to create already has id " + card.id());
            }
        }
        Set<String> seen = new HashSet<>();
        for (List<Card> group : List.of(toUpdate, toDeleteRemote, toDeleteLocal)) {
            for (Card card : group) {
                if (!card.hasId()) {
                    throw new IllegalStateException("Card without id in an id-based operation");
                }
                if (!seen.add(card.id())) {
                    throw new IllegalStateException("Card " + card.id() + " appears in more than one operation");
                }
            }
        }
    }

    @Override
    public String toString() {
        return "OperationSet{" +
                "create=" + toCreate.size() +
                ", update=" + toUpdate.size() +
                ", deleteRemote=" + toDeleteRemote.size() +
                ", deleteLocal=" + toDeleteLocal.size() +
                ", duplicates=" + duplicates.size() +
                '}';
    }
}
