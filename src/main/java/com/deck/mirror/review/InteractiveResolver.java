package com.deck.mirror.review;

import com.deck.mirror.core.model.Card;
import com.deck.mirror.core.model.CardImprovement;
import com.deck.mirror.core.model.ClassifiedPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Walks review cases through a {@link DecisionSource} and collects the decisions.
 * It never writes anything itself; an aborted outcome must leave the deck untouched.
 */
public class InteractiveResolver {
    private static final Logger log = LoggerFactory.getLogger(InteractiveResolver.class);

    private static final int SUMMARY_PREVIEW = 60;

    private final DecisionSource decisions;

    public InteractiveResolver(DecisionSource decisions) {
        this.decisions = decisions;
    }

    /**
     * Resolves classified pairs. Complementary pairs are skipped, as is any pair
     * that involves a card already marked for removal.
     */
    public ResolutionOutcome resolveDuplicates(List<Card> cards, List<ClassifiedPair> pairs) {
        List<ClassifiedPair> needsReview = new ArrayList<>();
        for (ClassifiedPair pair : pairs) {
            if (!pair.isComplementary()) {
                needsReview.add(pair);
            }
        }

        Set<Integer> removed = new TreeSet<>();
        int position = 0;
        for (ClassifiedPair pair : needsReview) {
            position++;
            if (removed.contains(pair.indexA()) || removed.contains(pair.indexB())) {
                log.debug("resolve.pair_skipped a={} b={} reason=already_removed", pair.indexA(), pair.indexB());
                continue;
            }
            DuplicateCase duplicateCase = new DuplicateCase(position, needsReview.size(), pair,
                    cards.get(pair.indexA()), cards.get(pair.indexB()));
            DuplicateDecision decision = decisions.decideDuplicate(duplicateCase);
            switch (decision) {
                case KEEP_FIRST -> removed.add(pair.indexB());
                case KEEP_SECOND -> removed.add(pair.indexA());
                case KEEP_BOTH, SKIP -> { }
                case ABORT -> {
                    log.info("resolve.aborted reviewed={} of={}", position, needsReview.size());
                    return ResolutionOutcome.abort();
                }
            }
        }

        if (removed.isEmpty()) {
            return new ResolutionOutcome(Set.of(), Map.of(), false);
        }
        StringBuilder summary = new StringBuilder("Will remove " + removed.size() + " card(s):");
        for (int index : removed) {
            summary.append("\n  - ").append(cards.get(index).preview(SUMMARY_PREVIEW));
        }
        if (!decisions.confirmChanges(summary.toString())) {
            return ResolutionOutcome.abort();
        }
        log.info("resolve.duplicates_decided removed={}", removed.size());
        return new ResolutionOutcome(removed, Map.of(), false);
    }

    /**
     * Resolves low-scoring cards: accept a rewrite, keep, delete, skip or quit.
     */
    public ResolutionOutcome resolveQuality(List<Card> cards, List<QualityCase> cases) {
        Set<Integer> removed = new TreeSet<>();
        Map<Integer, CardImprovement> rewrites = new HashMap<>();

        for (QualityCase qualityCase : cases) {
            QualityDecision decision = decisions.decideQuality(qualityCase);
            switch (decision) {
                case ACCEPT -> {
                    if (qualityCase.hasImprovement()) {
                        rewrites.put(qualityCase.index(), qualityCase.improvement());
                    }
                }
                case DELETE -> removed.add(qualityCase.index());
                case KEEP, SKIP -> { }
                case QUIT -> {
                    log.info("resolve.aborted reviewed={} of={}", qualityCase.position(), cases.size());
                    return ResolutionOutcome.abort();
                }
            }
        }

        if (removed.isEmpty() && rewrites.isEmpty()) {
            return new ResolutionOutcome(Set.of(), Map.of(), false);
        }
        StringBuilder summary = new StringBuilder("Will rewrite " + rewrites.size()
                + " card(s) and delete " + removed.size() + " card(s):");
        for (int index : new TreeSet<>(rewrites.keySet())) {
            summary.append("\n  ~ ").append(cards.get(index).preview(SUMMARY_PREVIEW));
        }
        for (int index : removed) {
            summary.append("\n  - ").append(cards.get(index).preview(SUMMARY_PREVIEW));
        }
        if (!decisions.confirmChanges(summary.toString())) {
            return ResolutionOutcome.abort();
        }
        log.info("resolve.quality_decided rewritten={} deleted={}", rewrites.size(), removed.size());
        return new ResolutionOutcome(removed, rewrites, false);
    }
}
