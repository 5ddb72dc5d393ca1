package com.deck.mirror.review;

/**
 * Source of review decisions: a person at the console or a fixed policy.
 */
public interface DecisionSource {

    DuplicateDecision decideDuplicate(DuplicateCase duplicateCase);

    QualityDecision decideQuality(QualityCase qualityCase);

    /**
     * Final confirmation before the deck file is rewritten.
     *
     * @param summary human-readable description of the pending changes
     */
    boolean confirmChanges(String summary);
}
