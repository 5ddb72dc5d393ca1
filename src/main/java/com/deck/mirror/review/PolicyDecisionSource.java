package com.deck.mirror.review;

import com.deck.mirror.core.model.Classification;

/**
 * Non-interactive decisions: pairs classified {@code duplicate} keep the first card
 * and drop the second, everything else is kept. Low-scoring cards keep their
 * original text.
 */
public class PolicyDecisionSource implements DecisionSource {

    @Override
    public DuplicateDecision decideDuplicate(DuplicateCase duplicateCase) {
        return duplicateCase.pair().label() == Classification.DUPLICATE
                ? DuplicateDecision.KEEP_FIRST
                : DuplicateDecision.KEEP_BOTH;
    }

    @Override
    public QualityDecision decideQuality(QualityCase qualityCase) {
        return QualityDecision.KEEP;
    }

    @Override
    public boolean confirmChanges(String summary) {
        return true;
    }
}
