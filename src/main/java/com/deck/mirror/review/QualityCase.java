package com.deck.mirror.review;

import com.deck.mirror.core.model.Card;
import com.deck.mirror.core.model.CardImprovement;
import com.deck.mirror.core.model.QualityGrade;

/**
 * A low-scoring card presented for review.
 *
 * @param position    1-based position among the cards needing review
 * @param total       number of cards needing review
 * @param index       index of the card in the deck
 * @param improvement proposed rewrite, null when none could be produced
 */
public record QualityCase(int position, int total, int index, Card card, QualityGrade grade,
                          CardImprovement improvement) {

    public boolean hasImprovement() {
        return improvement != null;
    }
}
