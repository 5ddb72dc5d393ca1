package com.deck.mirror.review;

import com.deck.mirror.core.model.Card;
import com.deck.mirror.core.model.ClassifiedPair;

/**
 * A pair presented for review.
 *
 * @param position 1-based position among the pairs needing review
 * @param total    number of pairs needing review
 */
public record DuplicateCase(int position, int total, ClassifiedPair pair, Card first, Card second) {
}
