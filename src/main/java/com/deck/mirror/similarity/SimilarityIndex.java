package com.deck.mirror.similarity;

import com.deck.mirror.core.model.CandidatePair;

import java.util.List;

/**
 * Finds near-duplicate candidates among embedded cards.
 */
public interface SimilarityIndex {

    /**
     * Returns every pair whose cosine similarity is at least {@code threshold},
     * each unordered pair once with {@code indexA < indexB}, sorted by descending score.
     *
     * @param vectors one embedding per card, indexed like the card list
     */
    List<CandidatePair> findCandidatePairs(List<float[]> vectors, double threshold);

    /**
     * Returns the name of this backend.
     */
    String getName();
}
