package com.deck.mirror.similarity;

import com.deck.mirror.core.model.CandidatePair;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Exact all-pairs cosine comparison. Quadratic, used for small decks.
 */
public class BruteForceSimilarityIndex implements SimilarityIndex {

    @Override
    public List<CandidatePair> findCandidatePairs(List<float[]> vectors, double threshold) {
        List<float[]> normalized = new ArrayList<>(vectors.size());
        for (float[] vector : vectors) {
            normalized.add(VectorMath.normalize(vector));
        }

        List<CandidatePair> pairs = new ArrayList<>();
        for (int i = 0; i < normalized.size(); i++) {
            for (int j = i + 1; j < normalized.size(); j++) {
                double score = VectorMath.dot(normalized.get(i), normalized.get(j));
                if (score >= threshold) {
                    pairs.add(new CandidatePair(i, j, score));
                }
            }
        }
        Collections.sort(pairs);
        return pairs;
    }

    @Override
    public String getName() {
        return "exact";
    }
}
