package com.deck.mirror.core.model;

/**
 * A candidate pair with the LLM classification attached.
 */
public record ClassifiedPair(CandidatePair pair, PairClassification classification) {

    public int indexA() {
        return pair.indexA();
    }

    public int indexB() {
        return pair.indexB();
    }

    public double score() {
        return pair.similarityScore();
    }

    public Classification label() {
        return classification.classification();
    }

    public boolean isComplementary() {
        return label() == Classification.COMPLEMENTARY;
    }
}
