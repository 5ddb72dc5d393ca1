package com.deck.mirror.core.model;

/**
 * Two cards whose embeddings are more similar than the configured threshold.
 * Indices refer to positions in the card list the pair was computed from.
 *
 * @param indexA          lower card index
 * @param indexB          higher card index
 * @param similarityScore cosine similarity of the two embeddings
 */
public record CandidatePair(int indexA, int indexB, double similarityScore) implements Comparable<CandidatePair> {

    public CandidatePair {
        if (indexA < 0 || indexB < 0) {
            throw new IllegalArgumentException("Indices must be non-negative");
        }
        if (indexA >= indexB) {
            throw new IllegalArgumentException("indexA must be < indexB, got " + indexA + " and " + indexB);
        }
    }

    /**
     * Creates a pair from two indices in either order.
     */
    public static CandidatePair of(int i, int j, double score) {
        return i < j ? new CandidatePair(i, j, score) : new CandidatePair(j, i, score);
    }

    public boolean involves(int index) {
        return indexA == index || indexB == index;
    }

    /**
     * Descending similarity, then ascending indices.
     */
    @Override
    public int compareTo(CandidatePair other) {
        int byScore = Double.compare(other.similarityScore, similarityScore);
        if (byScore != 0) {
            return byScore;
        }
        int byA = Integer.compare(indexA, other.indexA);
        return byA != 0 ? byA : Integer.compare(indexB, other.indexB);
    }
}
