package com.deck.mirror.similarity;

/**
 * Chooses the similarity backend for a deck.
 */
public final class SimilarityIndexes {

    public enum Backend {
        /** Exact below {@code approximateMinCards}, approximate above. */
        AUTO,
        EXACT,
        APPROXIMATE
    }

    private SimilarityIndexes() {
    }

    public static SimilarityIndex select(Backend backend, int cardCount, int approximateMinCards, int neighborCap) {
        return switch (backend) {
            case EXACT -> new BruteForceSimilarityIndex();
            case APPROXIMATE -> new IvfFlatSimilarityIndex(neighborCap, IvfFlatSimilarityIndex.DEFAULT_NPROBE);
            case AUTO -> cardCount >= approximateMinCards
                    ? new IvfFlatSimilarityIndex(neighborCap, IvfFlatSimilarityIndex.DEFAULT_NPROBE)
                    : new BruteForceSimilarityIndex();
        };
    }
}
