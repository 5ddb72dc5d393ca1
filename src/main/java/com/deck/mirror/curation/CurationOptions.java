package com.deck.mirror.curation;

import com.deck.mirror.config.MirrorConfig;
import com.deck.mirror.similarity.SimilarityIndexes;

/**
 * Settings for dedupe and curate runs.
 */
public record CurationOptions(
        String chatModel,
        String embeddingModel,
        int embeddingBatchSize,
        double similarityThreshold,
        SimilarityIndexes.Backend similarityBackend,
        int approximateMinCards,
        int neighborCap,
        int qualityThreshold
) {

    public static CurationOptions from(MirrorConfig config) {
        return new CurationOptions(
                config.getChatModel(),
                config.getEmbeddingModel(),
                config.getEmbeddingBatchSize(),
                config.getSimilarityThreshold(),
                config.getSimilarityBackend(),
                config.getApproximateMinCards(),
                config.getNeighborCap(),
                config.getQualityThreshold());
    }

    public CurationOptions withSimilarityThreshold(double threshold) {
        return new CurationOptions(chatModel, embeddingModel, embeddingBatchSize, threshold,
                similarityBackend, approximateMinCards, neighborCap, qualityThreshold);
    }

    public CurationOptions withQualityThreshold(int threshold) {
        return new CurationOptions(chatModel, embeddingModel, embeddingBatchSize, similarityThreshold,
                similarityBackend, approximateMinCards, neighborCap, threshold);
    }
}
