package com.deck.mirror.cache;

import com.deck.mirror.core.model.PairClassification;
import com.deck.mirror.core.model.QualityGrade;
import com.deck.mirror.metrics.MetricsService;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The three cache domains used by deduplication and curation, opened together and
 * flushed together.
 */
public class CurationCaches implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CurationCaches.class);

    public static final String EMBEDDINGS = "embeddings";
    public static final String CLASSIFICATIONS = "classifications";
    public static final String GRADINGS = "gradings";

    private final ContentCache<float[]> embeddings;
    private final ContentCache<PairClassification> classifications;
    private final ContentCache<QualityGrade> gradings;

    public CurationCaches(ContentCache<float[]> embeddings,
                          ContentCache<PairClassification> classifications,
                          ContentCache<QualityGrade> gradings) {
        this.embeddings = embeddings;
        this.classifications = classifications;
        this.gradings = gradings;
    }

    /**
     * Opens the file-backed caches described by the config, or no-op caches when disabled.
     */
    public static CurationCaches open(CacheConfig config, MetricsService metricsService) {
        if (!config.enabled()) {
            log.info("cache.disabled");
            return inMemoryDisabled();
        }
        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return new CurationCaches(
                new JsonFileContentCache<>(EMBEDDINGS, config.directory().resolve(EMBEDDINGS + ".json"),
                        float[].class, mapper, metricsService),
                new JsonFileContentCache<>(CLASSIFICATIONS, config.directory().resolve(CLASSIFICATIONS + ".json"),
                        PairClassification.class, mapper, metricsService),
                new JsonFileContentCache<>(GRADINGS, config.directory().resolve(GRADINGS + ".json"),
                        QualityGrade.class, mapper, metricsService));
    }

    public static CurationCaches inMemoryDisabled() {
        return new CurationCaches(
                new NoOpContentCache<>(EMBEDDINGS),
                new NoOpContentCache<>(CLASSIFICATIONS),
                new NoOpContentCache<>(GRADINGS));
    }

    public ContentCache<float[]> embeddings() {
        return embeddings;
    }

    public ContentCache<PairClassification> classifications() {
        return classifications;
    }

    public ContentCache<QualityGrade> gradings() {
        return gradings;
    }

    public void flushAll() {
        embeddings.flush();
        classifications.flush();
        gradings.flush();
    }

    @Override
    public void close() {
        flushAll();
    }
}
