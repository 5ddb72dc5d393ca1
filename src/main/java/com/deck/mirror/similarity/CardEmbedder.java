package com.deck.mirror.similarity;

import com.deck.mirror.cache.CacheKeys;
import com.deck.mirror.cache.ContentCache;
import com.deck.mirror.core.model.Card;
import com.deck.mirror.llm.LLMProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Embeds cards as {@code question + "\n" + answer}, cache first, sending only the
 * missing texts to the provider in fixed-size batches.
 *
 * <p>A provider failure propagates as {@link com.deck.mirror.llm.LLMException}; embeddings
 * already fetched in earlier batches stay cached.</p>
 */
public class CardEmbedder {
    private static final Logger log = LoggerFactory.getLogger(CardEmbedder.class);

    static final String PURPOSE = "card-embedding:question-newline-answer";

    private final LLMProvider provider;
    private final ContentCache<float[]> cache;
    private final String model;
    private final int batchSize;

    public CardEmbedder(LLMProvider provider, ContentCache<float[]> cache, String model, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        this.provider = provider;
        this.cache = cache;
        this.model = model;
        this.batchSize = batchSize;
    }

    /**
     * Returns one embedding per card, indexed like {@code cards}.
     */
    public List<float[]> embed(List<Card> cards) {
        List<String> keys = new ArrayList<>(cards.size());
        Map<String, String> missing = new LinkedHashMap<>();
        Map<String, float[]> vectors = new LinkedHashMap<>();

        for (Card card : cards) {
            String text = text(card);
            String key = CacheKeys.derive(model, PURPOSE, text);
            keys.add(key);
            Optional<float[]> cached = cache.get(key);
            if (cached.isPresent()) {
                vectors.put(key, cached.get());
            } else {
                missing.putIfAbsent(key, text);
            }
        }
        log.info("embed.cache_checked cards={} missing={}", cards.size(), missing.size());

        List<String> missingKeys = new ArrayList<>(missing.keySet());
        try {
            for (int start = 0; start < missingKeys.size(); start += batchSize) {
                List<String> batchKeys = missingKeys.subList(start, Math.min(start + batchSize, missingKeys.size()));
                List<String> texts = new ArrayList<>(batchKeys.size());
                for (String key : batchKeys) {
                    texts.add(missing.get(key));
                }
                List<float[]> embedded = provider.embed(model, texts);
                for (int i = 0; i < batchKeys.size(); i++) {
                    vectors.put(batchKeys.get(i), embedded.get(i));
                    cache.put(batchKeys.get(i), embedded.get(i));
                }
                log.debug("embed.batch_completed size={} done={}/{}", batchKeys.size(),
                        start + batchKeys.size(), missingKeys.size());
            }
        } finally {
            cache.flush();
        }

        List<float[]> result = new ArrayList<>(cards.size());
        for (String key : keys) {
            result.add(vectors.get(key));
        }
        return result;
    }

    static String text(Card card) {
        return card.question() + "\n" + card.answer();
    }
}
