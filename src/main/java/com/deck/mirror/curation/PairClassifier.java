package com.deck.mirror.curation;

import com.deck.mirror.cache.CacheKeys;
import com.deck.mirror.cache.ContentCache;
import com.deck.mirror.core.model.CandidatePair;
import com.deck.mirror.core.model.Card;
import com.deck.mirror.core.model.Classification;
import com.deck.mirror.core.model.ClassifiedPair;
import com.deck.mirror.core.model.PairClassification;
import com.deck.mirror.llm.CompletionRequest;
import com.deck.mirror.llm.LLMProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Classifies candidate pairs as duplicate, complementary or unclear.
 *
 * <p>Responses are expected as {@code classification | reasoning}. A response without
 * the bar, or with a label outside the closed set, becomes {@code unclear} with a
 * diagnostic reasoning. A failed request becomes {@code error}, which is never cached
 * and so is retried on the next run.</p>
 */
public class PairClassifier {
    private static final Logger log = LoggerFactory.getLogger(PairClassifier.class);

    private static final double TEMPERATURE = 0.0;

    private final LLMProvider provider;
    private final ContentCache<PairClassification> cache;
    private final WindowedBatchExecutor executor;
    private final String model;
    private final String template;

    public PairClassifier(LLMProvider provider, ContentCache<PairClassification> cache,
                          WindowedBatchExecutor executor, String model) {
        this(provider, cache, executor, model, PromptTemplates.CLASSIFY_PAIR);
    }

    public PairClassifier(LLMProvider provider, ContentCache<PairClassification> cache,
                          WindowedBatchExecutor executor, String model, String template) {
        this.provider = provider;
        this.cache = cache;
        this.executor = executor;
        this.model = model;
        this.template = template;
    }

    /**
     * Classifies every pair, cache first, and returns them in the input order.
     */
    public List<ClassifiedPair> classifyAll(List<Card> cards, List<CandidatePair> pairs, ProgressCallback progress) {
        List<BatchTask<PairClassification>> tasks = new ArrayList<>(pairs.size());
        List<String> keys = new ArrayList<>(pairs.size());
        for (CandidatePair pair : pairs) {
            Card first = cards.get(pair.indexA());
            Card second = cards.get(pair.indexB());
            String key = cacheKey(first, second);
            keys.add(key);
            tasks.add(new BatchTask<>(key, () -> request(first, second)));
        }

        Map<String, PairClassification> results = executor.executeCached(
                tasks, cache, c -> !c.isError(), PairClassifier::failure, progress);

        List<ClassifiedPair> classified = new ArrayList<>(pairs.size());
        for (int i = 0; i < pairs.size(); i++) {
            classified.add(new ClassifiedPair(pairs.get(i), results.get(keys.get(i))));
        }
        log.info("classify.completed pairs={} errors={}", classified.size(),
                classified.stream().filter(p -> p.classification().isError()).count());
        return classified;
    }

    /**
     * Classifies one pair, cache first.
     */
    public PairClassification classify(Card first, Card second) {
        String key = cacheKey(first, second);
        Optional<PairClassification> cached = cache.get(key);
        if (cached.isPresent()) {
            return cached.get();
        }
        PairClassification result;
        try {
            result = request(first, second);
        } catch (RuntimeException e) {
            return failure(e);
        }
        cache.put(key, result);
        return result;
    }

    String cacheKey(Card first, Card second) {
        return CacheKeys.derive(model, template,
                first.question(), first.answer(), second.question(), second.answer());
    }

    private PairClassification request(Card first, Card second) {
        String prompt = PromptTemplates.classifyPair(template, first, second);
        String response = provider.complete(CompletionRequest.of(model, prompt, TEMPERATURE));
        return parseResponse(response);
    }

    static PairClassification parseResponse(String response) {
        String result = response == null ? "" : response.strip();
        int bar = result.indexOf('|');
        if (bar < 0) {
            return PairClassification.unclear("LLM response format invalid: " + truncate(result, 50));
        }
        String label = result.substring(0, bar).strip();
        String reasoning = result.substring(bar + 1).strip();
        Optional<Classification> classification = Classification.parseModelLabel(label);
        if (classification.isEmpty()) {
            return PairClassification.unclear("Invalid classification '" + label.toLowerCase(Locale.ROOT) + "': " + reasoning);
        }
        return new PairClassification(classification.get(), reasoning);
    }

    private static PairClassification failure(Throwable error) {
        String message = String.valueOf(error.getMessage());
        return PairClassification.error("LLM request failed: " + truncate(message, 100));
    }

    private static String truncate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max);
    }
}
