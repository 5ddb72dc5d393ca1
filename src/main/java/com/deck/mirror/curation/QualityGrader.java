package com.deck.mirror.curation;

import com.deck.mirror.cache.CacheKeys;
import com.deck.mirror.cache.ContentCache;
import com.deck.mirror.core.model.Card;
import com.deck.mirror.core.model.QualityGrade;
import com.deck.mirror.llm.CompletionRequest;
import com.deck.mirror.llm.LLMProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Grades cards from 0 to 10.
 *
 * <p>An unparseable response yields the neutral score 5 with a diagnostic reasoning;
 * an out-of-range score is clamped. A failed request yields a failed grade that is
 * not cached.</p>
 */
public class QualityGrader {
    private static final Logger log = LoggerFactory.getLogger(QualityGrader.class);

    private static final double TEMPERATURE = 0.0;
    private static final Pattern SCORE_PATTERN = Pattern.compile("(?i)SCORE:\\s*(-?\\d+)");
    private static final Pattern REASONING_PATTERN = Pattern.compile("(?i)REASONING:\\s*(.+)", Pattern.DOTALL);

    private final LLMProvider provider;
    private final ContentCache<QualityGrade> cache;
    private final WindowedBatchExecutor executor;
    private final String model;
    private final String template;

    public QualityGrader(LLMProvider provider, ContentCache<QualityGrade> cache,
                         WindowedBatchExecutor executor, String model) {
        this(provider, cache, executor, model, PromptTemplates.GRADE_CARD);
    }

    public QualityGrader(LLMProvider provider, ContentCache<QualityGrade> cache,
                         WindowedBatchExecutor executor, String model, String template) {
        this.provider = provider;
        this.cache = cache;
        this.executor = executor;
        this.model = model;
        this.template = template;
    }

    /**
     * Grades every card, cache first. The result is indexed like {@code cards}.
     */
    public List<QualityGrade> gradeAll(List<Card> cards, ProgressCallback progress) {
        List<BatchTask<QualityGrade>> tasks = new ArrayList<>(cards.size());
        List<String> keys = new ArrayList<>(cards.size());
        for (Card card : cards) {
            String key = cacheKey(card);
            keys.add(key);
            tasks.add(new BatchTask<>(key, () -> request(card)));
        }

        Map<String, QualityGrade> results = executor.executeCached(
                tasks, cache, grade -> !grade.failed(), QualityGrader::failure, progress);

        List<QualityGrade> grades = new ArrayList<>(cards.size());
        for (String key : keys) {
            grades.add(results.get(key));
        }
        log.info("grade.completed cards={} failed={}", grades.size(), grades.stream().filter(QualityGrade::failed).count());
        return grades;
    }

    String cacheKey(Card card) {
        return CacheKeys.derive(model, template, card.question(), card.answer());
    }

    private QualityGrade request(Card card) {
        String prompt = PromptTemplates.gradeCard(template, card);
        return parseResponse(provider.complete(CompletionRequest.of(model, prompt, TEMPERATURE)));
    }

    static QualityGrade parseResponse(String response) {
        String text = response == null ? "" : response.strip();
        Matcher score = SCORE_PATTERN.matcher(text);
        if (!score.find()) {
            return QualityGrade.neutral("Could not parse score from response: " + truncate(text, 50));
        }
        int value;
        try {
            value = Integer.parseInt(score.group(1));
        } catch (NumberFormatException e) {
            // more digits than an int holds
            value = score.group(1).startsWith("-") ? QualityGrade.MIN_SCORE : QualityGrade.MAX_SCORE;
        }
        Matcher reasoning = REASONING_PATTERN.matcher(text);
        String explanation = reasoning.find() ? reasoning.group(1).strip() : "No reasoning provided";
        return QualityGrade.of(value, explanation);
    }

    private static QualityGrade failure(Throwable error) {
        return QualityGrade.failure("Grading request failed: " + truncate(String.valueOf(error.getMessage()), 100));
    }

    private static String truncate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max);
    }
}
