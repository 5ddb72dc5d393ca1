package com.deck.mirror.curation;

import com.deck.mirror.core.model.Card;
import com.deck.mirror.core.model.CardImprovement;
import com.deck.mirror.core.model.QualityGrade;
import com.deck.mirror.llm.CompletionRequest;
import com.deck.mirror.llm.LLMProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Proposes rewrites for low-scoring cards. Rewrites are not cached.
 * A response missing the {@code QUESTION:} or {@code ANSWER:} marker, or a failed
 * request, yields no improvement and the original card is kept.
 */
public class CardImprover {
    private static final Logger log = LoggerFactory.getLogger(CardImprover.class);

    private static final double TEMPERATURE = 0.3;
    private static final Pattern SECTIONS = Pattern.compile(
            "(?is)QUESTION:\\s*(.*?)\\s*ANSWER:\\s*(.*)");

    private final LLMProvider provider;
    private final WindowedBatchExecutor executor;
    private final String model;
    private final String template;

    public CardImprover(LLMProvider provider, WindowedBatchExecutor executor, String model) {
        this(provider, executor, model, PromptTemplates.IMPROVE_CARD);
    }

    public CardImprover(LLMProvider provider, WindowedBatchExecutor executor, String model, String template) {
        this.provider = provider;
        this.executor = executor;
        this.model = model;
        this.template = template;
    }

    /**
     * Requests improvements for the given card indices.
     *
     * @return improvements keyed by card index; indices without a usable rewrite are absent
     */
    public Map<Integer, CardImprovement> improveAll(List<Card> cards, Map<Integer, QualityGrade> grades,
                                                    ProgressCallback progress) {
        List<BatchTask<Optional<CardImprovement>>> tasks = new ArrayList<>(grades.size());
        for (Map.Entry<Integer, QualityGrade> entry : grades.entrySet()) {
            Card card = cards.get(entry.getKey());
            QualityGrade grade = entry.getValue();
            tasks.add(new BatchTask<>(Integer.toString(entry.getKey()), () -> request(card, grade)));
        }

        Map<String, Optional<CardImprovement>> results = executor.execute(tasks, error -> Optional.empty(), progress);

        Map<Integer, CardImprovement> improvements = new HashMap<>();
        results.forEach((key, improvement) -> improvement.ifPresent(i -> improvements.put(Integer.parseInt(key), i)));
        log.info("improve.completed requested={} improved={}", tasks.size(), improvements.size());
        return improvements;
    }

    public Optional<CardImprovement> improve(Card card, QualityGrade grade) {
        try {
            return request(card, grade);
        } catch (RuntimeException e) {
            log.warn("improve.failed error={}", e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<CardImprovement> request(Card card, QualityGrade grade) {
        String prompt = PromptTemplates.improveCard(template, card, grade.score(), grade.reasoning());
        return parseResponse(provider.complete(CompletionRequest.of(model, prompt, TEMPERATURE)));
    }

    static Optional<CardImprovement> parseResponse(String response) {
        if (response == null) {
            return Optional.empty();
        }
        Matcher matcher = SECTIONS.matcher(response);
        if (!matcher.find()) {
            log.debug("improve.unparseable response={}", response.length() > 80 ? response.substring(0, 80) : response);
            return Optional.empty();
        }
        String question = matcher.group(1).strip();
        String answer = matcher.group(2).strip();
        if (question.isEmpty() || answer.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new CardImprovement(question, answer));
    }
}
