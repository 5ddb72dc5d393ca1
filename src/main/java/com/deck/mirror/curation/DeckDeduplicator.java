package com.deck.mirror.curation;

import com.deck.mirror.codec.DeckFile;
import com.deck.mirror.codec.ValidationException;
import com.deck.mirror.console.UserConsole;
import com.deck.mirror.core.model.CandidatePair;
import com.deck.mirror.core.model.Card;
import com.deck.mirror.core.model.ClassifiedPair;
import com.deck.mirror.logging.LogContext;
import com.deck.mirror.metrics.MetricsService;
import com.deck.mirror.review.DecisionSource;
import com.deck.mirror.review.InteractiveResolver;
import com.deck.mirror.review.ResolutionOutcome;
import com.deck.mirror.similarity.CardEmbedder;
import com.deck.mirror.similarity.SimilarityIndex;
import com.deck.mirror.similarity.SimilarityIndexes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Finds and removes near-duplicate cards in a deck file.
 *
 * <p>Pipeline: embed (cached) - candidate pairs above the threshold - classify
 * (cached, windowed) - review of every non-complementary pair - write back.
 * The file is rewritten only when the review ends with removals and is not aborted.</p>
 */
public class DeckDeduplicator {
    private static final Logger log = LoggerFactory.getLogger(DeckDeduplicator.class);

    private static final int COMPLEMENTARY_SHOWN = 5;
    private static final int PREVIEW = 40;

    private final CardEmbedder embedder;
    private final PairClassifier classifier;
    private final DeckFile deckFile;
    private final UserConsole console;
    private final CurationOptions options;
    private final MetricsService metricsService;

    public DeckDeduplicator(CardEmbedder embedder, PairClassifier classifier, DeckFile deckFile,
                            UserConsole console, CurationOptions options, MetricsService metricsService) {
        this.embedder = embedder;
        this.classifier = classifier;
        this.deckFile = deckFile;
        this.console = console;
        this.options = options;
        this.metricsService = metricsService;
    }

    /**
     * Embeds the cards and returns the classified candidate pairs, highest similarity first.
     */
    public List<ClassifiedPair> findDuplicates(List<Card> cards, ProgressCallback progress) {
        List<float[]> embeddings = embedder.embed(cards);
        SimilarityIndex index = SimilarityIndexes.select(options.similarityBackend(), cards.size(),
                options.approximateMinCards(), options.neighborCap());
        List<CandidatePair> pairs = index.findCandidatePairs(embeddings, options.similarityThreshold());
        metricsService.recordCandidatePairs(pairs.size());
        log.info("dedupe.candidates cards={} backend={} threshold={} pairs={}",
                cards.size(), index.getName(), options.similarityThreshold(), pairs.size());
        if (pairs.isEmpty()) {
            return List.of();
        }
        try (LogContext ctx = LogContext.forBatch(LogContext.generateCorrelationId(), "classify")) {
            return classifier.classifyAll(cards, pairs, progress);
        }
    }

    public DedupeReport dedupe(Path file, DecisionSource decisions, ProgressCallback progress) {
        if (!Files.isRegularFile(file)) {
            throw new ValidationException("Deck file not found: " + file);
        }
        console.println("Loading cards from " + file + "...");
        List<Card> cards = deckFile.read(file);
        if (cards.size() < 2) {
            console.println("Not enough cards to deduplicate (need at least 2)");
            return DedupeReport.of(file, DedupeReport.Status.NOT_ENOUGH_CARDS, cards.size());
        }

        console.println("Embedding " + cards.size() + " cards and classifying pairs above "
                + options.similarityThreshold() + "...");
        List<ClassifiedPair> classified = findDuplicates(cards, progress);
        if (classified.isEmpty()) {
            console.println("No duplicates found!");
            return DedupeReport.of(file, DedupeReport.Status.NO_CANDIDATES, cards.size());
        }

        List<ClassifiedPair> complementary = classified.stream().filter(ClassifiedPair::isComplementary).toList();
        printComplementary(cards, complementary);
        int needsReview = classified.size() - complementary.size();
        if (needsReview == 0) {
            console.println("No duplicates found after LLM review!");
            return new DedupeReport(file, DedupeReport.Status.NO_CHANGES, cards.size(),
                    classified.size(), complementary.size(), 0);
        }
        console.println(needsReview + " pair(s) need review:");

        ResolutionOutcome outcome = new InteractiveResolver(decisions).resolveDuplicates(cards, classified);
        if (outcome.aborted()) {
            console.println("Aborted - no changes made");
            return new DedupeReport(file, DedupeReport.Status.ABORTED, cards.size(),
                    classified.size(), complementary.size(), 0);
        }
        if (!outcome.hasChanges()) {
            console.println("No cards marked for removal");
            return new DedupeReport(file, DedupeReport.Status.NO_CHANGES, cards.size(),
                    classified.size(), complementary.size(), 0);
        }

        List<Card> kept = outcome.applyTo(cards);
        deckFile.write(file, kept);
        console.println("Removed " + outcome.removed().size() + " duplicate(s); "
                + kept.size() + " cards remaining in " + file.getFileName());
        log.info("dedupe.written file={} removed={} remaining={}", file, outcome.removed().size(), kept.size());
        return new DedupeReport(file, DedupeReport.Status.WRITTEN, cards.size(),
                classified.size(), complementary.size(), outcome.removed().size());
    }

    private void printComplementary(List<Card> cards, List<ClassifiedPair> complementary) {
        if (complementary.isEmpty()) {
            return;
        }
        console.println("Auto-skipped " + complementary.size() + " complementary pair(s):");
        for (ClassifiedPair pair : complementary.subList(0, Math.min(COMPLEMENTARY_SHOWN, complementary.size()))) {
            console.println("  * " + cards.get(pair.indexA()).preview(PREVIEW)
                    + " <-> " + cards.get(pair.indexB()).preview(PREVIEW));
            console.println("    Reason: " + pair.classification().reasoning());
        }
        if (complementary.size() > COMPLEMENTARY_SHOWN) {
            console.println("  ... and " + (complementary.size() - COMPLEMENTARY_SHOWN) + " more");
        }
    }
}
