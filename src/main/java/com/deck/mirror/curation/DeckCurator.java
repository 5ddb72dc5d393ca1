package com.deck.mirror.curation;

import com.deck.mirror.codec.DeckFile;
import com.deck.mirror.codec.ValidationException;
import com.deck.mirror.console.UserConsole;
import com.deck.mirror.core.model.Card;
import com.deck.mirror.core.model.CardImprovement;
import com.deck.mirror.core.model.QualityGrade;
import com.deck.mirror.logging.LogContext;
import com.deck.mirror.review.DecisionSource;
import com.deck.mirror.review.InteractiveResolver;
import com.deck.mirror.review.QualityCase;
import com.deck.mirror.review.ResolutionOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Grades every card of a deck, proposes rewrites for cards below the quality
 * threshold and applies the reviewed decisions.
 */
public class DeckCurator {
    private static final Logger log = LoggerFactory.getLogger(DeckCurator.class);

    private final QualityGrader grader;
    private final CardImprover improver;
    private final DeckFile deckFile;
    private final UserConsole console;
    private final CurationOptions options;

    public DeckCurator(QualityGrader grader, CardImprover improver, DeckFile deckFile,
                       UserConsole console, CurationOptions options) {
        this.grader = grader;
        this.improver = improver;
        this.deckFile = deckFile;
        this.console = console;
        this.options = options;
    }

    public CurationReport curate(Path file, DecisionSource decisions, ProgressCallback progress) {
        if (!Files.isRegularFile(file)) {
            throw new ValidationException("Deck file not found: " + file);
        }
        List<Card> cards = deckFile.read(file);
        if (cards.isEmpty()) {
            console.println("No cards found in " + file.getFileName());
            return new CurationReport(file, CurationReport.Status.EMPTY, 0, 0, 0, 0, 0, 0, 0.0);
        }

        console.println("Grading " + cards.size() + " cards...");
        List<QualityGrade> grades;
        try (LogContext ctx = LogContext.forBatch(LogContext.generateCorrelationId(), "grade")) {
            grades = grader.gradeAll(cards, progress);
        }

        Map<Integer, QualityGrade> below = new LinkedHashMap<>();
        int failed = 0;
        long total = 0;
        for (int i = 0; i < grades.size(); i++) {
            QualityGrade grade = grades.get(i);
            if (grade.failed()) {
                failed++;
                continue;
            }
            total += grade.score();
            if (grade.isBelow(options.qualityThreshold())) {
                below.put(i, grade);
            }
        }
        int graded = cards.size() - failed;
        double average = graded == 0 ? 0.0 : (double) total / graded;
        console.println(String.format(Locale.ROOT, "Average score %.1f/10 over %d card(s); %d below %d; %d failed",
                average, graded, below.size(), options.qualityThreshold(), failed));

        if (below.isEmpty()) {
            console.println("All graded cards meet the quality threshold.");
            return new CurationReport(file, CurationReport.Status.ALL_ABOVE_THRESHOLD,
                    cards.size(), graded, failed, 0, 0, 0, average);
        }

        console.println("Generating rewrites for " + below.size() + " card(s)...");
        Map<Integer, CardImprovement> improvements;
        try (LogContext ctx = LogContext.forBatch(LogContext.generateCorrelationId(), "improve")) {
            improvements = improver.improveAll(cards, below, progress);
        }

        List<QualityCase> cases = new ArrayList<>(below.size());
        int position = 0;
        for (Map.Entry<Integer, QualityGrade> entry : below.entrySet()) {
            position++;
            int index = entry.getKey();
            cases.add(new QualityCase(position, below.size(), index, cards.get(index), entry.getValue(),
                    improvements.get(index)));
        }

        ResolutionOutcome outcome = new InteractiveResolver(decisions).resolveQuality(cards, cases);
        if (outcome.aborted()) {
            console.println("Aborted - no changes made");
            return new CurationReport(file, CurationReport.Status.ABORTED,
                    cards.size(), graded, failed, below.size(), 0, 0, average);
        }
        if (!outcome.hasChanges()) {
            console.println("No changes.");
            return new CurationReport(file, CurationReport.Status.NO_CHANGES,
                    cards.size(), graded, failed, below.size(), 0, 0, average);
        }

        List<Card> result = outcome.applyTo(cards);
        deckFile.write(file, result);
        console.println("Rewrote " + outcome.rewrites().size() + " and deleted " + outcome.removed().size()
                + " card(s) in " + file.getFileName());
        log.info("curate.written file={} rewritten={} deleted={}", file, outcome.rewrites().size(), outcome.removed().size());
        return new CurationReport(file, CurationReport.Status.WRITTEN, cards.size(), graded, failed,
                below.size(), outcome.rewrites().size(), outcome.removed().size(), average);
    }
}
