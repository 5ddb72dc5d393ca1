package com.deck.mirror.review;

import com.deck.mirror.console.UserConsole;
import com.deck.mirror.core.model.Card;

import java.util.Locale;

/**
 * Asks the user at the console. Invalid input is asked again; end of input aborts.
 */
public class ConsoleDecisionSource implements DecisionSource {

    private static final String RULE = "=".repeat(70);
    private static final int PREVIEW = 100;

    private final UserConsole console;

    public ConsoleDecisionSource(UserConsole console) {
        this.console = console;
    }

    @Override
    public DuplicateDecision decideDuplicate(DuplicateCase c) {
        console.println(RULE);
        console.println(String.format(Locale.ROOT, "Pair %d/%d - Similarity: %.3f", c.position(), c.total(), c.pair().score()));
        console.println("LLM classification: " + c.pair().label().label().toUpperCase(Locale.ROOT));
        console.println("   Reasoning: " + c.pair().classification().reasoning());
        printCard("[1] Card 1:", c.first());
        printCard("[2] Card 2:", c.second());
        console.println();
        console.println("Options:");
        console.println("  1 - Keep card 1, remove card 2");
        console.println("  2 - Keep card 2, remove card 1");
        console.println("  b - Keep both (not duplicates)");
        console.println("  s - Skip to next pair");
        console.println("  q - Quit without saving");

        while (true) {
            String choice = console.prompt("Your choice [1/2/b/s/q]: ");
            if (choice == null) {
                return DuplicateDecision.ABORT;
            }
            switch (choice.toLowerCase(Locale.ROOT)) {
                case "1":
                    return DuplicateDecision.KEEP_FIRST;
                case "2":
                    return DuplicateDecision.KEEP_SECOND;
                case "b":
                    return DuplicateDecision.KEEP_BOTH;
                case "s":
                    return DuplicateDecision.SKIP;
                case "q":
                    return DuplicateDecision.ABORT;
                default:
                    console.println("Invalid choice. Please enter 1, 2, b, s, or q");
            }
        }
    }

    @Override
    public QualityDecision decideQuality(QualityCase c) {
        console.println(RULE);
        console.println("Card " + c.position() + "/" + c.total() + " - Score: " + c.grade().score() + "/10");
        console.println("   Reasoning: " + c.grade().reasoning());
        printCard("Current:", c.card());
        if (c.hasImprovement()) {
            console.println();
            console.println("Suggested:");
            console.println("    Q: " + c.improvement().question());
            console.println("    A: " + c.improvement().answer());
        } else {
            console.println();
            console.println("(no rewrite available)");
        }
        console.println();
        console.println("Options:");
        if (c.hasImprovement()) {
            console.println("  a - Accept the rewrite");
        }
        console.println("  k - Keep the original");
        console.println("  d - Delete the card");
        console.println("  s - Skip to next card");
        console.println("  q - Quit without saving");

        while (true) {
            String choice = console.prompt(c.hasImprovement() ? "Your choice [a/k/d/s/q]: " : "Your choice [k/d/s/q]: ");
            if (choice == null) {
                return QualityDecision.QUIT;
            }
            switch (choice.toLowerCase(Locale.ROOT)) {
                case "a":
                    if (c.hasImprovement()) {
                        return QualityDecision.ACCEPT;
                    }
                    console.println("No rewrite to accept.");
                    break;
                case "k":
                    return QualityDecision.KEEP;
                case "d":
                    return QualityDecision.DELETE;
                case "s":
                    return QualityDecision.SKIP;
                case "q":
                    return QualityDecision.QUIT;
                default:
                    console.println("Invalid choice.");
            }
        }
    }

    @Override
    public boolean confirmChanges(String summary) {
        console.println();
        console.println(RULE);
        console.println(summary);
        return console.confirm("Proceed?");
    }

    private void printCard(String heading, Card card) {
        console.println();
        console.println(heading);
        console.println("    Q: " + card.preview(PREVIEW));
        console.println("    A: " + truncate(card.answer()));
        if (card.hasId()) {
            console.println("    ID: " + card.id());
        }
    }

    private static String truncate(String text) {
        return text.length() > PREVIEW ? text.substring(0, PREVIEW) + "..." : text;
    }
}
