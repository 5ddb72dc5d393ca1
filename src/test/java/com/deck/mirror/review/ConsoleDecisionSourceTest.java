package com.deck.mirror.review;

import com.deck.mirror.console.StandardConsole;
import com.deck.mirror.core.model.CandidatePair;
import com.deck.mirror.core.model.Card;
import com.deck.mirror.core.model.CardImprovement;
import com.deck.mirror.core.model.Classification;
import com.deck.mirror.core.model.ClassifiedPair;
import com.deck.mirror.core.model.PairClassification;
import com.deck.mirror.core.model.QualityGrade;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleDecisionSourceTest {

    private ByteArrayOutputStream output;

    private final DuplicateCase duplicateCase = new DuplicateCase(1, 3,
            new ClassifiedPair(new CandidatePair(0, 1, 0.912), new PairClassification(Classification.DUPLICATE, "same idea")),
            Card.of("AbCd1234", "What is Python?", "A language"),
            Card.newCard("What's Python?", "A programming language"));

    @BeforeEach
    void setUp() {
        output = new ByteArrayOutputStream();
    }

    private ConsoleDecisionSource source(String input) {
        return new ConsoleDecisionSource(new StandardConsole(
                new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(output, true, StandardCharsets.UTF_8)));
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("Duplicate pairs")
    class DuplicateTests {

        @ParameterizedTest
        @CsvSource({"1, KEEP_FIRST", "2, KEEP_SECOND", "b, KEEP_BOTH", "B, KEEP_BOTH", "s, SKIP", "q, ABORT"})
        @DisplayName("Should map each option to a decision")
        void testOptions(String input, DuplicateDecision expected) {
            assertEquals(expected, source(input + "\n").decideDuplicate(duplicateCase));
        }

        @Test
        @DisplayName("Should show the pair and ask again on invalid input")
        void testInvalidInput() {
            assertEquals(DuplicateDecision.KEEP_SECOND, source("x\n\n2\n").decideDuplicate(duplicateCase));

            String text = printed();
            assertTrue(text.contains("Pair 1/3 - Similarity: 0.912"));
            assertTrue(text.contains("LLM classification: DUPLICATE"));
            assertTrue(text.contains("ID: AbCd1234"));
            assertEquals(2, text.split("Invalid choice. Please enter 1, 2, b, s, or q", -1).length - 1);
        }

        @Test
        @DisplayName("Should abort at end of input")
        void testEndOfInput() {
            assertEquals(DuplicateDecision.ABORT, source("").decideDuplicate(duplicateCase));
        }
    }

    @Nested
    @DisplayName("Low-scoring cards")
    class QualityTests {

        private QualityCase qualityCase(CardImprovement improvement) {
            return new QualityCase(1, 1, 0, Card.newCard("Vague", "thing"), QualityGrade.of(2, "Too vague"), improvement);
        }

        @Test
        @DisplayName("Should accept an offered rewrite")
        void testAccept() {
            QualityDecision decision = source("a\n").decideQuality(qualityCase(new CardImprovement("Clear Q", "Clear A")));

            assertEquals(QualityDecision.ACCEPT, decision);
            assertTrue(printed().contains("Suggested:"));
        }

        @Test
        @DisplayName("Should not accept when no rewrite exists")
        void testAcceptWithoutRewrite() {
            QualityDecision decision = source("a\nd\n").decideQuality(qualityCase(null));

            assertEquals(QualityDecision.DELETE, decision);
            assertTrue(printed().contains("No rewrite to accept."));
        }

        @Test
        @DisplayName("Should quit at end of input")
        void testEndOfInput() {
            assertEquals(QualityDecision.QUIT, source("").decideQuality(qualityCase(null)));
        }
    }

    @ParameterizedTest
    @CsvSource({"y, true", "YES, true", "n, false", "maybe, false"})
    @DisplayName("Should only confirm on yes")
    void testConfirm(String input, boolean expected) {
        assertEquals(expected, source(input + "\n").confirmChanges("Will remove 1 card(s):"));
        assertTrue(printed().contains("Will remove 1 card(s):"));
    }

    @Test
    @DisplayName("Should decline at end of input")
    void testConfirmEndOfInput() {
        assertFalse(source("").confirmChanges("summary"));
    }
}
