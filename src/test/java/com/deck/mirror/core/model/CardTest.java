package com.deck.mirror.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CardTest {

    @Nested
    @DisplayName("Content hash")
    class ContentHashTests {

        @Test
        @DisplayName("Should be stable for the same question and answer")
        void testStable() {
            assertEquals(ContentHash.of("What is Python?", "A language"),
                    ContentHash.of("What is Python?", "A language"));
        }

        @Test
        @DisplayName("Should always be 16 hex characters")
        void testLength() {
            String hash = ContentHash.of("Q", "A");
            assertEquals(16, hash.length());
            assertTrue(hash.matches("[0-9a-f]{16}"));
            assertEquals(16, ContentHash.of("", "").length());
        }

        @Test
        @DisplayName("Should ignore surrounding whitespace")
        void testNormalized() {
            assertEquals(ContentHash.of("Q", "A"), ContentHash.of("  Q\n", "\tA  "));
        }

        @Test
        @DisplayName("Should differ when question or answer differ")
        void testDistinct() {
            assertNotEquals(ContentHash.of("Q1", "A"), ContentHash.of("Q2", "A"));
            assertNotEquals(ContentHash.of("Q", "A1"), ContentHash.of("Q", "A2"));
            assertNotEquals(ContentHash.of("Q\n---\nA", ""), ContentHash.of("Q", "A\n---\n"));
        }

        @Test
        @DisplayName("Should ignore id, tags and archived flag")
        void testOnlyContent() {
            Card a = Card.of("AbCdEfGh", "Q", "A", List.of("x"), true);
            Card b = Card.newCard("Q", "A");
            assertEquals(a.contentHash(), b.contentHash());
        }
    }

    @Test
    @DisplayName("Should treat blank id as absent")
    void testBlankId() {
        Card card = Card.of("  ", "Q", "A");
        assertNull(card.id());
        assertFalse(card.hasId());
    }

    @Test
    @DisplayName("Should compare tags as a set")
    void testTagsAsSet() {
        Card a = Card.of("id", "Q", "A", List.of("a", "b"), false);
        Card b = Card.of("id", "Q", "A", List.of("b", "a"), false);
        assertEquals(a, b);
        assertEquals(Set.of("a", "b"), a.tags());
    }

    @Test
    @DisplayName("Should be valid only when both sides are non-blank")
    void testValidity() {
        assertTrue(Card.newCard("Q", "A").isValid());
        assertFalse(Card.newCard("  ", "A").isValid());
        assertFalse(Card.newCard("Q", "").isValid());
    }

    @Test
    @DisplayName("Should keep metadata when content changes")
    void testWithContent() {
        Card card = Card.of("AbCdEfGh", "Q", "A", List.of("t"), true);
        Card changed = card.withContent("Q2", "A2");
        assertEquals("AbCdEfGh", changed.id());
        assertEquals(Set.of("t"), changed.tags());
        assertTrue(changed.archived());
        assertNotEquals(card.contentHash(), changed.contentHash());
    }

    @Test
    @DisplayName("Should join content with the delimiter line")
    void testContent() {
        assertEquals("Q\n---\nA", Card.newCard("Q", "A").content());
    }

    @Test
    @DisplayName("Should shorten long questions in previews")
    void testPreview() {
        Card card = Card.newCard("line one\nline two", "A");
        assertEquals("line one line two", card.preview(50));
        assertEquals("line...", card.preview(4));
    }

    @Nested
    @DisplayName("Model values")
    class ValueTests {

        @Test
        @DisplayName("Candidate pair orders indices and sorts by descending score")
        void testCandidatePair() {
            CandidatePair pair = CandidatePair.of(5, 2, 0.9);
            assertEquals(2, pair.indexA());
            assertEquals(5, pair.indexB());
            assertThrows(IllegalArgumentException.class, () -> new CandidatePair(3, 3, 1.0));

            List<CandidatePair> sorted = new ArrayList<>(List.of(
                    new CandidatePair(0, 1, 0.86), new CandidatePair(1, 2, 0.99), new CandidatePair(0, 2, 0.90)));
            Collections.sort(sorted);
            assertEquals(0.99, sorted.get(0).similarityScore());
            assertEquals(0.86, sorted.get(2).similarityScore());
        }

        @Test
        @DisplayName("Quality grade clamps out-of-range scores")
        void testGradeClamp() {
            assertEquals(10, QualityGrade.of(14, "r").score());
            assertEquals(0, QualityGrade.of(-3, "r").score());
            assertTrue(QualityGrade.of(4, "r").isBelow(7));
            assertFalse(QualityGrade.failure("down").isBelow(7));
        }

        @Test
        @DisplayName("Model labels exclude the error sentinel")
        void testModelLabels() {
            assertEquals(Classification.DUPLICATE, Classification.parseModelLabel(" Duplicate ").orElseThrow());
            assertTrue(Classification.parseModelLabel("error").isEmpty());
            assertTrue(Classification.parseModelLabel("maybe").isEmpty());
            assertEquals(Classification.ERROR, Classification.fromLabel("error"));
        }
    }
}
