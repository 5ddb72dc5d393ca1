package com.deck.mirror.curation;

import com.deck.mirror.cache.InMemoryContentCache;
import com.deck.mirror.core.model.Card;
import com.deck.mirror.core.model.QualityGrade;
import com.deck.mirror.llm.CompletionRequest;
import com.deck.mirror.llm.LLMException;
import com.deck.mirror.llm.LLMProvider;
import com.deck.mirror.metrics.NoOpMetricsService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class QualityGraderTest {

    @Mock
    private LLMProvider provider;

    private InMemoryContentCache<QualityGrade> cache;
    private WindowedBatchExecutor executor;

    @BeforeEach
    void setUp() {
        cache = new InMemoryContentCache<>("gradings");
        executor = new WindowedBatchExecutor(4, new NoOpMetricsService());
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    @Test
    @DisplayName("Should grade every card in order and reuse cached grades")
    void testGradeAll() {
        when(provider.complete(any(CompletionRequest.class))).thenAnswer(inv -> {
            CompletionRequest request = inv.getArgument(0);
            return request.prompt().contains("vague") ? "SCORE: 3\nREASONING: Too vague." : "SCORE: 9\nREASONING: Clear.";
        });
        QualityGrader grader = new QualityGrader(provider, cache, executor, "chat");
        List<Card> cards = List.of(Card.newCard("What is 2+2?", "4"), Card.newCard("Explain stuff", "vague things"));

        List<QualityGrade> grades = grader.gradeAll(cards, ProgressCallback.NOOP);
        grader.gradeAll(cards, ProgressCallback.NOOP);

        assertEquals(9, grades.get(0).score());
        assertEquals(3, grades.get(1).score());
        assertEquals("Too vague.", grades.get(1).reasoning());
        verify(provider, times(2)).complete(any(CompletionRequest.class));
    }

    @Test
    @DisplayName("Should mark failed requests and leave them uncached")
    void testFailure() {
        when(provider.complete(any(CompletionRequest.class))).thenThrow(new LLMException("HTTP 429"));
        QualityGrader grader = new QualityGrader(provider, cache, executor, "chat");

        List<QualityGrade> grades = grader.gradeAll(List.of(Card.newCard("Q", "A")), ProgressCallback.NOOP);

        assertTrue(grades.get(0).failed());
        assertEquals("Grading request failed: HTTP 429", grades.get(0).reasoning());
        assertEquals(0, cache.size());
    }

    @Nested
    @DisplayName("Response parsing")
    class ParseTests {

        @Test
        @DisplayName("Should read score and reasoning")
        void testValid() {
            QualityGrade grade = QualityGrader.parseResponse("SCORE: 7\nREASONING: Good but wordy.");
            assertEquals(7, grade.score());
            assertEquals("Good but wordy.", grade.reasoning());
            assertFalse(grade.failed());
        }

        @Test
        @DisplayName("Should clamp out-of-range scores")
        void testClamp() {
            assertEquals(10, QualityGrader.parseResponse("SCORE: 15\nREASONING: great").score());
            assertEquals(0, QualityGrader.parseResponse("score: -2\nreasoning: awful").score());
            assertEquals(10, QualityGrader.parseResponse("SCORE: 99999999999").score());
        }

        @Test
        @DisplayName("Should fall back to a neutral score when no score is present")
        void testNoScore() {
            QualityGrade grade = QualityGrader.parseResponse("I think this card is fine.");
            assertEquals(QualityGrade.NEUTRAL_SCORE, grade.score());
            assertEquals("Could not parse score from response: I think this card is fine.", grade.reasoning());
        }

        @Test
        @DisplayName("Should note missing reasoning")
        void testNoReasoning() {
            assertEquals("No reasoning provided", QualityGrader.parseResponse("SCORE: 8").reasoning());
        }
    }
}
