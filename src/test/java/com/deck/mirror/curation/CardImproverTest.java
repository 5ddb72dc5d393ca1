package com.deck.mirror.curation;

import com.deck.mirror.core.model.Card;
import com.deck.mirror.core.model.CardImprovement;
import com.deck.mirror.core.model.QualityGrade;
import com.deck.mirror.llm.CompletionRequest;
import com.deck.mirror.llm.LLMException;
import com.deck.mirror.llm.LLMProvider;
import com.deck.mirror.metrics.NoOpMetricsService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CardImproverTest {

    @Mock
    private LLMProvider provider;

    private WindowedBatchExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new WindowedBatchExecutor(2, new NoOpMetricsService());
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    @Test
    @DisplayName("Should parse the rewritten question and answer")
    void testParse() {
        Optional<CardImprovement> improvement = CardImprover.parseResponse(
                "Here you go:\nQUESTION: What does GIL stand for?\nANSWER: Global Interpreter Lock\nspanning lines");

        assertTrue(improvement.isPresent());
        assertEquals("What does GIL stand for?", improvement.get().question());
        assertEquals("Global Interpreter Lock\nspanning lines", improvement.get().answer());
    }

    @Test
    @DisplayName("Should yield no improvement when a marker is missing or a section is empty")
    void testUnparseable() {
        assertTrue(CardImprover.parseResponse("Just a better card").isEmpty());
        assertTrue(CardImprover.parseResponse("QUESTION: only a question").isEmpty());
        assertTrue(CardImprover.parseResponse("QUESTION: \nANSWER: text").isEmpty());
        assertTrue(CardImprover.parseResponse(null).isEmpty());
    }

    @Test
    @DisplayName("Should send score and reasoning in the prompt with a creative temperature")
    void testImprove() {
        when(provider.complete(any(CompletionRequest.class))).thenReturn("QUESTION: Q2\nANSWER: A2");
        CardImprover improver = new CardImprover(provider, executor, "chat");

        Optional<CardImprovement> improvement = improver.improve(Card.newCard("Q", "A"), QualityGrade.of(3, "Too vague"));

        assertEquals(Optional.of(new CardImprovement("Q2", "A2")), improvement);
        ArgumentCaptor<CompletionRequest> captor = ArgumentCaptor.forClass(CompletionRequest.class);
        verify(provider).complete(captor.capture());
        assertTrue(captor.getValue().prompt().contains("3/10: Too vague"));
        assertEquals(0.3, captor.getValue().temperature());
    }

    @Test
    @DisplayName("Should key improvements by card index and drop failures")
    void testImproveAll() {
        when(provider.complete(any(CompletionRequest.class))).thenAnswer(inv -> {
            CompletionRequest request = inv.getArgument(0);
            if (request.prompt().contains("broken")) {
                throw new LLMException("timeout");
            }
            return "QUESTION: better\nANSWER: answer";
        });
        CardImprover improver = new CardImprover(provider, executor, "chat");
        List<Card> cards = List.of(Card.newCard("fine", "a"), Card.newCard("weak", "a"), Card.newCard("broken", "a"));

        Map<Integer, CardImprovement> improvements = improver.improveAll(cards,
                Map.of(1, QualityGrade.of(2, "weak"), 2, QualityGrade.of(1, "bad")), ProgressCallback.NOOP);

        assertEquals(Map.of(1, new CardImprovement("better", "answer")), improvements);
    }

    @Test
    @DisplayName("Should keep id, tags and archived flag when applied")
    void testApply() {
        Card card = Card.of("AbCd1234", "old", "old", List.of("t"), true);

        Card rewritten = new CardImprovement("new", "new").applyTo(card);

        assertEquals("AbCd1234", rewritten.id());
        assertEquals("new", rewritten.question());
        assertTrue(rewritten.archived());
    }
}
