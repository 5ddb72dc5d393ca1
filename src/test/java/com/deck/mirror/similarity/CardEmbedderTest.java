package com.deck.mirror.similarity;

import com.deck.mirror.cache.InMemoryContentCache;
import com.deck.mirror.core.model.Card;
import com.deck.mirror.llm.LLMException;
import com.deck.mirror.llm.LLMProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CardEmbedderTest {

    private static final String MODEL = "embed-model";

    @Mock
    private LLMProvider provider;

    private InMemoryContentCache<float[]> cache;

    @BeforeEach
    void setUp() {
        cache = new InMemoryContentCache<>("embeddings");
    }

    private static List<float[]> vectorsFor(List<String> texts) {
        return texts.stream().map(t -> new float[]{t.length(), 1f}).toList();
    }

    @Test
    @DisplayName("Should embed question and answer joined by a newline, in batches")
    void testBatches() {
        when(provider.embed(eq(MODEL), anyList())).thenAnswer(inv -> vectorsFor(inv.getArgument(1)));
        CardEmbedder embedder = new CardEmbedder(provider, cache, MODEL, 2);
        List<Card> cards = List.of(Card.newCard("Q1", "A1"), Card.newCard("Q22", "A2"), Card.newCard("Q3", "A333"));

        List<float[]> vectors = embedder.embed(cards);

        assertEquals(3, vectors.size());
        assertArrayEquals(new float[]{5f, 1f}, vectors.get(0));
        assertArrayEquals(new float[]{7f, 1f}, vectors.get(2));
        verify(provider).embed(MODEL, List.of("Q1\nA1", "Q22\nA2"));
        verify(provider).embed(MODEL, List.of("Q3\nA333"));
        assertEquals(3, cache.size());
        assertEquals(1, cache.flushCount());
    }

    @Test
    @DisplayName("Should only send texts missing from the cache")
    void testCacheFirst() {
        when(provider.embed(eq(MODEL), anyList())).thenAnswer(inv -> vectorsFor(inv.getArgument(1)));
        CardEmbedder embedder = new CardEmbedder(provider, cache, MODEL, 10);
        embedder.embed(List.of(Card.newCard("Q1", "A1")));

        embedder.embed(List.of(Card.newCard("Q1", "A1"), Card.newCard("Q2", "A2")));

        verify(provider).embed(MODEL, List.of("Q1\nA1"));
        verify(provider).embed(MODEL, List.of("Q2\nA2"));
        verifyNoMoreInteractions(provider);
    }

    @Test
    @DisplayName("Should embed repeated content once")
    void testRepeatedContent() {
        when(provider.embed(eq(MODEL), anyList())).thenAnswer(inv -> vectorsFor(inv.getArgument(1)));
        CardEmbedder embedder = new CardEmbedder(provider, cache, MODEL, 10);

        List<float[]> vectors = embedder.embed(List.of(Card.newCard("Q", "A"), Card.of("id", "Q", "A")));

        assertSame(vectors.get(0), vectors.get(1));
        verify(provider, times(1)).embed(eq(MODEL), anyList());
    }

    @Test
    @DisplayName("Should keep earlier batches cached when a later batch fails")
    void testFailure() {
        when(provider.embed(eq(MODEL), anyList()))
                .thenAnswer(inv -> vectorsFor(inv.getArgument(1)))
                .thenThrow(new LLMException("rate limited"));
        CardEmbedder embedder = new CardEmbedder(provider, cache, MODEL, 1);

        assertThrows(LLMException.class,
                () -> embedder.embed(List.of(Card.newCard("Q1", "A1"), Card.newCard("Q2", "A2"))));

        assertEquals(1, cache.size());
        assertEquals(1, cache.flushCount());
    }

    @Test
    @DisplayName("Should reject a non-positive batch size")
    void testInvalidBatchSize() {
        assertThrows(IllegalArgumentException.class, () -> new CardEmbedder(provider, cache, MODEL, 0));
    }
}
