package com.deck.mirror.codec;

import com.deck.mirror.core.model.Card;
import com.deck.mirror.core.model.DeckRef;

import java.nio.file.Path;
import java.util.List;

/**
 * A deck file that passed validation.
 */
public record LoadedDeck(Path path, DeckRef deck, List<Card> cards) {

    public LoadedDeck {
        cards = List.copyOf(cards);
    }
}
