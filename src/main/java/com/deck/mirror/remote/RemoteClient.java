package com.deck.mirror.remote;

import java.util.List;

/**
 * Narrow interface to the remote card-management service.
 * Every method fails with {@link RemoteException}; none of them retries.
 */
public interface RemoteClient {

    List<RemoteDeck> listDecks();

    RemoteDeck getDeck(String deckId);

    RemoteDeck createDeck(String name);

    /**
     * Lists all cards of a deck, following the bookmark pagination until the
     * server returns an empty page or no bookmark.
     */
    List<RemoteCard> listCards(String deckId);

    RemoteCard createCard(String deckId, String content, CardOptions options);

    RemoteCard updateCard(String cardId, String content, CardOptions options);

    boolean deleteCard(String cardId);
}
