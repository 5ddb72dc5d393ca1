package com.deck.mirror.remote;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Deck resource as returned by the remote service.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RemoteDeck(String id, String name) {
}
