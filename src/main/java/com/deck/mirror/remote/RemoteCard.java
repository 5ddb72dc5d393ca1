package com.deck.mirror.remote;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Card resource as returned by the remote service.
 * {@code content} is the two-part {@code question\n---\nanswer} string.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RemoteCard(
        String id,
        String content,
        @JsonProperty("deck-id") String deckId,
        List<String> tags,
        @JsonProperty("archived?") Boolean archived
) {
    public RemoteCard {
        content = content != null ? content : "";
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    public boolean isArchived() {
        return Boolean.TRUE.equals(archived);
    }
}
