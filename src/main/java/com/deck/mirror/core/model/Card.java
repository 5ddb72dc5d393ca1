package com.deck.mirror.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A question/answer flashcard as mirrored in a local deck file.
 *
 * <p>{@code id} is the remote identifier and is {@code null} until the remote service
 * has created the card. Tags are compared as a set; their insertion order is only
 * kept so serialization is stable. The content hash is always derived from the
 * question and answer and is never stored.</p>
 */
public record Card(
        String id,
        String question,
        String answer,
        Set<String> tags,
        boolean archived
) {
    public Card {
        Objects.requireNonNull(question, "question is required");
        Objects.requireNonNull(answer, "answer is required");
        tags = tags == null || tags.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
        if (id != null && id.isBlank()) {
            id = null;
        }
    }

    /**
     * Creates a card that has not been created remotely yet.
     */
    public static Card newCard(String question, String answer) {
        return new Card(null, question, answer, Set.of(), false);
    }

    public static Card of(String id, String question, String answer) {
        return new Card(id, question, answer, Set.of(), false);
    }

    public static Card of(String id, String question, String answer, Collection<String> tags, boolean archived) {
        return new Card(id, question, answer, tags == null ? Set.of() : new LinkedHashSet<>(tags), archived);
    }

    public String contentHash() {
        return ContentHash.of(question, answer);
    }

    public boolean hasId() {
        return id != null;
    }

    /**
     * A card is valid only when both question and answer are non-empty after trimming.
     */
    public boolean isValid() {
        return !question.isBlank() && !answer.isBlank();
    }

    public Card withId(String newId) {
        return new Card(newId, question, answer, tags, archived);
    }

    public Card withContent(String newQuestion, String newAnswer) {
        return new Card(id, newQuestion, newAnswer, tags, archived);
    }

    /**
     * Remote wire representation of the content: {@code question\n---\nanswer}.
     */
    public String content() {
        return question + "\n---\n" + answer;
    }

    /**
     * Shortened question for plans and prompts.
     */
    public String preview(int maxLength) {
        String q = question.replace('\n', ' ');
        return q.length() > maxLength ? q.substring(0, maxLength) + "..." : q;
    }
}
