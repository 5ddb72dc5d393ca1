package com.deck.mirror.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Relationship between two similar cards as judged by the LLM.
 */
public enum Classification {
    /** Same concept, one card is redundant. */
    DUPLICATE,

    /** Related but covering different aspects; both are kept. */
    COMPLEMENTARY,

    /** The model could not decide, or its answer could not be parsed. */
    UNCLEAR,

    /** The request failed. Never cached. */
    ERROR;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Classification fromLabel(String label) {
        return parse(label).orElseThrow(() -> new IllegalArgumentException("Unknown classification: " + label));
    }

    /**
     * Parses one of the labels the model may answer with. {@code error} is not a model label.
     */
    public static Optional<Classification> parseModelLabel(String label) {
        return parse(label).filter(c -> c != ERROR);
    }

    private static Optional<Classification> parse(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String normalized = label.strip().toLowerCase(Locale.ROOT);
        for (Classification c : values()) {
            if (c.label().equals(normalized)) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }
}
