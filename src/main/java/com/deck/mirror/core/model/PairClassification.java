package com.deck.mirror.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;

/**
 * Cached result of classifying a candidate pair.
 */
public record PairClassification(Classification classification, String reasoning) {

    public PairClassification {
        Objects.requireNonNull(classification, "classification is required");
        reasoning = reasoning != null ? reasoning : "";
    }

    public static PairClassification error(String reasoning) {
        return new PairClassification(Classification.ERROR, reasoning);
    }

    public static PairClassification unclear(String reasoning) {
        return new PairClassification(Classification.UNCLEAR, reasoning);
    }

    @JsonIgnore
    public boolean isError() {
        return classification == Classification.ERROR;
    }
}
