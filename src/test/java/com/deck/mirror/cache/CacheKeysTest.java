package com.deck.mirror.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CacheKeysTest {

    private static final String TEMPLATE = "Compare {question1} and {question2}";

    @Test
    @DisplayName("Should be deterministic")
    void testDeterministic() {
        assertEquals(CacheKeys.derive("model-a", TEMPLATE, "q1", "a1"),
                CacheKeys.derive("model-a", TEMPLATE, List.of("q1", "a1")));
    }

    @Test
    @DisplayName("Should change with the model")
    void testModelChangesKey() {
        assertNotEquals(CacheKeys.derive("model-a", TEMPLATE, "q1"),
                CacheKeys.derive("model-b", TEMPLATE, "q1"));
    }

    @Test
    @DisplayName("Should change with a single template character")
    void testTemplateChangesKey() {
        assertNotEquals(CacheKeys.derive("model-a", TEMPLATE, "q1"),
                CacheKeys.derive("model-a", TEMPLATE + ".", "q1"));
    }

    @Test
    @DisplayName("Should depend on input order")
    void testInputOrder() {
        assertNotEquals(CacheKeys.derive("m", TEMPLATE, "a", "b"),
                CacheKeys.derive("m", TEMPLATE, "b", "a"));
    }

    @Test
    @DisplayName("Should not let inputs run into each other")
    void testInputBoundaries() {
        assertNotEquals(CacheKeys.derive("m", TEMPLATE, "ab", "c"),
                CacheKeys.derive("m", TEMPLATE, "a", "bc"));
    }

    @Test
    @DisplayName("Should ignore surrounding whitespace of inputs")
    void testWhitespaceNormalized() {
        assertEquals(CacheKeys.derive("m", TEMPLATE, "q1 ", "\na1"),
                CacheKeys.derive("m", TEMPLATE, "q1", "a1"));
    }

    @Test
    @DisplayName("Should be a 64-character hex digest")
    void testFormat() {
        assertTrue(CacheKeys.derive("m", TEMPLATE, "x").matches("[0-9a-f]{64}"));
    }
}
