package com.deck.mirror.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forCommand should set correlationId, command and target in MDC")
    void forCommandSetsMDC() {
        try (LogContext ctx = LogContext.forCommand("push", "deck-python.md")) {
            assertNotNull(MDC.get("correlationId"));
            assertEquals("push", MDC.get("command"));
            assertEquals("deck-python.md", MDC.get("target"));
        }
    }

    @Test
    @DisplayName("forCommand should use an empty target when none is given")
    void forCommandWithoutTarget() {
        try (LogContext ctx = LogContext.forCommand("decks", null)) {
            assertEquals("", MDC.get("target"));
        }
    }

    @Test
    @DisplayName("forBatch should set batchId and operation in MDC")
    void forBatchSetsMDC() {
        try (LogContext ctx = LogContext.forBatch("batch-456", "classify")) {
            assertEquals("batch-456", MDC.get("batchId"));
            assertEquals("classify", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forDeck should mark decks without an id as new")
    void forDeckSetsMDC() {
        try (LogContext ctx = LogContext.forDeck(null, "push")) {
            assertEquals("new", MDC.get("deckId"));
            assertEquals("push", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("Try-with-resources should clean up MDC including added keys")
    void tryWithResourcesCleansUp() {
        try (LogContext ctx = LogContext.forDeck("AbCd1234", "sync").with("file", "deck-x-AbCd1234.md")) {
            assertEquals("deck-x-AbCd1234.md", MDC.get("file"));
        }
        assertNull(MDC.get("deckId"));
        assertNull(MDC.get("operation"));
        assertNull(MDC.get("file"));
    }

    @Test
    @DisplayName("Nested contexts should leave the outer keys in place")
    void nestedContexts() {
        try (LogContext outer = LogContext.forCommand("dedupe", "deck-x.md")) {
            String correlationId = MDC.get("correlationId");

            try (LogContext inner = LogContext.forBatch("batch-1", "classify")) {
                assertEquals("batch-1", MDC.get("batchId"));
                assertEquals(correlationId, MDC.get("correlationId"));
            }
            assertNull(MDC.get("batchId"));
            assertEquals(correlationId, MDC.get("correlationId"));
        }
        assertNull(MDC.get("correlationId"));
    }

    @Test
    @DisplayName("generateCorrelationId should return unique UUIDs")
    void generateCorrelationIdReturnsUniqueIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateCorrelationId());
        }
        assertEquals(100, ids.size(), "All generated IDs should be unique");
    }
}
