package com.deck.mirror.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and automatically removes them on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forCommand("push", "deck-python-AbCdEfGh.md")) {
 *     log.info("push.applied created={} updated={}", created, updated);
 * } // MDC entries are automatically cleared
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for one CLI command.
     */
    public static LogContext forCommand(String command, String target) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", generateCorrelationId());
        ctx.put("command", command);
        ctx.put("target", target != null ? target : "");
        return ctx;
    }

    /**
     * Creates a log context for a batch of model requests.
     */
    public static LogContext forBatch(String batchId, String operation) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("operation", operation);
        return ctx;
    }

    /**
     * Creates a log context for reconciling one deck.
     */
    public static LogContext forDeck(String deckId, String mode) {
        LogContext ctx = new LogContext();
        ctx.put("deckId", deckId != null ? deckId : "new");
        ctx.put("operation", mode);
        return ctx;
    }

    /**
     * Generates a unique correlation ID.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
