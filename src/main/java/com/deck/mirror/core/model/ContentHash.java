package com.deck.mirror.core.model;

import org.apache.commons.codec.digest.DigestUtils;

/**
 * Deterministic digest of a card's normalized question and answer.
 * Used for change detection during reconciliation and for exact-duplicate matching.
 *
 * <p>The digest is the first 16 hex characters of SHA-256 over
 * {@code trim(question) + "\n---\n" + trim(answer)}.</p>
 */
public final class ContentHash {

    /** Fixed length of every content hash, in hex characters. */
    public static final int LENGTH = 16;

    private static final String SEPARATOR = "\n---\n";

    private ContentHash() {
    }

    public static String of(String question, String answer) {
        String normalized = normalize(question) + SEPARATOR + normalize(answer);
        return DigestUtils.sha256Hex(normalized).substring(0, LENGTH);
    }

    static String normalize(String text) {
        return text == null ? "" : text.strip();
    }
}
