package com.deck.mirror.codec;

import com.deck.mirror.core.model.DeckRef;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Deck file naming: {@code deck-<name>-<deckId>.md} for decks that exist remotely and
 * {@code deck-<name>.md} for decks that have not been created yet.
 *
 * <p>A remote deck id is an 8-character alphanumeric token containing both an
 * uppercase and a lowercase letter. Any other trailing token is part of the name.</p>
 */
public final class DeckFileName {

    public static final String PREFIX = "deck-";
    public static final String EXTENSION = ".md";
    public static final String GLOB = "deck-*.md";

    private static final int DECK_ID_LENGTH = 8;

    private DeckFileName() {
    }

    /**
     * Extracts the remote deck id from a deck file name.
     *
     * @return the id, or empty when the file names a deck that is not created yet
     * @throws ValidationException if the name does not follow the deck file pattern
     */
    public static Optional<String> extractDeckId(Path file) {
        String rest = stemWithoutPrefix(file);
        int lastHyphen = rest.lastIndexOf('-');
        if (lastHyphen < 0) {
            return Optional.empty();
        }
        String candidate = rest.substring(lastHyphen + 1);
        return isDeckId(candidate) ? Optional.of(candidate) : Optional.empty();
    }

    /**
     * Returns the deck name part of the file name, without prefix, id and extension.
     */
    public static String deckName(Path file) {
        String rest = stemWithoutPrefix(file);
        Optional<String> deckId = extractDeckId(file);
        if (deckId.isPresent()) {
            return rest.substring(0, rest.length() - deckId.get().length() - 1);
        }
        return rest;
    }

    public static DeckRef toDeckRef(Path file) {
        return new DeckRef(extractDeckId(file).orElse(null), deckName(file));
    }

    public static boolean isDeckId(String token) {
        if (token == null || token.length() != DECK_ID_LENGTH) {
            return false;
        }
        boolean upper = false;
        boolean lower = false;
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (!isAsciiAlphanumeric(c)) {
                return false;
            }
            upper |= c >= 'A' && c <= 'Z';
            lower |= c >= 'a' && c <= 'z';
        }
        return upper && lower;
    }

    /**
     * Builds the file name for a deck that exists remotely.
     */
    public static String fileName(String deckName, String deckId) {
        return PREFIX + sanitize(deckName) + "-" + deckId + EXTENSION;
    }

    /**
     * Lower-cases a deck name and reduces it to word characters separated by single hyphens.
     */
    public static String sanitize(String name) {
        String cleaned = name.replaceAll("[^\\w\\s-]", "")
                .replaceAll("[-\\s]+", "-")
                .replaceAll("^-+|-+$", "")
                .toLowerCase(Locale.ROOT);
        return cleaned.isEmpty() ? "untitled" : cleaned;
    }

    private static String stemWithoutPrefix(Path file) {
        String name = file.getFileName().toString();
        String stem = name.endsWith(EXTENSION) ? name.substring(0, name.length() - EXTENSION.length()) : name;
        if (!stem.startsWith(PREFIX) || stem.length() == PREFIX.length()) {
            throw new ValidationException("Invalid filename format. Expected: deck-<name>-<deck_id>.md or deck-<name>.md, got: " + name);
        }
        return stem.substring(PREFIX.length());
    }

    private static boolean isAsciiAlphanumeric(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
    }
}
