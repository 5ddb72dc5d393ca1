package com.deck.mirror.codec;

import com.deck.mirror.core.model.Card;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Loads, validates and writes deck files on disk (UTF-8).
 * Writes go through a temporary file and a move so a deck file is never left half written.
 */
public class DeckFile {
    private static final Logger log = LoggerFactory.getLogger(DeckFile.class);

    private final DeckMarkdownCodec codec;

    public DeckFile() {
        this(new DeckMarkdownCodec());
    }

    public DeckFile(DeckMarkdownCodec codec) {
        this.codec = codec;
    }

    /**
     * Loads and validates a deck file before it is pushed or synced.
     *
     * @throws ValidationException when the file is missing, empty, badly named,
     *                             has no cards, has an empty question or answer,
     *                             or repeats a card id
     */
    public LoadedDeck load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ValidationException("Deck file not found: " + file);
        }
        String content = readText(file);
        if (content.isBlank()) {
            throw new ValidationException("Deck file is empty: " + file);
        }

        var deck = DeckFileName.toDeckRef(file);
        List<Card> cards = codec.parse(content);
        if (cards.isEmpty()) {
            throw new ValidationException("No cards found in deck file: " + file);
        }

        Set<String> seenIds = new HashSet<>();
        for (int i = 0; i < cards.size(); i++) {
            Card card = cards.get(i);
            int position = i + 1;
            if (card.question().isBlank()) {
                throw new ValidationException("Card " + position + ": Empty question");
            }
            if (card.answer().isBlank()) {
                throw new ValidationException("Card " + position + ": Empty answer");
            }
            if (card.hasId() && !seenIds.add(card.id())) {
                throw new ValidationException("Card " + position + ": Duplicate card_id " + card.id());
            }
        }

        log.debug("deckfile.loaded path={} cards={} deckId={}", file, cards.size(), deck.deckId());
        return new LoadedDeck(file, deck, cards);
    }

    /**
     * Reads cards without the push-time validation rules. Missing files read as empty.
     */
    public List<Card> read(Path file) {
        if (!Files.isRegularFile(file)) {
            return List.of();
        }
        return codec.parse(readText(file));
    }

    /**
     * Writes cards to a deck file, replacing it.
     *
     * @throws ValidationException if the serialized text would not read back as the same
     *                             cards; the file is left untouched
     */
    public void write(Path file, List<Card> cards) {
        String text = codec.serialize(cards);
        verifyReadsBack(file, cards, codec.parse(text));

        Path parent = file.toAbsolutePath().getParent();
        try {
            Files.createDirectories(parent);
            Path tmp = Files.createTempFile(parent, ".deck-", ".tmp");
            try {
                Files.writeString(tmp, text, StandardCharsets.UTF_8);
                moveReplacing(tmp, file);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write deck file " + file, e);
        }
        log.debug("deckfile.written path={} cards={}", file, cards.size());
    }

    /**
     * Lists {@code deck-*.md} files in a directory, sorted by name.
     */
    public List<Path> findDeckFiles(Path directory) {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, DeckFileName.GLOB)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path)) {
                    files.add(path);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list deck files in " + directory, e);
        }
        files.sort(null);
        return files;
    }

    public DeckMarkdownCodec codec() {
        return codec;
    }

    private static void verifyReadsBack(Path file, List<Card> written, List<Card> parsed) {
        if (parsed.size() != written.size()) {
            throw new ValidationException("Cannot write " + file.getFileName() + ": " + written.size()
                    + " cards would read back as " + parsed.size());
        }
        for (int i = 0; i < written.size(); i++) {
            Card expected = written.get(i);
            Card actual = parsed.get(i);
            boolean same = Objects.equals(expected.id(), actual.id())
                    && expected.contentHash().equals(actual.contentHash())
                    && expected.tags().equals(actual.tags())
                    && expected.archived() == actual.archived();
            if (!same) {
                throw new ValidationException("Cannot write " + file.getFileName() + ": card " + (i + 1)
                        + " would not read back unchanged: " + expected.preview(60));
            }
        }
    }

    private String readText(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ValidationException("Cannot read file " + file + ": " + e.getMessage(), e);
        }
    }

    private void moveReplacing(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
