package com.deck.mirror.reconcile;

import com.deck.mirror.codec.DeckFile;
import com.deck.mirror.core.model.Card;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Stores the last state both sides agreed on, per deck, as a deck file under
 * {@code .deck-mirror/base/<deckId>.md} next to the deck file.
 *
 * <p>The snapshot is advisory. A missing or unreadable snapshot reads as empty,
 * which makes the next merge treat every differing card as a conflict and keep
 * the local version.</p>
 */
public class BaseSnapshotStore {
    private static final Logger log = LoggerFactory.getLogger(BaseSnapshotStore.class);

    static final String DIRECTORY = ".deck-mirror";
    static final String BASE_DIRECTORY = "base";

    private final DeckFile deckFile;

    public BaseSnapshotStore(DeckFile deckFile) {
        this.deckFile = deckFile;
    }

    public Path snapshotPath(Path deckPath, String deckId) {
        Path parent = deckPath.toAbsolutePath().getParent();
        return parent.resolve(DIRECTORY).resolve(BASE_DIRECTORY).resolve(deckId + ".md");
    }

    public List<Card> load(Path deckPath, String deckId) {
        Path path = snapshotPath(deckPath, deckId);
        try {
            List<Card> cards = deckFile.read(path);
            log.debug("snapshot.loaded deckId={} cards={}", deckId, cards.size());
            return cards;
        } catch (RuntimeException e) {
            log.warn("snapshot.load_failed deckId={} path={} error={}", deckId, path, e.getMessage());
            return List.of();
        }
    }

    public void save(Path deckPath, String deckId, List<Card> cards) {
        Path path = snapshotPath(deckPath, deckId);
        try {
            deckFile.write(path, cards);
            log.debug("snapshot.saved deckId={} cards={}", deckId, cards.size());
        } catch (UncheckedIOException e) {
            log.warn("snapshot.save_failed deckId={} path={} error={}", deckId, path, e.getMessage());
        }
    }
}
