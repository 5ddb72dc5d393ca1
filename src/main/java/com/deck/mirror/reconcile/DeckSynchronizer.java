package com.deck.mirror.reconcile;

import com.deck.mirror.codec.DeckFile;
import com.deck.mirror.codec.DeckFileName;
import com.deck.mirror.codec.LoadedDeck;
import com.deck.mirror.codec.ValidationException;
import com.deck.mirror.console.UserConsole;
import com.deck.mirror.core.model.Card;
import com.deck.mirror.logging.LogContext;
import com.deck.mirror.metrics.MetricsService;
import com.deck.mirror.metrics.NoOpMetricsService;
import com.deck.mirror.remote.CardOptions;
import com.deck.mirror.remote.RemoteCard;
import com.deck.mirror.remote.RemoteCards;
import com.deck.mirror.remote.RemoteClient;
import com.deck.mirror.remote.RemoteDeck;
import com.deck.mirror.remote.RemoteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Applies reconciliation plans: pulls remote decks into local files and pushes or
 * syncs local files to the remote service.
 *
 * <p>Every mutating run prints its plan and asks for confirmation unless
 * {@link SyncOptions#assumeYes()} is set; declining performs no mutation on either
 * side. Remote mutations run in the order creates, updates, deletes. If a remote
 * call fails midway, ids already assigned to created cards are still written to the
 * local file before the error propagates, so a re-run does not create them twice.</p>
 *
 * <pre>
 * DeckSynchronizer synchronizer = DeckSynchronizer.builder()
 *     .remoteClient(client)
 *     .console(console)
 *     .build();
 * SyncReport report = synchronizer.push(Path.of("deck-python-AbCdEfGh.md"), SyncOptions.defaults());
 * </pre>
 */
public class DeckSynchronizer {
    private static final Logger log = LoggerFactory.getLogger(DeckSynchronizer.class);

    private static final int PREVIEW_LENGTH = 60;

    private final RemoteClient remoteClient;
    private final DeckFile deckFile;
    private final ReconciliationEngine engine;
    private final BaseSnapshotStore snapshots;
    private final UserConsole console;
    private final MetricsService metricsService;

    private DeckSynchronizer(Builder builder) {
        this.remoteClient = builder.remoteClient;
        this.deckFile = builder.deckFile;
        this.engine = builder.engine;
        this.snapshots = builder.snapshots != null ? builder.snapshots : new BaseSnapshotStore(builder.deckFile);
        this.console = builder.console;
        this.metricsService = builder.metricsService;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<RemoteDeck> listDecks() {
        return remoteClient.listDecks();
    }

    /**
     * Finds a remote deck by exact id or name, or else by a case-insensitive
     * substring of its name.
     */
    public Optional<RemoteDeck> findDeck(String idOrName) {
        List<RemoteDeck> decks = remoteClient.listDecks();
        for (RemoteDeck deck : decks) {
            if (deck.id().equals(idOrName) || idOrName.equals(deck.name())) {
                return Optional.of(deck);
            }
        }
        String wanted = idOrName.toLowerCase(Locale.ROOT);
        for (RemoteDeck deck : decks) {
            if (deck.name() != null && deck.name().toLowerCase(Locale.ROOT).contains(wanted)) {
                return Optional.of(deck);
            }
        }
        return Optional.empty();
    }

    // ========== Pull ==========

    /**
     * Fetches a remote deck into {@code directory}. A new file is written as is; an
     * existing file for the same deck is three-way merged against the base snapshot.
     */
    public PullReport pull(String deckId, Path directory, SyncOptions options) {
        try (LogContext ctx = LogContext.forDeck(deckId, "pull")) {
            RemoteDeck deck = remoteClient.getDeck(deckId);
            List<Card> remote = RemoteCards.toCards(remoteClient.listCards(deckId));
            warnUnanswered(remote);
            Path target = existingFileFor(directory, deckId)
                    .orElseGet(() -> directory.resolve(DeckFileName.fileName(deck.name(), deckId)));

            if (!Files.exists(target)) {
                deckFile.write(target, remote);
                snapshots.save(target, deckId, remote);
                console.println("Pulled " + remote.size() + " cards into " + target.getFileName());
                log.info("pull.written deckId={} file={} cards={}", deckId, target, remote.size());
                return new PullReport(target, remote.size(), false, false, List.of());
            }

            List<Card> local = deckFile.read(target);
            List<Card> base = snapshots.load(target, deckId);
            MergeOutcome outcome = engine.merge(base, local, remote);
            printMerge(target, outcome);

            if (!options.assumeYes() && !console.confirm("Overwrite " + target.getFileName() + " with the merged deck?")) {
                console.println("Aborted. No files were changed.");
                log.info("pull.aborted deckId={}", deckId);
                return new PullReport(target, local.size(), true, true, outcome.conflicts());
            }

            deckFile.write(target, outcome.merged());
            snapshots.save(target, deckId, outcome.newBase());
            log.info("pull.merged deckId={} file={} cards={} conflicts={}",
                    deckId, target, outcome.merged().size(), outcome.conflicts().size());
            return new PullReport(target, outcome.merged().size(), true, false, outcome.conflicts());
        }
    }

    /**
     * Remote content without a delimiter reads as a question with an empty answer.
     * Such cards are kept so nothing is lost, but push refuses the file until they are filled in.
     */
    private void warnUnanswered(List<Card> remote) {
        List<Card> unanswered = remote.stream()
                .filter(card -> card.answer().isBlank())
                .toList();
        if (unanswered.isEmpty()) {
            return;
        }
        console.println("WARNING: " + unanswered.size() + " remote card(s) have no answer section;"
                + " add an answer before pushing:");
        for (Card card : unanswered) {
            console.println("  [" + card.id() + "] " + card.preview(PREVIEW_LENGTH));
        }
        log.warn("pull.unanswered_cards count={}", unanswered.size());
    }

    private Optional<Path> existingFileFor(Path directory, String deckId) {
        if (!Files.isDirectory(directory)) {
            return Optional.empty();
        }
        for (Path file : deckFile.findDeckFiles(directory)) {
            try {
                if (DeckFileName.extractDeckId(file).filter(deckId::equals).isPresent()) {
                    return Optional.of(file);
                }
            } catch (ValidationException e) {
                log.debug("pull.skip_file file={} reason={}", file, e.getMessage());
            }
        }
        return Optional.empty();
    }

    private void printMerge(Path target, MergeOutcome outcome) {
        console.println("Merging remote changes into " + target.getFileName() + ":");
        console.println("  accepted from remote: " + outcome.acceptedRemote());
        console.println("  new remote cards:     " + outcome.addedRemote());
        console.println("  deleted locally:      " + outcome.droppedLocally());
        console.println("  deleted remotely:     " + outcome.droppedRemotely());
        if (outcome.hasConflicts()) {
            console.println("  conflicts (local version kept): " + outcome.conflicts().size());
            for (MergeConflict conflict : outcome.conflicts()) {
                console.println("    [" + conflict.cardId() + "] " + conflict.kind() + ": "
                        + conflict.local().preview(PREVIEW_LENGTH));
            }
        }
    }

    // ========== Push ==========

    /**
     * Pushes a deck file one way. A file without a deck id creates the remote deck
     * and is renamed to carry the new id.
     *
     * @throws InconsistencyException if local cards reference ids the remote deck lacks
     * @throws ValidationException    if the file does not validate
     */
    public SyncReport push(Path file, SyncOptions options) {
        LoadedDeck loaded = deckFile.load(file);
        String deckId = loaded.deck().deckId();
        try (LogContext ctx = LogContext.forDeck(deckId, "push").with("file", file.getFileName().toString())) {
            List<Card> remote = deckId == null
                    ? List.of()
                    : RemoteCards.toCards(remoteClient.listCards(deckId));
            OperationSet plan = engine.planPush(loaded.cards(), remote, options.force());
            return apply(loaded, plan, options, false);
        }
    }

    /**
     * Pushes every {@code deck-*.md} file in a directory after a single confirmation.
     * A failing file is reported and does not stop the others.
     */
    public List<SyncReport> pushAll(Path directory, SyncOptions options) {
        List<Path> files = deckFile.findDeckFiles(directory);
        if (files.isEmpty()) {
            console.println("No deck files found in " + directory);
            return List.of();
        }
        console.println("Found " + files.size() + " deck file(s):");
        for (Path file : files) {
            console.println("  " + file.getFileName());
        }
        if (!options.assumeYes() && !console.confirm("Push all " + files.size() + " decks?")) {
            console.println("Aborted.");
            return List.of();
        }

        SyncOptions perFile = new SyncOptions(options.force(), true);
        List<SyncReport> reports = new ArrayList<>();
        for (Path file : files) {
            console.println();
            console.println("== " + file.getFileName());
            try {
                reports.add(push(file, perFile));
            } catch (ValidationException | InconsistencyException | RemoteException e) {
                log.warn("push.file_failed file={} error={}", file, e.getMessage());
                console.println("Failed: " + e.getMessage());
                reports.add(SyncReport.withoutChanges(file, null, SyncReport.Status.FAILED, List.of()));
            }
        }
        return reports;
    }

    // ========== Sync ==========

    /**
     * Bidirectional sync: like push, but cards deleted remotely are removed locally.
     *
     * @throws ValidationException if the file has no deck id or does not validate
     */
    public SyncReport sync(Path file, SyncOptions options) {
        LoadedDeck loaded = deckFile.load(file);
        String deckId = loaded.deck().deckId();
        if (deckId == null) {
            throw new ValidationException("Cannot sync " + file.getFileName()
                    + ": no deck id in filename. Push it first to create the deck.");
        }
        try (LogContext ctx = LogContext.forDeck(deckId, "sync").with("file", file.getFileName().toString())) {
            List<Card> remote = RemoteCards.toCards(remoteClient.listCards(deckId));
            OperationSet plan = engine.planSync(loaded.cards(), remote, options.force());
            return apply(loaded, plan, options, true);
        }
    }

    // ========== Apply ==========

    private SyncReport apply(LoadedDeck loaded, OperationSet plan, SyncOptions options, boolean sync) {
        Path file = loaded.path();
        String deckId = loaded.deck().deckId();

        if (plan.hasDuplicates()) {
            printDuplicates(plan);
            console.println("Aborting. Run with --force to create these cards anyway.");
            log.info("reconcile.blocked_by_duplicates file={} duplicates={}", file, plan.duplicates().size());
            return SyncReport.withoutChanges(file, deckId, SyncReport.Status.BLOCKED_BY_DUPLICATES, plan.duplicates());
        }

        if (plan.isEmpty() && deckId != null) {
            console.println(file.getFileName() + " is up to date.");
            snapshots.save(file, deckId, loaded.cards());
            return SyncReport.withoutChanges(file, deckId, SyncReport.Status.UP_TO_DATE, List.of());
        }

        printPlan(loaded, plan);
        if (!options.assumeYes() && !console.confirm("Apply these changes?")) {
            console.println("Aborted. Nothing was changed.");
            log.info("reconcile.aborted file={}", file);
            return SyncReport.withoutChanges(file, deckId, SyncReport.Status.ABORTED, List.of());
        }

        if (deckId == null) {
            RemoteDeck created = remoteClient.createDeck(loaded.deck().deckName());
            metricsService.incrementRemoteMutation("create_deck");
            deckId = created.id();
            Path renamed = file.resolveSibling(DeckFileName.fileName(loaded.deck().deckName(), deckId));
            file = rename(file, renamed);
            console.println("Created deck '" + created.name() + "' (" + deckId + "), file renamed to " + file.getFileName());
            log.info("push.deck_created deckId={} file={}", deckId, file);
        }

        Map<Card, String> assignedIds = new IdentityHashMap<>();
        int updated = 0;
        int deletedRemote = 0;
        try {
            for (Card card : plan.toCreate()) {
                RemoteCard created = remoteClient.createCard(deckId, card.content(), CardOptions.from(card));
                metricsService.incrementRemoteMutation("create");
                assignedIds.put(card, created.id());
            }
            for (Card card : plan.toUpdate()) {
                remoteClient.updateCard(card.id(), card.content(), CardOptions.from(card));
                metricsService.incrementRemoteMutation("update");
                updated++;
            }
            for (Card card : plan.toDeleteRemote()) {
                remoteClient.deleteCard(card.id());
                metricsService.incrementRemoteMutation("delete");
                deletedRemote++;
            }
        } catch (RemoteException e) {
            log.error("reconcile.apply_failed file={} created={} updated={} deleted={} status={}",
                    file, assignedIds.size(), updated, deletedRemote, e.getStatus());
            if (!assignedIds.isEmpty()) {
                deckFile.write(file, withAssignedIds(loaded.cards(), assignedIds, Set.of()));
                console.println("Saved ids of " + assignedIds.size() + " card(s) created before the failure.");
            }
            throw e;
        }

        Set<String> removedLocally = sync
                ? plan.toDeleteLocal().stream().map(Card::id).collect(Collectors.toSet())
                : Set.of();
        List<Card> finalCards = withAssignedIds(loaded.cards(), assignedIds, removedLocally);
        if (!assignedIds.isEmpty() || !removedLocally.isEmpty()) {
            deckFile.write(file, finalCards);
        }
        snapshots.save(file, deckId, finalCards);

        SyncReport report = new SyncReport(file, deckId, SyncReport.Status.APPLIED,
                assignedIds.size(), updated, deletedRemote, removedLocally.size(), List.of());
        console.println("Done: " + report.created() + " created, " + report.updated() + " updated, "
                + report.deletedRemote() + " deleted remotely"
                + (sync ? ", " + report.deletedLocal() + " removed locally" : "") + ".");
        log.info("reconcile.applied file={} deckId={} created={} updated={} deletedRemote={} deletedLocal={}",
                file, deckId, report.created(), report.updated(), report.deletedRemote(), report.deletedLocal());
        return report;
    }

    private static List<Card> withAssignedIds(List<Card> cards, Map<Card, String> assignedIds, Set<String> removed) {
        List<Card> result = new ArrayList<>(cards.size());
        for (Card card : cards) {
            String assigned = assignedIds.get(card);
            if (assigned != null) {
                result.add(card.withId(assigned));
            } else if (!card.hasId() || !removed.contains(card.id())) {
                result.add(card);
            }
        }
        return result;
    }

    private Path rename(Path from, Path to) {
        if (from.equals(to)) {
            return from;
        }
        try {
            return Files.move(from, to);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot rename " + from + " to " + to, e);
        }
    }

    private void printPlan(LoadedDeck loaded, OperationSet plan) {
        String target = loaded.deck().isCreated()
                ? "deck " + loaded.deck().deckId()
                : "new deck '" + loaded.deck().deckName() + "'";
        console.println("Plan for " + loaded.path().getFileName() + " -> " + target + ":");
        printCards("create", plan.toCreate());
        printCards("update", plan.toUpdate());
        printCards("delete remotely", plan.toDeleteRemote());
        if (!plan.toDeleteLocal().isEmpty()) {
            console.println("  WARNING: the following cards were deleted remotely and will be removed from the local file:");
            printCards("remove locally", plan.toDeleteLocal());
        }
    }

    private void printCards(String label, List<Card> cards) {
        if (cards.isEmpty()) {
            return;
        }
        console.println("  " + label + ": " + cards.size());
        for (Card card : cards) {
            String id = card.hasId() ? "[" + card.id() + "] " : "";
            console.println("    " + id + card.preview(PREVIEW_LENGTH));
        }
    }

    private void printDuplicates(OperationSet plan) {
        console.println("Found " + plan.duplicates().size() + " new card(s) whose content already exists remotely:");
        for (DuplicateMatch match : plan.duplicates()) {
            console.println("  " + match.localCard().preview(PREVIEW_LENGTH) + " (remote " + match.remoteCardId() + ")");
        }
    }

    public static class Builder {
        private RemoteClient remoteClient;
        private DeckFile deckFile = new DeckFile();
        private ReconciliationEngine engine = new ReconciliationEngine();
        private BaseSnapshotStore snapshots;
        private UserConsole console;
        private MetricsService metricsService = new NoOpMetricsService();

        public Builder remoteClient(RemoteClient remoteClient) {
            this.remoteClient = remoteClient;
            return this;
        }

        public Builder deckFile(DeckFile deckFile) {
            this.deckFile = deckFile;
            return this;
        }

        public Builder engine(ReconciliationEngine engine) {
            this.engine = engine;
            return this;
        }

        public Builder snapshots(BaseSnapshotStore snapshots) {
            this.snapshots = snapshots;
            return this;
        }

        public Builder console(UserConsole console) {
            this.console = console;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public DeckSynchronizer build() {
            if (remoteClient == null) {
                throw new IllegalStateException("RemoteClient is required");
            }
            if (console == null) {
                throw new IllegalStateException("UserConsole is required");
            }
            return new DeckSynchronizer(this);
        }
    }
}
