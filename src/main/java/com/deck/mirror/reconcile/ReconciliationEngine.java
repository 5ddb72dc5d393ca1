package com.deck.mirror.reconcile;

import com.deck.mirror.core.model.Card;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes the operations that bring a local deck and the remote deck together.
 * Pure: it never calls the remote service and never touches the file system.
 *
 * <h2>Modes</h2>
 * <ul>
 *   <li><b>Push</b> - local is authoritative. A local id missing remotely is fatal.</li>
 *   <li><b>Sync</b> - as push, but a local id missing remotely means the card was
 *       deleted remotely and is removed locally.</li>
 *   <li><b>Merge</b> - three-way merge of base, local and remote used by pull.
 *       On a true conflict the local edit wins and the conflict is reported.</li>
 * </ul>
 */
public class ReconciliationEngine {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    private enum Mode {
        PUSH,
        SYNC
    }

    /**
     * Plans a one-way push of the local deck.
     *
     * @param force create id-less cards even when their content already exists remotely
     * @throws InconsistencyException if a local card's id is not in the remote deck
     */
    public OperationSet planPush(List<Card> local, List<Card> remote, boolean force) {
        return plan(local, remote, force, Mode.PUSH);
    }

    /**
     * Plans a bidirectional sync of the local deck.
     */
    public OperationSet planSync(List<Card> local, List<Card> remote, boolean force) {
        return plan(local, remote, force, Mode.SYNC);
    }

    private OperationSet plan(List<Card> local, List<Card> remote, boolean force, Mode mode) {
        Map<String, Card> remoteById = indexById(remote);
        Map<String, String> remoteIdByHash = new HashMap<>();
        for (Card card : remote) {
            remoteIdByHash.putIfAbsent(card.contentHash(), card.id());
        }

        List<Card> toCreate = new ArrayList<>();
        List<Card> toUpdate = new ArrayList<>();
        List<Card> toDeleteLocal = new ArrayList<>();
        List<DuplicateMatch> duplicates = new ArrayList<>();
        List<Card> missingRemote = new ArrayList<>();
        Set<String> localIds = new HashSet<>();

        for (Card card : local) {
            if (card.hasId()) {
                localIds.add(card.id());
                Card remoteCard = remoteById.get(card.id());
                if (remoteCard == null) {
                    missingRemote.add(card);
                } else if (!card.contentHash().equals(remoteCard.contentHash())) {
                    toUpdate.add(card);
                }
            } else {
                String existing = remoteIdByHash.get(card.contentHash());
                if (existing != null && !force) {
                    duplicates.add(new DuplicateMatch(card, existing));
                } else {
                    toCreate.add(card);
                }
            }
        }

        if (!missingRemote.isEmpty()) {
            if (mode == Mode.PUSH) {
                log.warn("reconcile.inconsistency missing={}", missingRemote.size());
                throw new InconsistencyException(missingRemote);
            }
            toDeleteLocal.addAll(missingRemote);
        }

        List<Card> toDeleteRemote = new ArrayList<>();
        for (Card card : remote) {
            if (!localIds.contains(card.id())) {
                toDeleteRemote.add(card);
            }
        }

        OperationSet operations = new OperationSet(toCreate, toUpdate, toDeleteRemote, toDeleteLocal, duplicates);
        log.debug("reconcile.planned mode={} local={} remote={} result={}", mode, local.size(), remote.size(), operations);
        return operations;
    }

    /**
     * Three-way merge used by pull.
     *
     * <p>Local cards keep their order; cards new on the remote side are appended in
     * remote order. Id-less local cards are carried through untouched. The returned
     * base is the remote deck, which becomes the next common ancestor.</p>
     */
    public MergeOutcome merge(List<Card> base, List<Card> local, List<Card> remote) {
        Map<String, Card> baseById = indexById(base);
        Map<String, Card> remoteById = indexById(remote);

        List<Card> merged = new ArrayList<>();
        List<MergeConflict> conflicts = new ArrayList<>();
        Set<String> localIds = new HashSet<>();
        int acceptedRemote = 0;
        int droppedRemotely = 0;

        for (Card localCard : local) {
            if (!localCard.hasId()) {
                merged.add(localCard);
                continue;
            }
            String id = localCard.id();
            localIds.add(id);
            Card remoteCard = remoteById.get(id);
            Card baseCard = baseById.get(id);

            if (remoteCard == null) {
                if (baseCard == null) {
                    // never synced through this mirror; sync decides what it means
                    merged.add(localCard);
                } else if (sameContent(localCard, baseCard)) {
                    droppedRemotely++;
                } else {
                    conflicts.add(new MergeConflict(id, MergeConflict.Kind.MODIFIED_LOCALLY_DELETED_REMOTELY, localCard, null));
                    merged.add(localCard.withId(null));
                }
                continue;
            }

            if (baseCard == null) {
                if (!sameContent(localCard, remoteCard)) {
                    conflicts.add(new MergeConflict(id, MergeConflict.Kind.NO_COMMON_BASE, localCard, remoteCard));
                }
                merged.add(localCard);
                continue;
            }

            boolean localChanged = !sameContent(localCard, baseCard);
            boolean remoteChanged = !sameContent(remoteCard, baseCard);
            if (localChanged && remoteChanged) {
                if (!sameContent(localCard, remoteCard)) {
                    conflicts.add(new MergeConflict(id, MergeConflict.Kind.BOTH_CHANGED, localCard, remoteCard));
                }
                merged.add(localCard);
            } else if (localChanged) {
                merged.add(localCard);
            } else {
                if (!localCard.equals(remoteCard)) {
                    acceptedRemote++;
                }
                merged.add(remoteCard);
            }
        }

        int addedRemote = 0;
        int droppedLocally = 0;
        for (Card remoteCard : remote) {
            if (localIds.contains(remoteCard.id())) {
                continue;
            }
            if (baseById.containsKey(remoteCard.id())) {
                droppedLocally++;
            } else {
                merged.add(remoteCard);
                addedRemote++;
            }
        }

        log.info("merge.completed merged={} acceptedRemote={} addedRemote={} droppedLocally={} droppedRemotely={} conflicts={}",
                merged.size(), acceptedRemote, addedRemote, droppedLocally, droppedRemotely, conflicts.size());
        return new MergeOutcome(merged, remote, conflicts, acceptedRemote, addedRemote, droppedLocally, droppedRemotely);
    }

    private static boolean sameContent(Card a, Card b) {
        return a.contentHash().equals(b.contentHash());
    }

    private static Map<String, Card> indexById(List<Card> cards) {
        Map<String, Card> byId = new LinkedHashMap<>();
        for (Card card : cards) {
            if (card.hasId()) {
                byId.put(card.id(), card);
            }
        }
        return byId;
    }
}
