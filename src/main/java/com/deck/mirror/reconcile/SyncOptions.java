package com.deck.mirror.reconcile;

/**
 * Flags shared by pull, push and sync.
 *
 * @param force     create cards even when identical content exists remotely
 * @param assumeYes skip the confirmation prompt
 */
public record SyncOptions(boolean force, boolean assumeYes) {

    public static SyncOptions defaults() {
        return new SyncOptions(false, false);
    }
}
