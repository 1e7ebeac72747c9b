package com.bbthechange.rehearsalsync.model;

/**
 * Export state of a single rehearsal, resolved once per sync from the
 * export mapping and the device calendar.
 */
public sealed interface SyncState permits SyncState.Unsynced, SyncState.Synced, SyncState.Orphaned {

    /**
     * No mapping exists for the rehearsal.
     */
    record Unsynced() implements SyncState {
    }

    /**
     * Mapped, and the mapped event still resolves in the calendar.
     */
    record Synced(EventMapping mapping) implements SyncState {
    }

    /**
     * Mapped, but the mapped event no longer exists.
     */
    record Orphaned(EventMapping mapping) implements SyncState {
    }
}
