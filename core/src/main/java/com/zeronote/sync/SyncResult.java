package com.zeronote.sync;

import java.util.List;

/**
 * Outcome of one cycle. A failed cycle changed nothing: dirty flags and the cursor are as they were.
 *
 * @param remoteKeyEpoch the account key epoch the remote reported, or null if it keeps none
 */
public record SyncResult(boolean success, SyncStats stats, List<SyncConflict> conflicts, String error,
                         String remoteKeyEpoch) {

    public static final String ALREADY_RUNNING = "Sync already in progress";

    public SyncResult {
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
    }

    public static SyncResult completed(SyncStats stats, List<SyncConflict> conflicts) {
        return completed(stats, conflicts, null);
    }

    public static SyncResult completed(SyncStats stats, List<SyncConflict> conflicts, String remoteKeyEpoch) {
        return new SyncResult(true, stats, conflicts, null, remoteKeyEpoch);
    }

    public static SyncResult failed(String error) {
        return new SyncResult(false, SyncStats.none(), List.of(), error, null);
    }
}
