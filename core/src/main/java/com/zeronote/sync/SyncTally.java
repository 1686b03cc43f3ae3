package com.zeronote.sync;

import java.util.ArrayList;
import java.util.List;

import com.zeronote.model.EntityType;
import com.zeronote.model.SyncEntity;

/** Counters for one cycle. Confined to the cycle that created it. */
final class SyncTally {

    private int notesUploaded;
    private int notesDownloaded;
    private int foldersUploaded;
    private int foldersDownloaded;
    private int rejected;
    private int staleKeys;
    private final List<SyncConflict> conflicts = new ArrayList<>();

    void uploaded(EntityType type) {
        if (type == EntityType.NOTE) notesUploaded++;
        else foldersUploaded++;
    }

    void downloaded(EntityType type) {
        if (type == EntityType.NOTE) notesDownloaded++;
        else foldersDownloaded++;
    }

    void rejected() {
        rejected++;
    }

    void staleKeys() {
        rejected++;
        staleKeys++;
    }

    void conflict(SyncEntity<?> local, SyncEntity<?> remote, SyncConflict.Winner winner) {
        conflicts.add(new SyncConflict(local.getEntityType(), local.getId(), winner,
                local.getUpdatedAt(), remote == null ? 0 : remote.getUpdatedAt()));
    }

    SyncResult result(String remoteKeyEpoch) {
        SyncStats stats = new SyncStats(notesUploaded, notesDownloaded, foldersUploaded, foldersDownloaded,
                conflicts.size(), rejected, staleKeys);
        return SyncResult.completed(stats, conflicts, remoteKeyEpoch);
    }
}
