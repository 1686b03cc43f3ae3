package com.zeronote.sync;

/**
 * @param rejected  pushed entities the remote refused, stale keys included
 * @param staleKeys pushed entities refused because they were written under replaced account keys
 */
public record SyncStats(int notesUploaded, int notesDownloaded, int foldersUploaded, int foldersDownloaded,
                        int conflicts, int rejected, int staleKeys) {

    public static SyncStats none() {
        return new SyncStats(0, 0, 0, 0, 0, 0, 0);
    }
}
