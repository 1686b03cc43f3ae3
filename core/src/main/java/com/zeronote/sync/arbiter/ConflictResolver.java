package com.zeronote.sync.arbiter;

import com.zeronote.model.SyncEntity;

/**
 * Decides a pushed write against the stored copy.
 *
 * <p>The push carries the version the device last saw. If the stored version is not ahead of
 * that, or the stored copy was written by the same device, the write applies. Otherwise another
 * device got there first and the strictly later {@code updatedAt} wins outright; ties keep the
 * stored copy.
 */
public class ConflictResolver {

    public enum Resolution {
        APPLY,
        LOCAL_WINS,
        REMOTE_WINS
    }

    public Resolution resolve(SyncEntity<?> stored, SyncEntity<?> incoming, String deviceId) {
        if (stored.getSyncVersion() <= incoming.getSyncVersion()) {
            return Resolution.APPLY;
        }
        if (deviceId != null && deviceId.equals(stored.getLastModifiedDeviceId())) {
            return Resolution.APPLY;
        }
        return incoming.getUpdatedAt() > stored.getUpdatedAt() ? Resolution.LOCAL_WINS : Resolution.REMOTE_WINS;
    }
}
