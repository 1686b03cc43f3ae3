package com.zeronote.sync;

import com.zeronote.model.EntityType;

/** One concurrent edit resolved by timestamp during a cycle. */
public record SyncConflict(EntityType entityType, String entityId, Winner winner,
                           long localUpdatedAt, long remoteUpdatedAt) {

    public enum Winner {
        LOCAL,
        REMOTE
    }
}
