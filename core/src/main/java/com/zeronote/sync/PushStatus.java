package com.zeronote.sync;

public enum PushStatus {
    CREATED,
    UPDATED,
    /** Concurrent write from another device; this push was newer and replaced it. */
    CONFLICT_LOCAL_WON,
    /** Concurrent write from another device; the stored copy was newer and this push was dropped. */
    CONFLICT_REMOTE_WON,
    REJECTED,
    /** Written under account keys that have since been replaced; rewrap it and push again. */
    STALE_KEYS;

    public boolean isApplied() {
        return this == CREATED || this == UPDATED || this == CONFLICT_LOCAL_WON;
    }

    public boolean isConflict() {
        return this == CONFLICT_LOCAL_WON || this == CONFLICT_REMOTE_WON;
    }
}
