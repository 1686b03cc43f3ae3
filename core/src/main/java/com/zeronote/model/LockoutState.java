package com.zeronote.model;

/**
 * Failed-attempt bookkeeping for one protected entity. {@code lockedUntil} is epoch millis,
 * null while unlocked. Device-local: never accepted from a remote.
 */
public record LockoutState(int attempts, Long lockedUntil) {

    private static final LockoutState UNLOCKED = new LockoutState(0, null);

    public static LockoutState unlocked() {
        return UNLOCKED;
    }

    public boolean isLockedAt(long nowMillis) {
        return lockedUntil != null && nowMillis < lockedUntil;
    }
}
