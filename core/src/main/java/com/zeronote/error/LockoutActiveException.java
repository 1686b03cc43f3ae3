package com.zeronote.error;

import java.time.Instant;

/** A protected entity is inside its lockout window; the attempt was not evaluated. */
public class LockoutActiveException extends ZeroNoteException {

    private final Instant lockedUntil;

    public LockoutActiveException(Instant lockedUntil) {
        super("Too many failed attempts. Try again after " + lockedUntil);
        this.lockedUntil = lockedUntil;
    }

    public Instant getLockedUntil() {
        return lockedUntil;
    }
}
