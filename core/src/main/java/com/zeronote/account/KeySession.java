package com.zeronote.account;

import java.util.Optional;
import java.util.UUID;

import com.zeronote.crypto.Kek;
import com.zeronote.crypto.MasterKey;
import com.zeronote.error.SessionExpiredException;

/**
 * Key material for one unlocked account, passed explicitly to every operation that needs it.
 * Nothing here is ever written to disk. {@link #close()} wipes the keys; the session is unusable
 * afterwards.
 */
public final class KeySession implements AutoCloseable {

    private final String id = UUID.randomUUID().toString();
    private final MasterKey masterKey;
    private final Kek accountKek;
    private final Kek recoveryKek;
    private final String keyEpoch;
    private volatile boolean closed;

    public KeySession(MasterKey masterKey, Kek accountKek, Kek recoveryKek, String keyEpoch) {
        this.masterKey = masterKey;
        this.accountKek = accountKek;
        this.recoveryKek = recoveryKek;
        this.keyEpoch = keyEpoch;
    }

    public String id() {
        return id;
    }

    /** Epoch of the key bundle this session was opened from; stamped on everything it wraps. */
    public String keyEpoch() {
        return keyEpoch;
    }

    public MasterKey masterKey() {
        ensureOpen();
        return masterKey;
    }

    public Kek accountKek() {
        ensureOpen();
        return accountKek;
    }

    /** Present when the session was opened with a key bundle that carries a recovery wrap. */
    public Optional<Kek> recoveryKek() {
        ensureOpen();
        return Optional.ofNullable(recoveryKek);
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
        masterKey.destroy();
        accountKek.destroy();
        if (recoveryKek != null) {
            recoveryKek.destroy();
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new SessionExpiredException("Session " + id + " has been closed");
        }
    }
}
