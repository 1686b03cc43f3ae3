package com.zeronote.crypto;

import java.util.Arrays;

import javax.security.auth.Destroyable;

import com.zeronote.error.SessionExpiredException;

/**
 * 256-bit symmetric key held only in memory. {@link #destroy()} zeroes the bytes; any access
 * afterwards raises {@link SessionExpiredException}.
 */
public abstract class KeyMaterial implements Destroyable {

    public static final int KEY_LENGTH = 32;

    private final byte[] bytes;
    private volatile boolean destroyed;

    protected KeyMaterial(byte[] bytes) {
        if (bytes == null || bytes.length != KEY_LENGTH) {
            throw new IllegalArgumentException("Keys are " + KEY_LENGTH + " bytes");
        }
        this.bytes = bytes.clone();
    }

    /** Copy of the raw key bytes. */
    public byte[] getEncoded() {
        return raw().clone();
    }

    byte[] raw() {
        if (destroyed) {
            throw new SessionExpiredException(getClass().getSimpleName() + " has been wiped");
        }
        return bytes;
    }

    @Override
    public void destroy() {
        Arrays.fill(bytes, (byte) 0);
        destroyed = true;
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + (destroyed ? "[wiped]" : "[****]");
    }
}
