package com.zeronote.crypto;

import java.util.Arrays;

import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.engines.AESWrapEngine;
import org.bouncycastle.crypto.params.KeyParameter;

import com.zeronote.error.AuthenticationFailureException;

/**
 * RFC 3394 AES key wrap. Deterministic, no IV. The integrity check built into the unwrap is
 * what detects a wrong KEK.
 */
public final class KeyWrap {

    public static final String ALGORITHM = "AES-KW";

    public WrappedKey wrap(KeyMaterial key, Kek kek) {
        AESWrapEngine engine = new AESWrapEngine();
        engine.init(true, new KeyParameter(kek.raw()));
        byte[] raw = key.raw();
        return new WrappedKey(engine.wrap(raw, 0, raw.length), ALGORITHM);
    }

    public Dek unwrapDek(WrappedKey wrapped, Kek kek) {
        byte[] raw = unwrap(wrapped, kek);
        try {
            return new Dek(raw);
        } finally {
            Arrays.fill(raw, (byte) 0);
        }
    }

    public Kek unwrapKek(WrappedKey wrapped, Kek kek) {
        byte[] raw = unwrap(wrapped, kek);
        try {
            return new Kek(raw);
        } finally {
            Arrays.fill(raw, (byte) 0);
        }
    }

    public MasterKey unwrapMasterKey(WrappedKey wrapped, Kek kek) {
        byte[] raw = unwrap(wrapped, kek);
        try {
            return new MasterKey(raw);
        } finally {
            Arrays.fill(raw, (byte) 0);
        }
    }

    /** Moves a wrapped DEK from one KEK to another without exposing it to the caller. */
    public WrappedKey rewrap(WrappedKey wrapped, Kek from, Kek to) {
        Dek dek = unwrapDek(wrapped, from);
        try {
            return wrap(dek, to);
        } finally {
            dek.destroy();
        }
    }

    private static byte[] unwrap(WrappedKey wrapped, Kek kek) {
        if (wrapped == null || !ALGORITHM.equals(wrapped.algorithm())) {
            throw new AuthenticationFailureException("Unsupported wrapped key");
        }
        AESWrapEngine engine = new AESWrapEngine();
        engine.init(false, new KeyParameter(kek.raw()));
        byte[] bytes = wrapped.wrappedKey();
        try {
            return engine.unwrap(bytes, 0, bytes.length);
        } catch (InvalidCipherTextException e) {
            throw new AuthenticationFailureException("Key unwrap failed", e);
        }
    }
}
