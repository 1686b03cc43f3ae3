package com.zeronote.crypto;

/** PBKDF2 output. Never persisted; only ever wrapped under the recovery KEK. */
public final class MasterKey extends KeyMaterial {

    public MasterKey(byte[] bytes) {
        super(bytes);
    }
}
