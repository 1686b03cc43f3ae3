package com.zeronote.crypto;

/** Per-entity data-encrypting key. */
public final class Dek extends KeyMaterial {

    public Dek(byte[] bytes) {
        super(bytes);
    }

    public static Dek generate() {
        return new Dek(CryptoRandom.bytes(KEY_LENGTH));
    }
}
