package com.zeronote.crypto;

/** Key-encrypting key. Used only to wrap and unwrap other keys. */
public final class Kek extends KeyMaterial {

    public Kek(byte[] bytes) {
        super(bytes);
    }
}
