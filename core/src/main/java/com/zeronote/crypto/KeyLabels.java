package com.zeronote.crypto;

/** HKDF info strings. Each label roots an independent capability from the same master key. */
public final class KeyLabels {

    public static final String ACCOUNT_KEK = "zeronote-account-kek";
    public static final String ENTITY_PASSWORD_KEK = "zeronote-entity-password-kek";
    public static final String RECOVERY_KEK = "zeronote-recovery-kek";
    public static final String LOGIN = "zeronote-login";

    private KeyLabels() {
    }
}
