package com.zeronote.account;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.zeronote.crypto.Digests;
import com.zeronote.crypto.EncryptedBlob;
import com.zeronote.crypto.WrappedKey;

/**
 * The account's key bundle as the server stores it. Opaque to the server: every secret in it
 * is either encrypted or wrapped under something only the user can derive.
 *
 * <p>Every password change or recovery draws a fresh salt, so the salt identifies the
 * generation of keys in force. {@link #keyEpoch()} names that generation; each entity carries
 * the epoch its DEK was wrapped in.
 *
 * @param salt                  PBKDF2 salt for the account password
 * @param iterations            PBKDF2 rounds the salt was used with
 * @param keyCheck              a fixed marker sealed under the master key; opening it proves the password
 * @param masterKeyRecoveryWrap the master key wrapped under the recovery KEK
 * @param recoveryKekWrap       the recovery KEK wrapped under the account KEK
 * @param recoveryKeyHash       hex SHA-256 of the normalized recovery phrase
 * @param retiredKeys           earlier master keys, oldest first, wrapped under the current account KEK
 */
public record AccountKeys(
        byte[] salt,
        int iterations,
        EncryptedBlob keyCheck,
        WrappedKey masterKeyRecoveryWrap,
        WrappedKey recoveryKekWrap,
        String recoveryKeyHash,
        List<RetiredKey> retiredKeys) {

    private static final int EPOCH_HEX_LENGTH = 16;

    public AccountKeys {
        retiredKeys = retiredKeys == null ? List.of() : List.copyOf(retiredKeys);
    }

    @JsonIgnore
    public String keyEpoch() {
        return epochOf(salt);
    }

    public static String epochOf(byte[] salt) {
        return salt == null ? null : Digests.sha256Hex(salt).substring(0, EPOCH_HEX_LENGTH);
    }
}
