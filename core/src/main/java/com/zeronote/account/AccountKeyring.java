package com.zeronote.account;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zeronote.crypto.AesGcm;
import com.zeronote.crypto.Kek;
import com.zeronote.crypto.KeyDerivation;
import com.zeronote.crypto.KeyLabels;
import com.zeronote.crypto.KeyWrap;
import com.zeronote.crypto.MasterKey;
import com.zeronote.error.AuthenticationFailureException;
import com.zeronote.error.IntegrityFailureException;
import com.zeronote.recovery.RecoveryKey;
import com.zeronote.recovery.RecoveryPhrases;

/**
 * Account-level key lifecycle: register, unlock, change password, recover.
 *
 * <p>The account password roots two capabilities: the master key (which seals the key check
 * and every entity password salt) and the account KEK derived from it (which wraps every
 * unprotected entity's DEK). The recovery KEK is created once at registration and carried
 * forward unchanged through every password change and recovery.
 *
 * <p>Each rekey retires the master key it replaces into the new bundle, wrapped under the new
 * account KEK, so a device holding the current keys can still open entities written under any
 * of the last {@value #MAX_RETIRED_KEYS} generations.
 */
public class AccountKeyring {

    private static final Logger log = LoggerFactory.getLogger(AccountKeyring.class);

    private static final byte[] KEY_CHECK = "zeronote-key-check-v1".getBytes(StandardCharsets.UTF_8);
    private static final int LOGIN_HASH_LENGTH = 32;
    static final int MAX_RETIRED_KEYS = 16;

    private final KeyDerivation keyDerivation;
    private final AesGcm aesGcm;
    private final KeyWrap keyWrap;
    private final RecoveryPhrases recoveryPhrases;

    public AccountKeyring(KeyDerivation keyDerivation, AesGcm aesGcm, KeyWrap keyWrap,
                          RecoveryPhrases recoveryPhrases) {
        this.keyDerivation = keyDerivation;
        this.aesGcm = aesGcm;
        this.keyWrap = keyWrap;
        this.recoveryPhrases = recoveryPhrases;
    }

    public Registration register(String password) {
        RecoveryKey recoveryKey = recoveryPhrases.generate();
        Kek recoveryKek = recoveryPhrases.deriveKek(recoveryKey.words());

        byte[] salt = keyDerivation.newSalt();
        MasterKey masterKey = keyDerivation.deriveMasterKey(password, salt);
        Kek accountKek = keyDerivation.deriveKek(masterKey, KeyLabels.ACCOUNT_KEK);

        AccountKeys keys = seal(salt, masterKey, accountKek, recoveryKek,
                recoveryPhrases.hash(recoveryKey.words()), List.of());
        KeySession session = new KeySession(masterKey, accountKek, recoveryKek, keys.keyEpoch());
        log.info("Registered account key bundle ({} PBKDF2 rounds)", keys.iterations());
        return new Registration(keys, recoveryKey, session, loginHash(session));
    }

    /**
     * @throws AuthenticationFailureException with the generic message when the password is wrong
     */
    public KeySession unlock(String password, AccountKeys keys) {
        MasterKey masterKey = keyDerivation.deriveMasterKey(password, keys.salt(), keys.iterations());
        if (!opensKeyCheck(keys, masterKey)) {
            masterKey.destroy();
            throw AuthenticationFailureException.incorrectPassword(null);
        }
        Kek accountKek = keyDerivation.deriveKek(masterKey, KeyLabels.ACCOUNT_KEK);
        Kek recoveryKek = keys.recoveryKekWrap() == null
                ? null
                : keyWrap.unwrapKek(keys.recoveryKekWrap(), accountKek);
        return new KeySession(masterKey, accountKek, recoveryKek, keys.keyEpoch());
    }

    /** Login verifier sent to the server in place of the password. */
    public String loginHash(KeySession session) {
        return loginHash(session.masterKey());
    }

    /** Login verifier for a password, from the KDF parameters the server hands out before login. */
    public String loginHash(String password, byte[] salt, int iterations) {
        MasterKey masterKey = keyDerivation.deriveMasterKey(password, salt, iterations);
        try {
            return loginHash(masterKey);
        } finally {
            masterKey.destroy();
        }
    }

    /**
     * Opens the keys of an earlier generation from the retired wrap in {@code keys}. The returned
     * session carries no recovery KEK; close it once the entities are rewrapped.
     *
     * @return empty when {@code keys} holds no retired key for {@code keyEpoch}
     */
    public Optional<KeySession> openRetired(KeySession current, AccountKeys keys, String keyEpoch) {
        return keys.retiredKeys().stream()
                .filter(retired -> retired.keyEpoch().equals(keyEpoch))
                .findFirst()
                .map(retired -> {
                    MasterKey masterKey = keyWrap.unwrapMasterKey(retired.masterKeyWrap(), current.accountKek());
                    Kek accountKek = keyDerivation.deriveKek(masterKey, KeyLabels.ACCOUNT_KEK);
                    return new KeySession(masterKey, accountKek, null, keyEpoch);
                });
    }

    /**
     * Derives the old keys from the old password (which must open the key check) and new keys
     * from the new password under a fresh salt.
     */
    public Rekey changePassword(String oldPassword, String newPassword, AccountKeys keys) {
        KeySession previous = unlock(oldPassword, keys);
        return rekey(previous, newPassword, keys, false);
    }

    /**
     * Reopens the account from its recovery phrase and rekeys it under {@code newPassword}.
     *
     * @throws com.zeronote.error.ValidationFailureException if the phrase is malformed
     * @throws AuthenticationFailureException if the phrase is well formed but not this account's
     */
    public Rekey recover(List<String> words, String newPassword, AccountKeys keys) {
        List<String> normalized = recoveryPhrases.normalize(words);
        if (!recoveryPhrases.verify(normalized, keys.recoveryKeyHash())) {
            throw new AuthenticationFailureException("Recovery key does not match this account");
        }
        Kek recoveryKek = recoveryPhrases.deriveKek(normalized);
        MasterKey masterKey = keyWrap.unwrapMasterKey(keys.masterKeyRecoveryWrap(), recoveryKek);
        Kek accountKek = keyDerivation.deriveKek(masterKey, KeyLabels.ACCOUNT_KEK);
        KeySession previous = new KeySession(masterKey, accountKek, recoveryKek, keys.keyEpoch());
        log.info("Account reopened from recovery phrase");
        return rekey(previous, newPassword, keys, true);
    }

    private Rekey rekey(KeySession previous, String newPassword, AccountKeys keys, boolean viaRecovery) {
        byte[] salt = keyDerivation.newSalt();
        MasterKey masterKey = keyDerivation.deriveMasterKey(newPassword, salt);
        Kek accountKek = keyDerivation.deriveKek(masterKey, KeyLabels.ACCOUNT_KEK);
        Kek recoveryKek = previous.recoveryKek()
                .map(kek -> new Kek(kek.getEncoded()))
                .orElse(null);
        List<RetiredKey> retired = retire(keys, previous, accountKek);

        AccountKeys rekeyed = recoveryKek == null
                ? new AccountKeys(salt, keyDerivation.iterations(), aesGcm.encrypt(KEY_CHECK, masterKey),
                        null, null, keys.recoveryKeyHash(), retired)
                : seal(salt, masterKey, accountKek, recoveryKek, keys.recoveryKeyHash(), retired);
        KeySession current = new KeySession(masterKey, accountKek, recoveryKek, rekeyed.keyEpoch());
        log.info("Account rekeyed from epoch {} to {} ({} retired keys kept)",
                keys.keyEpoch(), rekeyed.keyEpoch(), retired.size());
        return new Rekey(rekeyed, previous, current, loginHash(current), loginHash(previous), viaRecovery);
    }

    // Earlier retired keys move from the old account KEK to the new one; the replaced master key joins them.
    private List<RetiredKey> retire(AccountKeys keys, KeySession previous, Kek accountKek) {
        List<RetiredKey> retired = new ArrayList<>();
        for (RetiredKey key : keys.retiredKeys()) {
            retired.add(new RetiredKey(key.keyEpoch(),
                    keyWrap.rewrap(key.masterKeyWrap(), previous.accountKek(), accountKek)));
        }
        retired.add(new RetiredKey(keys.keyEpoch(), keyWrap.wrap(previous.masterKey(), accountKek)));
        return retired.size() > MAX_RETIRED_KEYS
                ? List.copyOf(retired.subList(retired.size() - MAX_RETIRED_KEYS, retired.size()))
                : retired;
    }

    private String loginHash(MasterKey masterKey) {
        byte[] verifier = keyDerivation.expand(masterKey, KeyLabels.LOGIN, LOGIN_HASH_LENGTH);
        return Base64.getEncoder().encodeToString(verifier);
    }

    private AccountKeys seal(byte[] salt, MasterKey masterKey, Kek accountKek, Kek recoveryKek,
                             String recoveryKeyHash, List<RetiredKey> retired) {
        return new AccountKeys(
                salt,
                keyDerivation.iterations(),
                aesGcm.encrypt(KEY_CHECK, masterKey),
                keyWrap.wrap(masterKey, recoveryKek),
                keyWrap.wrap(recoveryKek, accountKek),
                recoveryKeyHash,
                retired);
    }

    private boolean opensKeyCheck(AccountKeys keys, MasterKey masterKey) {
        try {
            return Arrays.equals(KEY_CHECK, aesGcm.decrypt(keys.keyCheck(), masterKey));
        } catch (IntegrityFailureException e) {
            return false;
        }
    }
}
