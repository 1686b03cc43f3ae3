package com.zeronote.protection;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zeronote.account.KeySession;
import com.zeronote.crypto.AesGcm;
import com.zeronote.crypto.Dek;
import com.zeronote.crypto.EncryptedBlob;
import com.zeronote.crypto.Kek;
import com.zeronote.crypto.KeyDerivation;
import com.zeronote.crypto.KeyLabels;
import com.zeronote.crypto.KeyWrap;
import com.zeronote.crypto.MasterKey;
import com.zeronote.error.AuthenticationFailureException;
import com.zeronote.error.IntegrityFailureException;
import com.zeronote.error.ValidationFailureException;
import com.zeronote.model.SyncEntity;

/**
 * Dual encryption for a single note or folder.
 *
 * <p>A protected entity's DEK is wrapped under a KEK derived from its own password and its own
 * salt, never under the account KEK. The salt is sealed under the account master key, so an
 * attempt cannot even start without an unlocked account. When the session holds the recovery
 * KEK the DEK is also wrapped under it.
 *
 * <p>Setting or removing protection always generates a new DEK and re-encrypts the sealed
 * fields with it. The recovery wrap follows the new DEK in both directions.
 */
public class SecondaryPassword {

    private static final Logger log = LoggerFactory.getLogger(SecondaryPassword.class);

    private final KeyDerivation keyDerivation;
    private final AesGcm aesGcm;
    private final KeyWrap keyWrap;

    public SecondaryPassword(KeyDerivation keyDerivation, AesGcm aesGcm, KeyWrap keyWrap) {
        this.keyDerivation = keyDerivation;
        this.aesGcm = aesGcm;
        this.keyWrap = keyWrap;
    }

    /** Unwraps the DEK of an entity that is not under its own password. */
    public Dek openDek(SyncEntity<?> entity, KeySession session) {
        if (entity.isOwnProtected()) {
            throw new AuthenticationFailureException("Entity is password protected");
        }
        return keyWrap.unwrapDek(entity.getEncryptedDek(), session.accountKek());
    }

    public void protect(SyncEntity<?> entity, String password, KeySession session) {
        if (entity.isOwnProtected()) {
            throw new ValidationFailureException("Entity already has a password");
        }
        Dek current = openDek(entity, session);
        Map<String, String> plaintext;
        try {
            plaintext = decryptFields(entity, current);
        } finally {
            current.destroy();
        }
        seal(entity, plaintext, password, session);
        log.debug("Protection set on {} {}", entity.getEntityType(), entity.getId());
    }

    /**
     * Opens a protected entity's DEK. Every way this can fail surfaces as the same
     * "Incorrect password".
     */
    public Dek unlock(SyncEntity<?> entity, String password, KeySession session) {
        if (!entity.isOwnProtected() || entity.getPasswordSalt() == null) {
            throw new ValidationFailureException("Entity has no password of its own");
        }
        MasterKey masterKey = session.masterKey();
        try {
            byte[] salt = aesGcm.decrypt(entity.getPasswordSalt(), masterKey);
            Kek passwordKek = passwordKek(password, salt);
            Dek dek;
            try {
                dek = keyWrap.unwrapDek(entity.getEncryptedDek(), passwordKek);
            } finally {
                passwordKek.destroy();
            }
            try {
                decryptFields(entity, dek);
            } catch (IntegrityFailureException e) {
                dek.destroy();
                throw e;
            }
            return dek;
        } catch (AuthenticationFailureException | IntegrityFailureException e) {
            throw AuthenticationFailureException.incorrectPassword(e);
        }
    }

    public void remove(SyncEntity<?> entity, String password, KeySession session) {
        Dek dek = unlock(entity, password, session);
        Map<String, String> plaintext;
        try {
            plaintext = decryptFields(entity, dek);
        } finally {
            dek.destroy();
        }
        unseal(entity, plaintext, session);
        log.debug("Protection removed from {} {}", entity.getEntityType(), entity.getId());
    }

    public Dek unlockWithRecovery(SyncEntity<?> entity, KeySession session) {
        Kek recoveryKek = session.recoveryKek()
                .orElseThrow(() -> new AuthenticationFailureException("Session has no recovery key"));
        if (entity.getRecoveryDek() == null) {
            throw new AuthenticationFailureException("Entity has no recovery wrap");
        }
        return keyWrap.unwrapDek(entity.getRecoveryDek(), recoveryKek);
    }

    /** Replaces a forgotten entity password using the recovery wrap. */
    public void resetWithRecovery(SyncEntity<?> entity, String newPassword, KeySession session) {
        Dek dek = unlockWithRecovery(entity, session);
        Map<String, String> plaintext;
        try {
            plaintext = decryptFields(entity, dek);
        } finally {
            dek.destroy();
        }
        seal(entity, plaintext, newPassword, session);
        log.info("Password reset with recovery key on {} {}", entity.getEntityType(), entity.getId());
    }

    public void removeWithRecovery(SyncEntity<?> entity, KeySession session) {
        Dek dek = unlockWithRecovery(entity, session);
        Map<String, String> plaintext;
        try {
            plaintext = decryptFields(entity, dek);
        } finally {
            dek.destroy();
        }
        unseal(entity, plaintext, session);
        log.info("Password removed with recovery key from {} {}", entity.getEntityType(), entity.getId());
    }

    public Map<String, String> decryptFields(SyncEntity<?> entity, Dek dek) {
        Map<String, String> plaintext = new LinkedHashMap<>();
        entity.getSealedFields().forEach((name, blob) ->
                plaintext.put(name, blob == null ? null : aesGcm.decryptString(blob, dek)));
        return plaintext;
    }

    public void encryptFields(SyncEntity<?> entity, Map<String, String> plaintext, Dek dek) {
        Map<String, EncryptedBlob> sealed = new LinkedHashMap<>();
        plaintext.forEach((name, value) -> sealed.put(name, value == null ? null : aesGcm.encrypt(value, dek)));
        entity.replaceSealedFields(sealed);
    }

    private void seal(SyncEntity<?> entity, Map<String, String> plaintext, String password, KeySession session) {
        byte[] salt = keyDerivation.newSalt();
        Kek passwordKek = passwordKek(password, salt);
        Dek dek = Dek.generate();
        try {
            encryptFields(entity, plaintext, dek);
            entity.setEncryptedDek(keyWrap.wrap(dek, passwordKek));
            entity.setDekId(UUID.randomUUID().toString());
            entity.setRecoveryDek(session.recoveryKek().map(kek -> keyWrap.wrap(dek, kek)).orElse(null));
            entity.setPasswordSalt(aesGcm.encrypt(salt, session.masterKey()));
            entity.setKeyEpoch(session.keyEpoch());
            entity.setHasPassword(true);
            entity.setPasswordInherited(false);
            entity.setProtectionSourceId(null);
        } finally {
            dek.destroy();
            passwordKek.destroy();
        }
    }

    private void unseal(SyncEntity<?> entity, Map<String, String> plaintext, KeySession session) {
        Dek dek = Dek.generate();
        try {
            encryptFields(entity, plaintext, dek);
            entity.setEncryptedDek(keyWrap.wrap(dek, session.accountKek()));
            entity.setDekId(UUID.randomUUID().toString());
            entity.setRecoveryDek(session.recoveryKek().map(kek -> keyWrap.wrap(dek, kek)).orElse(null));
            entity.setPasswordSalt(null);
            entity.setKeyEpoch(session.keyEpoch());
            entity.setHasPassword(false);
            entity.setPasswordInherited(false);
            entity.setProtectionSourceId(null);
        } finally {
            dek.destroy();
        }
    }

    private Kek passwordKek(String password, byte[] salt) {
        MasterKey passwordKey = keyDerivation.deriveMasterKey(password, salt);
        try {
            return keyDerivation.deriveKek(passwordKey, KeyLabels.ENTITY_PASSWORD_KEK);
        } finally {
            passwordKey.destroy();
        }
    }
}
