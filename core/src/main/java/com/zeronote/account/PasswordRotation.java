package com.zeronote.account;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zeronote.crypto.AesGcm;
import com.zeronote.crypto.KeyWrap;
import com.zeronote.model.SyncEntity;

/**
 * Moves every entity from one account session's keys to another's without touching content
 * ciphertext.
 *
 * <p>Entities whose DEK sits under the account KEK get that wrap replaced. Entities protected
 * by their own password keep their DEK wrap (it is under the password KEK) and instead have
 * their encrypted salt resealed under the new master key. Recovery wraps are untouched since
 * the recovery KEK survives the change. Every copy is stamped with the epoch of {@code to}.
 *
 * <p>All results are computed on copies before anything is returned, so a failure on any
 * entity leaves the caller with nothing to apply.
 */
public class PasswordRotation {

    private static final Logger log = LoggerFactory.getLogger(PasswordRotation.class);

    private final AesGcm aesGcm;
    private final KeyWrap keyWrap;

    public PasswordRotation(AesGcm aesGcm, KeyWrap keyWrap) {
        this.aesGcm = aesGcm;
        this.keyWrap = keyWrap;
    }

    /**
     * @return rotated copies, each marked dirty so the new wraps sync with their entities
     * @throws com.zeronote.error.AuthenticationFailureException if any DEK does not open under
     *                                                           {@code from}; nothing is rotated
     */
    public <T extends SyncEntity<T>> List<T> rotate(Collection<T> entities, KeySession from, KeySession to,
                                                 long nowMillis) {
        List<T> rotated = new ArrayList<>(entities.size());
        int resealedSalts = 0;
        for (T entity : entities) {
            T copy = entity.copy();
            if (entity.isOwnProtected()) {
                byte[] salt = aesGcm.decrypt(entity.getPasswordSalt(), from.masterKey());
                copy.setPasswordSalt(aesGcm.encrypt(salt, to.masterKey()));
                resealedSalts++;
            } else {
                copy.setEncryptedDek(keyWrap.rewrap(entity.getEncryptedDek(), from.accountKek(), to.accountKek()));
            }
            copy.setKeyEpoch(to.keyEpoch());
            copy.touch(nowMillis);
            rotated.add(copy);
        }
        log.info("Rotated {} entities ({} password salts resealed)", rotated.size(), resealedSalts);
        return rotated;
    }
}
