package com.zeronote.model;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.zeronote.crypto.EncryptedBlob;
import com.zeronote.crypto.WrappedKey;

/**
 * Fields shared by every entity that travels through sync. Everything here is ciphertext,
 * wrapped keys or plain metadata; nothing decrypts without a session.
 *
 * <p>{@code syncVersion} is the per-entity counter the server bumps on every accepted write.
 * On a device it holds the last version this device saw, which is what a push is based on.
 * {@code changeSeq} is the account-wide sequence the server stamped on the write and is what
 * pulls page by.
 *
 * <p>{@code keyEpoch} names the account key generation the DEK wraps and password salt were
 * written under. The server refuses writes from an epoch the account has moved past.
 *
 * <p>{@code dekId} is a random, non-secret name for the DEK itself. It changes only when a new
 * DEK is generated, never on a rewrap, so history can tell whether an old ciphertext still opens
 * with the entity's current key.
 *
 * <p>{@code dirty} and {@code lockout} are device-local and are reset by the server on arrival.
 */
public abstract class SyncEntity<T extends SyncEntity<T>> {

    private String id;
    private long syncVersion;
    private long changeSeq;
    private String lastModifiedDeviceId;
    private long createdAt;
    private long updatedAt;
    private boolean deleted;
    private Long deletedAt;

    private WrappedKey encryptedDek;
    private WrappedKey recoveryDek;
    private String keyEpoch;
    private String dekId;

    private boolean hasPassword;
    private EncryptedBlob passwordSalt;
    private boolean passwordInherited;
    private String protectionSourceId;

    private boolean dirty;
    private LockoutState lockout = LockoutState.unlocked();

    @JsonIgnore
    public abstract EntityType getEntityType();

    /** Folder id for a note, parent id for a folder. */
    @JsonIgnore
    public abstract String getContainerId();

    /** The ciphertext fields this entity's DEK seals, by name. */
    @JsonIgnore
    public abstract Map<String, EncryptedBlob> getSealedFields();

    public abstract void replaceSealedFields(Map<String, EncryptedBlob> fields);

    public abstract T copy();

    /** Protected by a password set on this entity itself, as opposed to one inherited from a folder. */
    @JsonIgnore
    public boolean isOwnProtected() {
        return hasPassword && !passwordInherited;
    }

    /** Stamps a local edit: bumps {@code updatedAt} and queues the entity for the next push. */
    public void touch(long nowMillis) {
        this.updatedAt = nowMillis;
        this.dirty = true;
    }

    protected void copyInto(SyncEntity<?> target) {
        target.id = id;
        target.syncVersion = syncVersion;
        target.changeSeq = changeSeq;
        target.lastModifiedDeviceId = lastModifiedDeviceId;
        target.createdAt = createdAt;
        target.updatedAt = updatedAt;
        target.deleted = deleted;
        target.deletedAt = deletedAt;
        target.encryptedDek = encryptedDek;
        target.recoveryDek = recoveryDek;
        target.keyEpoch = keyEpoch;
        target.dekId = dekId;
        target.hasPassword = hasPassword;
        target.passwordSalt = passwordSalt;
        target.passwordInherited = passwordInherited;
        target.protectionSourceId = protectionSourceId;
        target.dirty = dirty;
        target.lockout = lockout;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public long getSyncVersion() { return syncVersion; }
    public void setSyncVersion(long syncVersion) { this.syncVersion = syncVersion; }
    public long getChangeSeq() { return changeSeq; }
    public void setChangeSeq(long changeSeq) { this.changeSeq = changeSeq; }
    public String getLastModifiedDeviceId() { return lastModifiedDeviceId; }
    public void setLastModifiedDeviceId(String lastModifiedDeviceId) { this.lastModifiedDeviceId = lastModifiedDeviceId; }
    public long getCreatedAt() { return createdAt; }
    public void setCreatedAt(long createdAt) { this.createdAt = createdAt; }
    public long getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(long updatedAt) { this.updatedAt = updatedAt; }
    public boolean isDeleted() { return deleted; }
    public void setDeleted(boolean deleted) { this.deleted = deleted; }
    public Long getDeletedAt() { return deletedAt; }
    public void setDeletedAt(Long deletedAt) { this.deletedAt = deletedAt; }

    @JsonProperty("encryptedDEK")
    public WrappedKey getEncryptedDek() { return encryptedDek; }
    @JsonProperty("encryptedDEK")
    public void setEncryptedDek(WrappedKey encryptedDek) { this.encryptedDek = encryptedDek; }
    @JsonProperty("recoveryDEK")
    public WrappedKey getRecoveryDek() { return recoveryDek; }
    @JsonProperty("recoveryDEK")
    public void setRecoveryDek(WrappedKey recoveryDek) { this.recoveryDek = recoveryDek; }

    public String getKeyEpoch() { return keyEpoch; }
    public void setKeyEpoch(String keyEpoch) { this.keyEpoch = keyEpoch; }

    public String getDekId() { return dekId; }
    public void setDekId(String dekId) { this.dekId = dekId; }

    @JsonProperty("hasPassword")
    public boolean hasPassword() { return hasPassword; }
    @JsonProperty("hasPassword")
    public void setHasPassword(boolean hasPassword) { this.hasPassword = hasPassword; }

    /** Per-entity password salt, encrypted under the account master key. */
    public EncryptedBlob getPasswordSalt() { return passwordSalt; }
    public void setPasswordSalt(EncryptedBlob passwordSalt) { this.passwordSalt = passwordSalt; }
    public boolean isPasswordInherited() { return passwordInherited; }
    public void setPasswordInherited(boolean passwordInherited) { this.passwordInherited = passwordInherited; }
    public String getProtectionSourceId() { return protectionSourceId; }
    public void setProtectionSourceId(String protectionSourceId) { this.protectionSourceId = protectionSourceId; }

    public boolean isDirty() { return dirty; }
    public void setDirty(boolean dirty) { this.dirty = dirty; }
    public LockoutState getLockout() { return lockout; }
    public void setLockout(LockoutState lockout) { this.lockout = lockout == null ? LockoutState.unlocked() : lockout; }
}
