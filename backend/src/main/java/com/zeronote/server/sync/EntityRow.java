package com.zeronote.server.sync;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;

/**
 * Stored form of a synced entity. The entity travels as an opaque JSON {@code payload}; the
 * version columns are copied out of it so writes can be conditioned on them.
 */
public abstract class EntityRow {

    @PrimaryKey
    private EntityKey key;

    @Column("sync_version")
    private long syncVersion;

    /** Account sequence stamped on the last accepted write; what pulls page by. */
    @Column("change_seq")
    private long changeSeq;

    @Column("updated_at")
    private long updatedAt;

    @Column("deleted")
    private boolean deleted;

    @Column("payload")
    private String payload;

    public EntityKey getKey() { return key; }
    public void setKey(EntityKey key) { this.key = key; }
    public long getSyncVersion() { return syncVersion; }
    public void setSyncVersion(long syncVersion) { this.syncVersion = syncVersion; }
    public long getChangeSeq() { return changeSeq; }
    public void setChangeSeq(long changeSeq) { this.changeSeq = changeSeq; }
    public long getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(long updatedAt) { this.updatedAt = updatedAt; }
    public boolean isDeleted() { return deleted; }
    public void setDeleted(boolean deleted) { this.deleted = deleted; }
    public String getPayload() { return payload; }
    public void setPayload(String payload) { this.payload = payload; }
}
