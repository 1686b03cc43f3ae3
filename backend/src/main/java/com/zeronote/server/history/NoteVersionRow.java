package com.zeronote.server.history;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

/** A note's ciphertext as it stood after one accepted push. Envelopes are stored as JSON. */
@Table("note_versions")
public class NoteVersionRow {

    @PrimaryKey
    private NoteVersionKey key;

    @Column("encrypted_title")
    private String encryptedTitle;

    @Column("encrypted_content")
    private String encryptedContent;

    @Column("encrypted_dek")
    private String encryptedDek;

    @Column("dek_id")
    private String dekId;

    @Column("key_epoch")
    private String keyEpoch;

    @Column("size_bytes")
    private int size;

    @Column("sync_version")
    private long syncVersion;

    @Column("created_at")
    private long createdAt;

    public NoteVersionRow() {}

    public NoteVersionKey getKey() { return key; }
    public void setKey(NoteVersionKey key) { this.key = key; }
    public String getEncryptedTitle() { return encryptedTitle; }
    public void setEncryptedTitle(String encryptedTitle) { this.encryptedTitle = encryptedTitle; }
    public String getEncryptedContent() { return encryptedContent; }
    public void setEncryptedContent(String encryptedContent) { this.encryptedContent = encryptedContent; }
    public String getEncryptedDek() { return encryptedDek; }
    public void setEncryptedDek(String encryptedDek) { this.encryptedDek = encryptedDek; }
    public String getDekId() { return dekId; }
    public void setDekId(String dekId) { this.dekId = dekId; }
    public String getKeyEpoch() { return keyEpoch; }
    public void setKeyEpoch(String keyEpoch) { this.keyEpoch = keyEpoch; }
    public int getSize() { return size; }
    public void setSize(int size) { this.size = size; }
    public long getSyncVersion() { return syncVersion; }
    public void setSyncVersion(long syncVersion) { this.syncVersion = syncVersion; }
    public long getCreatedAt() { return createdAt; }
    public void setCreatedAt(long createdAt) { this.createdAt = createdAt; }
}
