package com.zeronote.server.sync;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

/** The last change sequence handed out for an account. */
@Table("sync_cursors")
public class SyncCursor {

    @PrimaryKey
    private String owner;

    @Column("seq")
    private long seq;

    public SyncCursor() {}

    public SyncCursor(String owner, long seq) {
        this.owner = owner;
        this.seq = seq;
    }

    public String getOwner() { return owner; }
    public void setOwner(String owner) { this.owner = owner; }
    public long getSeq() { return seq; }
    public void setSeq(long seq) { this.seq = seq; }
}
