package com.zeronote.server.account;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

/**
 * Zero-knowledge account row. Nothing here opens a note: the key bundle is wrapped under keys
 * derived from the password or the recovery phrase, neither of which reaches the server.
 */
@Table("accounts")
public class UserAccount {

    @PrimaryKey
    public String username;

    /** SHA-256 of the client's login hash, so a leaked table cannot be replayed at login. */
    @Column("login_hash")
    public String loginHash;

    /** The account key bundle as JSON, returned verbatim at login. */
    @Column("account_keys")
    public String accountKeys;

    /** Hash of the normalized recovery phrase, as computed by the client. */
    @Column("recovery_key_hash")
    public String recoveryKeyHash;

    @Column("created_at")
    public long createdAt;
}
