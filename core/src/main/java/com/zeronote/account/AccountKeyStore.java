package com.zeronote.account;

import java.util.Optional;

/** The device's copy of the account key bundle, so it can unlock without reaching the remote. */
public interface AccountKeyStore {

    Optional<AccountKeys> load();

    void save(AccountKeys keys);
}
