package com.zeronote.account;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

public class InMemoryAccountKeyStore implements AccountKeyStore {

    private final AtomicReference<AccountKeys> keys = new AtomicReference<>();

    @Override
    public Optional<AccountKeys> load() {
        return Optional.ofNullable(keys.get());
    }

    @Override
    public void save(AccountKeys updated) {
        keys.set(updated);
    }
}
