package com.zeronote.sync;

import java.util.concurrent.atomic.AtomicReference;

public class InMemorySyncConfigStore implements SyncConfigStore {

    private final AtomicReference<SyncConfig> config;

    public InMemorySyncConfigStore(SyncConfig initial) {
        this.config = new AtomicReference<>(initial);
    }

    @Override
    public SyncConfig load() {
        return config.get();
    }

    @Override
    public void save(SyncConfig updated) {
        config.set(updated);
    }
}
