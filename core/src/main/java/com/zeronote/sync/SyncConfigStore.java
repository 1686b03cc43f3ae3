package com.zeronote.sync;

public interface SyncConfigStore {

    SyncConfig load();

    void save(SyncConfig config);
}
