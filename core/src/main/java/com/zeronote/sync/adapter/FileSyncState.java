package com.zeronote.sync.adapter;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.zeronote.account.AccountKeys;
import com.zeronote.model.Folder;
import com.zeronote.model.Note;

/** Contents of the file remote's state file. {@code accountKeys} is null until a device registers. */
public record FileSyncState(List<Note> notes, List<Folder> folders, long currentSyncVersion, AccountKeys accountKeys) {

    public FileSyncState {
        notes = notes == null ? List.of() : List.copyOf(notes);
        folders = folders == null ? List.of() : List.copyOf(folders);
    }

    public static FileSyncState empty() {
        return new FileSyncState(List.of(), List.of(), 0, null);
    }

    @JsonIgnore
    public String keyEpoch() {
        return accountKeys == null ? null : accountKeys.keyEpoch();
    }

    public FileSyncState withAccountKeys(AccountKeys keys) {
        return new FileSyncState(notes, folders, currentSyncVersion, keys);
    }
}
