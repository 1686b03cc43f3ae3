package com.zeronote.sync;

import java.util.List;

import com.zeronote.model.Folder;
import com.zeronote.model.Note;

/**
 * Entities changed after the requested cursor, and the cursor to ask from next time.
 *
 * @param keyEpoch the account's current key epoch, or null when the remote holds no key bundle
 */
public record PullResponse(List<Note> notes, List<Folder> folders, long currentSyncVersion, String keyEpoch) {

    public PullResponse {
        notes = notes == null ? List.of() : List.copyOf(notes);
        folders = folders == null ? List.of() : List.copyOf(folders);
    }
}
