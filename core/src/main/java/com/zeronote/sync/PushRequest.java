package com.zeronote.sync;

import java.util.List;

import com.zeronote.model.Folder;
import com.zeronote.model.Note;

public record PushRequest(String deviceId, List<Note> notes, List<Folder> folders) {

    public PushRequest {
        notes = notes == null ? List.of() : List.copyOf(notes);
        folders = folders == null ? List.of() : List.copyOf(folders);
    }
}
