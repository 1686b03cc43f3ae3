package com.zeronote.sync;

import com.zeronote.model.Folder;
import com.zeronote.model.Note;

public record PushResponse(EntityPushResult<Note> notes, EntityPushResult<Folder> folders) {
}
