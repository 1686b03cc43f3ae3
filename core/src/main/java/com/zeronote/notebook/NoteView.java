package com.zeronote.notebook;

import java.util.List;

/** Decrypted note, held only in memory. */
public record NoteView(
        String id,
        String title,
        String content,
        String folderId,
        boolean pinned,
        List<String> tags,
        boolean passwordProtected,
        long createdAt,
        long updatedAt) {
}
