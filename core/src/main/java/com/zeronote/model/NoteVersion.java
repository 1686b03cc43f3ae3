package com.zeronote.model;

import com.zeronote.crypto.EncryptedBlob;
import com.zeronote.crypto.WrappedKey;

/**
 * One retained snapshot of a note's ciphertext. {@code encryptedDek} is the wrap that was
 * current when the snapshot was taken; a later password change does not rewrap history.
 * {@code dekId} names the DEK itself, so a snapshot can be restored under the note's current
 * wrap as long as the note still uses the same DEK.
 */
public record NoteVersion(
        String id,
        String noteId,
        EncryptedBlob encryptedTitle,
        EncryptedBlob encryptedContent,
        WrappedKey encryptedDek,
        String dekId,
        String keyEpoch,
        int size,
        long syncVersion,
        long createdAt) {

    public static final int CAPACITY = 50;
}
