package com.zeronote.notebook;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zeronote.account.AccountKeyring;
import com.zeronote.account.AccountKeys;
import com.zeronote.account.KeySession;
import com.zeronote.account.PasswordRotation;
import com.zeronote.account.Rekey;
import com.zeronote.crypto.Dek;
import com.zeronote.crypto.KeyWrap;
import com.zeronote.error.AuthenticationFailureException;
import com.zeronote.error.EntityNotFoundException;
import com.zeronote.error.ValidationFailureException;
import com.zeronote.model.Folder;
import com.zeronote.model.Note;
import com.zeronote.model.SyncEntity;
import com.zeronote.protection.FolderCascade;
import com.zeronote.protection.FolderTree;
import com.zeronote.protection.LockoutPolicy;
import com.zeronote.protection.SecondaryPassword;
import com.zeronote.store.LocalStore;

/**
 * Everything a device does to notes and folders. Plaintext goes in and comes out here and
 * nowhere else; what reaches the stores is ciphertext.
 *
 * <p>Every operation takes the {@link KeySession} it runs under. Every mutation stamps
 * {@code updatedAt}, marks the entity dirty and notifies the change listener, which is how the
 * debounced flush learns there is something to push.
 */
public class NotebookService {

    private static final Logger log = LoggerFactory.getLogger(NotebookService.class);

    private final LocalStore<Note> notes;
    private final LocalStore<Folder> folders;
    private final AccountKeyring keyring;
    private final PasswordRotation rotation;
    private final SecondaryPassword secondaryPassword;
    private final LockoutPolicy lockoutPolicy;
    private final KeyWrap keyWrap;
    private final FolderCascade cascade = new FolderCascade();
    private final Clock clock;

    private volatile Runnable changeListener = () -> { };

    public NotebookService(LocalStore<Note> notes, LocalStore<Folder> folders, AccountKeyring keyring,
                           PasswordRotation rotation, SecondaryPassword secondaryPassword,
                           LockoutPolicy lockoutPolicy, KeyWrap keyWrap, Clock clock) {
        this.notes = notes;
        this.folders = folders;
        this.keyring = keyring;
        this.rotation = rotation;
        this.secondaryPassword = secondaryPassword;
        this.lockoutPolicy = lockoutPolicy;
        this.keyWrap = keyWrap;
        this.clock = clock;
    }

    public void setChangeListener(Runnable listener) {
        this.changeListener = listener == null ? () -> { } : listener;
    }

    // ── Notes ────────────────────────────────────────────────────────────────

    public NoteView createNote(KeySession session, String title, String content, String folderId) {
        if (folderId != null) {
            liveFolder(folderId);
        }
        long now = clock.millis();
        Note note = new Note();
        note.setId(UUID.randomUUID().toString());
        note.setFolderId(folderId);
        note.setCreatedAt(now);
        Dek dek = Dek.generate();
        try {
            secondaryPassword.encryptFields(note, noteFields(title, content), dek);
            note.setEncryptedDek(keyWrap.wrap(dek, session.accountKek()));
            note.setDekId(UUID.randomUUID().toString());
            note.setKeyEpoch(session.keyEpoch());
        } finally {
            dek.destroy();
        }
        note.touch(now);
        notes.put(note);
        refreshProtection();
        changed();
        Note stored = liveNote(note.getId());
        return new NoteView(stored.getId(), title, content, folderId, false, List.of(), stored.hasPassword(),
                stored.getCreatedAt(), stored.getUpdatedAt());
    }

    /** Reads a note that has no password, its own or inherited. */
    public NoteView readNote(KeySession session, String id) {
        Note note = liveNote(id);
        if (note.hasPassword()) {
            throw new AuthenticationFailureException("Password required");
        }
        return readWith(note, null, session);
    }

    /**
     * Reads a protected note. For a note under its own password, that password; for a note
     * covered by a folder, the folder's. Failed attempts count against whichever entity owns
     * the password.
     */
    public NoteView readProtectedNote(KeySession session, String id, String password) {
        return readWith(liveNote(id), password, session);
    }

    public NoteView updateNote(KeySession session, String id, String title, String content, String password) {
        Note note = liveNote(id);
        Dek dek = dekFor(note, notes, password, session);
        try {
            Note current = liveNote(id);
            secondaryPassword.encryptFields(current, noteFields(title, content), dek);
            current.touch(clock.millis());
            notes.put(current);
        } finally {
            dek.destroy();
        }
        changed();
        return readWith(liveNote(id), password, session);
    }

    public void moveNote(String id, String folderId) {
        if (folderId != null) {
            liveFolder(folderId);
        }
        Note note = liveNote(id);
        note.setFolderId(folderId);
        note.touch(clock.millis());
        notes.put(note);
        refreshProtection();
        changed();
    }

    public void setPinned(String id, boolean pinned) {
        Note note = liveNote(id);
        long now = clock.millis();
        note.setPinned(pinned);
        note.setPinnedAt(pinned ? now : null);
        note.touch(now);
        notes.put(note);
        changed();
    }

    public void setTags(String id, List<String> tags) {
        Note note = liveNote(id);
        note.setTags(tags.stream().map(String::trim).filter(tag -> !tag.isEmpty()).distinct().collect(Collectors.toList()));
        note.touch(clock.millis());
        notes.put(note);
        changed();
    }

    /** Tombstones the note; the ciphertext stays until the tombstone has synced. */
    public void deleteNote(String id) {
        Note note = liveNote(id);
        tombstone(note);
        notes.put(note);
        changed();
    }

    public List<Note> listNotes(String folderId) {
        return notes.findByParent(folderId).stream().filter(note -> !note.isDeleted()).collect(Collectors.toList());
    }

    // ── Folders ──────────────────────────────────────────────────────────────

    public FolderView createFolder(KeySession session, String name, String parentId) {
        String id = UUID.randomUUID().toString();
        FolderTree.of(folders.getAll()).checkPlacement(id, parentId);

        long now = clock.millis();
        Folder folder = new Folder();
        folder.setId(id);
        folder.setParentId(parentId);
        folder.setOrder((int) folders.findByParent(parentId).stream().filter(f -> !f.isDeleted()).count());
        folder.setCreatedAt(now);
        Dek dek = Dek.generate();
        try {
            secondaryPassword.encryptFields(folder, folderFields(name), dek);
            folder.setEncryptedDek(keyWrap.wrap(dek, session.accountKek()));
            folder.setDekId(UUID.randomUUID().toString());
            folder.setKeyEpoch(session.keyEpoch());
        } finally {
            dek.destroy();
        }
        folder.touch(now);
        folders.put(folder);
        refreshProtection();
        changed();
        return new FolderView(id, name, parentId, folder.getOrder(), liveFolder(id).hasPassword());
    }

    public FolderView readFolder(KeySession session, String id, String password) {
        Folder folder = liveFolder(id);
        Dek dek = dekFor(folder, folders, password, session);
        try {
            Map<String, String> fields = secondaryPassword.decryptFields(folder, dek);
            return new FolderView(id, fields.get(Folder.NAME), folder.getParentId(), folder.getOrder(), folder.hasPassword());
        } finally {
            dek.destroy();
        }
    }

    public void renameFolder(KeySession session, String id, String name, String password) {
        Folder folder = liveFolder(id);
        Dek dek = dekFor(folder, folders, password, session);
        try {
            Folder current = liveFolder(id);
            secondaryPassword.encryptFields(current, folderFields(name), dek);
            current.touch(clock.millis());
            folders.put(current);
        } finally {
            dek.destroy();
        }
        changed();
    }

    /**
     * @throws ValidationFailureException if the move nests deeper than {@link FolderTree#MAX_DEPTH}
     *                                    or into the folder's own subtree
     */
    public void moveFolder(String id, String newParentId) {
        Folder folder = liveFolder(id);
        FolderTree.of(folders.getAll()).checkPlacement(id, newParentId);
        folder.setParentId(newParentId);
        folder.touch(clock.millis());
        folders.put(folder);
        refreshProtection();
        changed();
    }

    /** Tombstones the folder, every folder below it and every note inside them. */
    public void deleteFolder(String id) {
        liveFolder(id);
        FolderTree tree = FolderTree.of(folders.getAll());
        List<String> doomed = new ArrayList<>();
        doomed.add(id);
        doomed.addAll(tree.descendants(id));

        List<Folder> deletedFolders = new ArrayList<>();
        List<Note> deletedNotes = new ArrayList<>();
        for (String folderId : doomed) {
            Folder folder = tree.get(folderId).orElseThrow();
            tombstone(folder);
            deletedFolders.add(folder);
            for (Note note : notes.findByParent(folderId)) {
                if (!note.isDeleted()) {
                    tombstone(note);
                    deletedNotes.add(note);
                }
            }
        }
        folders.putAll(deletedFolders);
        notes.putAll(deletedNotes);
        log.debug("Deleted folder {} with {} subfolders and {} notes", id, doomed.size() - 1, deletedNotes.size());
        changed();
    }

    public List<Folder> listFolders(String parentId) {
        return folders.findByParent(parentId).stream().filter(folder -> !folder.isDeleted()).collect(Collectors.toList());
    }

    // ── Protection ───────────────────────────────────────────────────────────

    public void protectNote(KeySession session, String id, String password) {
        Note note = liveNote(id);
        secondaryPassword.protect(note, password, session);
        note.touch(clock.millis());
        notes.put(note);
        changed();
    }

    public void protectFolder(KeySession session, String id, String password, boolean inheritToChildren) {
        Folder folder = liveFolder(id);
        secondaryPassword.protect(folder, password, session);
        folder.setInheritToChildren(inheritToChildren);
        folder.touch(clock.millis());
        folders.put(folder);
        refreshProtection();
        changed();
    }

    public void setInheritToChildren(String id, boolean inheritToChildren) {
        Folder folder = liveFolder(id);
        folder.setInheritToChildren(inheritToChildren);
        folder.touch(clock.millis());
        folders.put(folder);
        refreshProtection();
        changed();
    }

    public void unprotectNote(KeySession session, String id, String password) {
        Note note = liveNote(id);
        guarded(note, notes, () -> {
            secondaryPassword.remove(note, password, session);
            return null;
        });
        note.touch(clock.millis());
        notes.put(note);
        refreshProtection();
        changed();
    }

    public void unprotectFolder(KeySession session, String id, String password) {
        Folder folder = liveFolder(id);
        guarded(folder, folders, () -> {
            secondaryPassword.remove(folder, password, session);
            return null;
        });
        folder.touch(clock.millis());
        folders.put(folder);
        refreshProtection();
        changed();
    }

    /** Sets a new password on a note whose password is forgotten, using the recovery wrap. */
    public void resetNotePasswordWithRecovery(KeySession session, String id, String newPassword) {
        Note note = liveNote(id);
        secondaryPassword.resetWithRecovery(note, newPassword, session);
        note.setLockout(null);
        note.touch(clock.millis());
        notes.put(note);
        changed();
    }

    public void removeNotePasswordWithRecovery(KeySession session, String id) {
        Note note = liveNote(id);
        secondaryPassword.removeWithRecovery(note, session);
        note.setLockout(null);
        note.touch(clock.millis());
        notes.put(note);
        refreshProtection();
        changed();
    }

    public void resetFolderPasswordWithRecovery(KeySession session, String id, String newPassword) {
        Folder folder = liveFolder(id);
        secondaryPassword.resetWithRecovery(folder, newPassword, session);
        folder.setLockout(null);
        folder.touch(clock.millis());
        folders.put(folder);
        changed();
    }

    public void removeFolderPasswordWithRecovery(KeySession session, String id) {
        Folder folder = liveFolder(id);
        secondaryPassword.removeWithRecovery(folder, session);
        folder.setLockout(null);
        folder.touch(clock.millis());
        folders.put(folder);
        refreshProtection();
        changed();
    }

    // ── Account ──────────────────────────────────────────────────────────────

    /**
     * Changes the account password and rewraps every entity. Either every entity moves to the
     * new keys or none does.
     *
     * @return the new key bundle and sessions; {@link Rekey#previous()} is already closed
     */
    public Rekey changeAccountPassword(String oldPassword, String newPassword, AccountKeys keys) {
        return applyRekey(keyring.changePassword(oldPassword, newPassword, keys));
    }

    /** Reopens the account from its recovery phrase under a new password and rewraps every entity. */
    public Rekey recoverAccount(List<String> recoveryWords, String newPassword, AccountKeys keys) {
        return applyRekey(keyring.recover(recoveryWords, newPassword, keys));
    }

    /**
     * Moves every local entity from {@link Rekey#previous()} to {@link Rekey#current()} and closes
     * the previous session. Entities still under an older generation follow through
     * {@link #rewrapRetired}. On failure nothing is stored and both sessions are closed.
     */
    public Rekey applyRekey(Rekey rekey) {
        try {
            long now = clock.millis();
            List<Note> rotatedNotes = rotation.rotate(underEpoch(notes.getAll(), rekey.previous()),
                    rekey.previous(), rekey.current(), now);
            List<Folder> rotatedFolders = rotation.rotate(underEpoch(folders.getAll(), rekey.previous()),
                    rekey.previous(), rekey.current(), now);
            notes.putAll(rotatedNotes);
            folders.putAll(rotatedFolders);
        } catch (RuntimeException e) {
            rekey.current().close();
            throw e;
        } finally {
            rekey.previous().close();
        }
        changed();
        rewrapRetired(rekey.current(), rekey.keys());
        return rekey;
    }

    /**
     * Rewraps entities still under an earlier key generation, such as edits another device made
     * before it learned of a password change. The old keys come from the retired wraps in
     * {@code keys}; entities from a generation {@code keys} no longer holds are left alone.
     *
     * @return how many entities moved to the session's epoch
     */
    public int rewrapRetired(KeySession session, AccountKeys keys) {
        Map<String, List<Note>> staleNotes = staleByEpoch(notes.getAll(), session);
        Map<String, List<Folder>> staleFolders = staleByEpoch(folders.getAll(), session);
        List<String> epochs = new ArrayList<>(staleNotes.keySet());
        staleFolders.keySet().stream().filter(epoch -> !staleNotes.containsKey(epoch)).forEach(epochs::add);
        if (epochs.isEmpty()) {
            return 0;
        }
        long now = clock.millis();
        List<Note> rotatedNotes = new ArrayList<>();
        List<Folder> rotatedFolders = new ArrayList<>();
        for (String epoch : epochs) {
            KeySession retired = keyring.openRetired(session, keys, epoch).orElse(null);
            if (retired == null) {
                log.warn("No retired key for epoch {}; {} notes and {} folders stay unreadable", epoch,
                        staleNotes.getOrDefault(epoch, List.of()).size(), staleFolders.getOrDefault(epoch, List.of()).size());
                continue;
            }
            try {
                rotatedNotes.addAll(rotation.rotate(staleNotes.getOrDefault(epoch, List.of()), retired, session, now));
                rotatedFolders.addAll(rotation.rotate(staleFolders.getOrDefault(epoch, List.of()), retired, session, now));
            } finally {
                retired.close();
            }
        }
        notes.putAll(rotatedNotes);
        folders.putAll(rotatedFolders);
        int moved = rotatedNotes.size() + rotatedFolders.size();
        if (moved > 0) {
            log.info("Rewrapped {} entities from retired keys to epoch {}", moved, session.keyEpoch());
            changed();
        }
        return moved;
    }

    // Unstamped entities predate key epochs and are taken to be under the session's keys.
    private static <T extends SyncEntity<T>> List<T> underEpoch(List<T> entities, KeySession session) {
        return entities.stream()
                .filter(entity -> entity.getKeyEpoch() == null || entity.getKeyEpoch().equals(session.keyEpoch()))
                .collect(Collectors.toList());
    }

    private static <T extends SyncEntity<T>> Map<String, List<T>> staleByEpoch(List<T> entities, KeySession session) {
        Map<String, List<T>> stale = new LinkedHashMap<>();
        for (T entity : entities) {
            String epoch = entity.getKeyEpoch();
            if (epoch != null && !epoch.equals(session.keyEpoch())) {
                stale.computeIfAbsent(epoch, key -> new ArrayList<>()).add(entity);
            }
        }
        return stale;
    }

    // ── Internals ────────────────────────────────────────────────────────────

    private NoteView readWith(Note note, String password, KeySession session) {
        Dek dek = dekFor(note, notes, password, session);
        try {
            Map<String, String> fields = secondaryPassword.decryptFields(note, dek);
            return new NoteView(note.getId(), fields.get(Note.TITLE), fields.get(Note.CONTENT), note.getFolderId(),
                    note.isPinned(), List.copyOf(note.getTags()), note.hasPassword(),
                    note.getCreatedAt(), note.getUpdatedAt());
        } finally {
            dek.destroy();
        }
    }

    /** Opens an entity's DEK, checking whichever password guards it. */
    private <T extends SyncEntity<T>> Dek dekFor(T entity, LocalStore<T> store, String password, KeySession session) {
        if (entity.isOwnProtected()) {
            requirePassword(password);
            return guarded(entity, store, () -> secondaryPassword.unlock(entity, password, session));
        }
        if (entity.hasPassword() && entity.getProtectionSourceId() != null) {
            requirePassword(password);
            Folder source = liveFolder(entity.getProtectionSourceId());
            guarded(source, folders, () -> secondaryPassword.unlock(source, password, session)).destroy();
        }
        return secondaryPassword.openDek(entity, session);
    }

    // Lockout state is saved whether the attempt succeeded or not.
    private <T extends SyncEntity<T>, R> R guarded(T entity, LocalStore<T> store, Supplier<R> verification) {
        try {
            return lockoutPolicy.attempt(entity, verification);
        } finally {
            store.get(entity.getId()).ifPresent(stored -> {
                stored.setLockout(entity.getLockout());
                store.put(stored);
            });
        }
    }

    private void refreshProtection() {
        List<Note> allNotes = notes.getAll();
        List<SyncEntity<?>> flagged = cascade.propagate(FolderTree.of(folders.getAll()), allNotes);
        if (flagged.isEmpty()) {
            return;
        }
        long now = clock.millis();
        List<Folder> changedFolders = new ArrayList<>();
        List<Note> changedNotes = new ArrayList<>();
        for (SyncEntity<?> entity : flagged) {
            entity.touch(now);
            if (entity instanceof Folder folder) {
                changedFolders.add(folder);
            } else if (entity instanceof Note note) {
                changedNotes.add(note);
            }
        }
        folders.putAll(changedFolders);
        notes.putAll(changedNotes);
        log.debug("Inherited protection updated on {} folders and {} notes", changedFolders.size(), changedNotes.size());
    }

    private void tombstone(SyncEntity<?> entity) {
        long now = clock.millis();
        entity.setDeleted(true);
        entity.setDeletedAt(now);
        entity.touch(now);
    }

    private Note liveNote(String id) {
        return notes.get(id).filter(note -> !note.isDeleted())
                .orElseThrow(() -> new EntityNotFoundException("Note", id));
    }

    private Folder liveFolder(String id) {
        return folders.get(id).filter(folder -> !folder.isDeleted())
                .orElseThrow(() -> new EntityNotFoundException("Folder", id));
    }

    private void changed() {
        changeListener.run();
    }

    private static void requirePassword(String password) {
        if (password == null || password.isEmpty()) {
            throw new AuthenticationFailureException("Password required");
        }
    }

    private static Map<String, String> noteFields(String title, String content) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(Note.TITLE, title == null ? "" : title);
        fields.put(Note.CONTENT, content == null ? "" : content);
        return fields;
    }

    private static Map<String, String> folderFields(String name) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(Folder.NAME, name == null ? "" : name);
        return fields;
    }
}
