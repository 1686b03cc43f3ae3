package com.zeronote.protection;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.zeronote.model.Folder;
import com.zeronote.model.Note;
import com.zeronote.model.SyncEntity;

/**
 * Recomputes inherited folder protection for a whole account in one top-down pass.
 *
 * <p>A folder with its own password and {@code inheritToChildren} covers everything below it;
 * the nearest such folder is recorded as {@code protectionSourceId}. Entities with their own
 * password are never touched, so clearing a folder's password only clears flags that came
 * from it, and anything it covered falls back to the next protecting ancestor, if any.
 */
public final class FolderCascade {

    /**
     * Updates flags in place on the tree's folders and on {@code notes}.
     *
     * @return the entities whose flags changed
     */
    public List<SyncEntity<?>> propagate(FolderTree tree, Collection<Note> notes) {
        List<SyncEntity<?>> changed = new ArrayList<>();
        Map<String, String> coverBelow = new HashMap<>();

        Deque<Map.Entry<String, String>> queue = new ArrayDeque<>();
        for (String rootId : tree.roots()) {
            queue.add(Map.entry(rootId, ""));
        }
        while (!queue.isEmpty()) {
            Map.Entry<String, String> next = queue.poll();
            Folder folder = tree.get(next.getKey()).orElseThrow();
            if (coverBelow.containsKey(folder.getId())) {
                continue;
            }
            String inherited = next.getValue().isEmpty() ? null : next.getValue();
            if (applyInherited(folder, inherited)) {
                changed.add(folder);
            }
            String carry = folder.isOwnProtected() && folder.isInheritToChildren() ? folder.getId() : inherited;
            coverBelow.put(folder.getId(), carry == null ? "" : carry);
            for (String childId : tree.childrenOf(folder.getId())) {
                queue.add(Map.entry(childId, carry == null ? "" : carry));
            }
        }

        for (Note note : notes) {
            if (note.isDeleted()) {
                continue;
            }
            String cover = note.getFolderId() == null ? "" : coverBelow.getOrDefault(note.getFolderId(), "");
            if (applyInherited(note, cover.isEmpty() ? null : cover)) {
                changed.add(note);
            }
        }
        return changed;
    }

    private static boolean applyInherited(SyncEntity<?> entity, String sourceId) {
        if (entity.isOwnProtected()) {
            return false;
        }
        if (sourceId != null) {
            if (entity.hasPassword() && entity.isPasswordInherited() && sourceId.equals(entity.getProtectionSourceId())) {
                return false;
            }
            entity.setHasPassword(true);
            entity.setPasswordInherited(true);
            entity.setProtectionSourceId(sourceId);
            return true;
        }
        if (!entity.hasPassword() && !entity.isPasswordInherited() && entity.getProtectionSourceId() == null) {
            return false;
        }
        entity.setHasPassword(false);
        entity.setPasswordInherited(false);
        entity.setProtectionSourceId(null);
        return true;
    }
}
