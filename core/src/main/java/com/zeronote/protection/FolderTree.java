package com.zeronote.protection;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.zeronote.error.ValidationFailureException;
import com.zeronote.model.Folder;

/**
 * Index over live folders: id to folder and parent id to child ids. Every walk is an explicit
 * loop over this index. A root folder has depth 1; a folder whose parent is unknown is treated
 * as a root.
 */
public final class FolderTree {

    public static final int MAX_DEPTH = 10;

    private final Map<String, Folder> folders = new LinkedHashMap<>();
    private final Map<String, List<String>> children = new HashMap<>();

    private FolderTree() {
    }

    public static FolderTree of(Collection<Folder> folders) {
        FolderTree tree = new FolderTree();
        for (Folder folder : folders) {
            if (!folder.isDeleted()) {
                tree.folders.put(folder.getId(), folder);
            }
        }
        for (Folder folder : tree.folders.values()) {
            tree.children.computeIfAbsent(tree.parentKey(folder), k -> new ArrayList<>()).add(folder.getId());
        }
        return tree;
    }

    public Optional<Folder> get(String id) {
        return Optional.ofNullable(id == null ? null : folders.get(id));
    }

    public boolean contains(String id) {
        return id != null && folders.containsKey(id);
    }

    public Collection<Folder> folders() {
        return folders.values();
    }

    public List<String> roots() {
        return children.getOrDefault(null, List.of());
    }

    public List<String> childrenOf(String id) {
        return children.getOrDefault(id, List.of());
    }

    /** Number of folders on the path from a root down to {@code id}, inclusive. */
    public int depth(String id) {
        return ancestors(id).size() + 1;
    }

    /** Ancestor ids, nearest first. */
    public List<String> ancestors(String id) {
        List<String> path = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        seen.add(id);
        Folder current = folders.get(id);
        while (current != null && current.getParentId() != null && folders.containsKey(current.getParentId())) {
            String parentId = current.getParentId();
            if (!seen.add(parentId)) {
                throw new ValidationFailureException("Folder hierarchy contains a cycle at " + parentId);
            }
            path.add(parentId);
            current = folders.get(parentId);
        }
        return path;
    }

    /** All folder ids below {@code id}, breadth first. */
    public List<String> descendants(String id) {
        List<String> result = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        seen.add(id);
        Deque<String> queue = new ArrayDeque<>(childrenOf(id));
        while (!queue.isEmpty()) {
            String next = queue.poll();
            if (seen.add(next)) {
                result.add(next);
                queue.addAll(childrenOf(next));
            }
        }
        return result;
    }

    /** Levels in the subtree rooted at {@code id}; 1 for a leaf or an unknown folder. */
    public int height(String id) {
        int levels = 0;
        Set<String> seen = new HashSet<>();
        List<String> level = List.of(id);
        while (!level.isEmpty()) {
            levels++;
            List<String> next = new ArrayList<>();
            for (String folderId : level) {
                if (seen.add(folderId)) {
                    next.addAll(childrenOf(folderId));
                }
            }
            level = next;
        }
        return levels;
    }

    /**
     * Checks that {@code folderId} (existing or new) can sit under {@code parentId}.
     *
     * @throws ValidationFailureException if the move creates a cycle or nests past {@link #MAX_DEPTH}
     */
    public void checkPlacement(String folderId, String parentId) {
        if (parentId != null && !folders.containsKey(parentId)) {
            throw new ValidationFailureException("Parent folder not found: " + parentId);
        }
        if (parentId != null && (parentId.equals(folderId) || descendants(folderId).contains(parentId))) {
            throw new ValidationFailureException("A folder cannot be moved into itself");
        }
        int parentDepth = parentId == null ? 0 : depth(parentId);
        if (parentDepth + height(folderId) > MAX_DEPTH) {
            throw new ValidationFailureException("Folders cannot be nested more than " + MAX_DEPTH + " levels deep");
        }
    }

    private String parentKey(Folder folder) {
        String parentId = folder.getParentId();
        return parentId != null && folders.containsKey(parentId) && !parentId.equals(folder.getId()) ? parentId : null;
    }
}
