package com.zeronote.notebook;

public record FolderView(String id, String name, String parentId, int order, boolean passwordProtected) {
}
