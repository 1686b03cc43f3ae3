package com.zeronote.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.zeronote.crypto.EncryptedBlob;

public class Note extends SyncEntity<Note> {

    public static final String TITLE = "title";
    public static final String CONTENT = "content";

    private EncryptedBlob encryptedTitle;
    private EncryptedBlob encryptedContent;
    private String folderId;
    private boolean pinned;
    private Long pinnedAt;
    private List<String> tags = new ArrayList<>();

    public Note() {}

    @Override
    public EntityType getEntityType() {
        return EntityType.NOTE;
    }

    @Override
    public String getContainerId() {
        return folderId;
    }

    @Override
    public Map<String, EncryptedBlob> getSealedFields() {
        Map<String, EncryptedBlob> fields = new LinkedHashMap<>();
        fields.put(TITLE, encryptedTitle);
        fields.put(CONTENT, encryptedContent);
        return fields;
    }

    @Override
    public void replaceSealedFields(Map<String, EncryptedBlob> fields) {
        this.encryptedTitle = fields.get(TITLE);
        this.encryptedContent = fields.get(CONTENT);
    }

    @Override
    public Note copy() {
        Note copy = new Note();
        copyInto(copy);
        copy.encryptedTitle = encryptedTitle;
        copy.encryptedContent = encryptedContent;
        copy.folderId = folderId;
        copy.pinned = pinned;
        copy.pinnedAt = pinnedAt;
        copy.tags = new ArrayList<>(tags);
        return copy;
    }

    // Getters & Setters
    public EncryptedBlob getEncryptedTitle() { return encryptedTitle; }
    public void setEncryptedTitle(EncryptedBlob encryptedTitle) { this.encryptedTitle = encryptedTitle; }
    public EncryptedBlob getEncryptedContent() { return encryptedContent; }
    public void setEncryptedContent(EncryptedBlob encryptedContent) { this.encryptedContent = encryptedContent; }
    public String getFolderId() { return folderId; }
    public void setFolderId(String folderId) { this.folderId = folderId; }

    @JsonProperty("isPinned")
    public boolean isPinned() { return pinned; }
    @JsonProperty("isPinned")
    public void setPinned(boolean pinned) { this.pinned = pinned; }
    public Long getPinnedAt() { return pinnedAt; }
    public void setPinnedAt(Long pinnedAt) { this.pinnedAt = pinnedAt; }
    public List<String> getTags() { return tags; }
    public void setTags(List<String> tags) { this.tags = tags == null ? new ArrayList<>() : new ArrayList<>(tags); }
}
