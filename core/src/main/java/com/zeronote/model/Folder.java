package com.zeronote.model;

import java.util.LinkedHashMap;
import java.util.Map;

import com.zeronote.crypto.EncryptedBlob;

public class Folder extends SyncEntity<Folder> {

    public static final String NAME = "name";

    private EncryptedBlob encryptedName;
    private String parentId;
    private int order;

    /** When this folder carries its own password, whether the subtree inherits it. */
    private boolean inheritToChildren;

    public Folder() {}

    @Override
    public EntityType getEntityType() {
        return EntityType.FOLDER;
    }

    @Override
    public String getContainerId() {
        return parentId;
    }

    @Override
    public Map<String, EncryptedBlob> getSealedFields() {
        Map<String, EncryptedBlob> fields = new LinkedHashMap<>();
        fields.put(NAME, encryptedName);
        return fields;
    }

    @Override
    public void replaceSealedFields(Map<String, EncryptedBlob> fields) {
        this.encryptedName = fields.get(NAME);
    }

    @Override
    public Folder copy() {
        Folder copy = new Folder();
        copyInto(copy);
        copy.encryptedName = encryptedName;
        copy.parentId = parentId;
        copy.order = order;
        copy.inheritToChildren = inheritToChildren;
        return copy;
    }

    public EncryptedBlob getEncryptedName() { return encryptedName; }
    public void setEncryptedName(EncryptedBlob encryptedName) { this.encryptedName = encryptedName; }
    public String getParentId() { return parentId; }
    public void setParentId(String parentId) { this.parentId = parentId; }
    public int getOrder() { return order; }
    public void setOrder(int order) { this.order = order; }
    public boolean isInheritToChildren() { return inheritToChildren; }
    public void setInheritToChildren(boolean inheritToChildren) { this.inheritToChildren = inheritToChildren; }
}
