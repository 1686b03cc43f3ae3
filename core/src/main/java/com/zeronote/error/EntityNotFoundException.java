package com.zeronote.error;

public class EntityNotFoundException extends ZeroNoteException {

    public EntityNotFoundException(String type, String id) {
        super(type + " not found: " + id);
    }
}
