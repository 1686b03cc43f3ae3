package com.zeronote.error;

public class SessionExpiredException extends ZeroNoteException {

    public SessionExpiredException(String message) {
        super(message);
    }
}
