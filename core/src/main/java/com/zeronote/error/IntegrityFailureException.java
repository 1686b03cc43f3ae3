package com.zeronote.error;

/** Authentication tag mismatch on a ciphertext. Fatal for that blob. */
public class IntegrityFailureException extends ZeroNoteException {

    public IntegrityFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
