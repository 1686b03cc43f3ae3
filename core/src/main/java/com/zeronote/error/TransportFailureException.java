package com.zeronote.error;

/** The sync remote could not be reached or answered with an error. Recoverable. */
public class TransportFailureException extends ZeroNoteException {

    public TransportFailureException(String message) {
        super(message);
    }

    public TransportFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
