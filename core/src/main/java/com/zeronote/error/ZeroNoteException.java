package com.zeronote.error;

/**
 * Root of every failure raised by the ZeroNote core.
 *
 * All subclasses are unchecked: callers on the reactive paths receive them as error signals,
 * callers on the synchronous paths (crypto, protection) see them thrown directly.
 */
public abstract class ZeroNoteException extends RuntimeException {

    protected ZeroNoteException(String message) {
        super(message);
    }

    protected ZeroNoteException(String message, Throwable cause) {
        super(message, cause);
    }
}
