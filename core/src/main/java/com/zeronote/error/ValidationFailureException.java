package com.zeronote.error;

/**
 * Input rejected before any cryptographic or storage work ran: a malformed recovery phrase,
 * a folder nested too deep, a history request over the retention limit.
 */
public class ValidationFailureException extends ZeroNoteException {

    public ValidationFailureException(String message) {
        super(message);
    }
}
