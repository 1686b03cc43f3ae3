package com.zeronote.error;

/**
 * A key did not match: an unwrap failed its integrity check or a password-derived key could not
 * open what it was supposed to open. Never retried automatically; the caller must re-prompt.
 */
public class AuthenticationFailureException extends ZeroNoteException {

    public static final String INCORRECT_PASSWORD = "Incorrect password";

    public AuthenticationFailureException(String message) {
        super(message);
    }

    public AuthenticationFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    /** The only message a user ever sees for a failed password, whichever step rejected it. */
    public static AuthenticationFailureException incorrectPassword(Throwable cause) {
        return new AuthenticationFailureException(INCORRECT_PASSWORD, cause);
    }
}
