package com.zeronote.server.web;

/** Missing, unknown or expired bearer token, or credentials that did not match. */
public class UnauthorizedException extends RuntimeException {

    public UnauthorizedException(String message) {
        super(message);
    }
}
