package com.zeronote.server.account;

/** What a client needs before login: the KDF parameters to turn the password into a login hash. */
public record PreloginResponse(byte[] salt, int iterations) {
}
