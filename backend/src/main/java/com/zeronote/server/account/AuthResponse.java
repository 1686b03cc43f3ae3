package com.zeronote.server.account;

import com.zeronote.account.AccountKeys;

/** Session token plus the key bundle the client unlocks locally. */
public class AuthResponse {
    public String token;
    public AccountKeys accountKeys;
}
