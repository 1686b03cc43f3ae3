package com.zeronote.server.account;

import com.zeronote.account.AccountKeys;

public class SignUpRequest {
    public String username;
    public String loginHash;
    public AccountKeys accountKeys;
}
