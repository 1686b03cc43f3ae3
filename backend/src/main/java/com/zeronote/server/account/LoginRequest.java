package com.zeronote.server.account;

public class LoginRequest {
    public String username;
    public String loginHash;
}
