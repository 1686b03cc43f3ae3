package com.zeronote.server.account;

public class RecoveryRequest {
    public String username;
    public String recoveryKeyHash;
}
