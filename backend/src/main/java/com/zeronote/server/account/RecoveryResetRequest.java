package com.zeronote.server.account;

import com.zeronote.account.AccountKeys;

public class RecoveryResetRequest {
    public String username;
    public String recoveryKeyHash;
    public String newLoginHash;
    public AccountKeys accountKeys;
}
