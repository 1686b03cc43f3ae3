package com.zeronote.server.account;

import com.zeronote.account.AccountKeys;

/** Password change: proves the old password and installs the rewrapped bundle. */
public class KeyUpdateRequest {
    public String currentLoginHash;
    public String newLoginHash;
    public AccountKeys accountKeys;
}
