package com.zeronote.account;

import com.zeronote.recovery.RecoveryKey;

/**
 * Result of registering an account. {@code recoveryKey} is shown to the user once and then
 * dropped; only {@code keys} and {@code loginHash} go to the server.
 */
public record Registration(AccountKeys keys, RecoveryKey recoveryKey, KeySession session, String loginHash) {
}
