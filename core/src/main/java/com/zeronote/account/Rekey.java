package com.zeronote.account;

/**
 * A password change or account recovery in progress. Entities still need rewrapping from
 * {@code previous} to {@code current}; close {@code previous} once that is done.
 *
 * @param loginHash         login verifier for the new password
 * @param previousLoginHash login verifier for the keys being replaced; proves the change to the server
 * @param viaRecovery       opened with the recovery phrase rather than the old password
 */
public record Rekey(AccountKeys keys, KeySession previous, KeySession current, String loginHash,
                    String previousLoginHash, boolean viaRecovery) {
}
