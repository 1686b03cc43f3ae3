package com.zeronote.account;

import com.zeronote.crypto.WrappedKey;

/**
 * A master key the account used before its latest password change or recovery, wrapped under
 * the current account KEK. Lets any unlocked device rewrap entities that were still written
 * under the old keys.
 *
 * @param keyEpoch      the epoch that master key was in force for
 * @param masterKeyWrap the old master key, wrapped under the current account KEK
 */
public record RetiredKey(String keyEpoch, WrappedKey masterKeyWrap) {
}
