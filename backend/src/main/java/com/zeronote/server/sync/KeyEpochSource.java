package com.zeronote.server.sync;

import reactor.core.publisher.Mono;

/** The key epoch an account's entities must carry to be accepted. */
public interface KeyEpochSource {

    /** Empty when the account has no key bundle on record. */
    Mono<String> keyEpoch(String owner);
}
