package com.zeronote.account;

import reactor.core.publisher.Mono;

/**
 * Where a sync remote keeps the account's key bundle, so a password change or recovery made
 * on one device reaches the others.
 */
public interface KeyDirectory {

    /** The bundle the remote holds now; empty when none has been published. */
    Mono<AccountKeys> fetch();

    /** Stores the first bundle of a newly registered account. */
    Mono<Void> register(Registration registration);

    /**
     * Replaces the bundle after a password change or recovery.
     *
     * @return an error if the remote already moved past the bundle {@code rekey} started from
     */
    Mono<Void> publish(Rekey rekey);
}
