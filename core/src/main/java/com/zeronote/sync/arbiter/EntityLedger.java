package com.zeronote.sync.arbiter;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import com.zeronote.model.SyncEntity;

/**
 * Versioned storage of one account's entities of one type, as seen by {@link PushArbiter}.
 * Both writes are compare-and-set: they report whether they took effect rather than failing.
 */
public interface EntityLedger<T extends SyncEntity<T>> {

    Mono<T> find(String id);

    /** Stores {@code entity} only if no entity with its id exists. */
    Mono<Boolean> insertIfAbsent(T entity);

    /** Replaces the stored entity only if its {@code syncVersion} still equals {@code expectedVersion}. */
    Mono<Boolean> replaceIfVersion(T entity, long expectedVersion);

    /** Entities stamped with a {@code changeSeq} greater than {@code sinceSeq}, in sequence order. */
    Flux<T> changedSince(long sinceSeq);
}
