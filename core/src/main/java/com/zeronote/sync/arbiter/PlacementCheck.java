package com.zeronote.sync.arbiter;

import reactor.core.publisher.Mono;

import com.zeronote.model.SyncEntity;

/** Structural validation run before a pushed entity is written. Errors with a validation failure to reject it. */
@FunctionalInterface
public interface PlacementCheck<T extends SyncEntity<T>> {

    Mono<Void> check(T entity);

    static <T extends SyncEntity<T>> PlacementCheck<T> none() {
        return entity -> Mono.empty();
    }
}
