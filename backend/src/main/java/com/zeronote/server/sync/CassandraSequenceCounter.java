package com.zeronote.server.sync;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.cassandra.core.InsertOptions;
import org.springframework.data.cassandra.core.ReactiveCassandraOperations;
import org.springframework.data.cassandra.core.UpdateOptions;
import org.springframework.data.cassandra.core.WriteResult;
import org.springframework.data.cassandra.core.query.Criteria;

import com.zeronote.sync.arbiter.SequenceCounter;

import reactor.core.publisher.Mono;

/** Per-account change sequence in {@code sync_cursors}, advanced with compare-and-set. */
public class CassandraSequenceCounter implements SequenceCounter {

    private static final Logger log = LoggerFactory.getLogger(CassandraSequenceCounter.class);

    static final int MAX_ATTEMPTS = 16;

    private final String owner;
    private final ReactiveCassandraOperations operations;

    public CassandraSequenceCounter(String owner, ReactiveCassandraOperations operations) {
        this.owner = owner;
        this.operations = operations;
    }

    @Override
    public Mono<Long> next() {
        return attempt(MAX_ATTEMPTS);
    }

    @Override
    public Mono<Long> current() {
        return operations.selectOneById(owner, SyncCursor.class)
                .map(SyncCursor::getSeq)
                .defaultIfEmpty(0L);
    }

    private Mono<Long> attempt(int attemptsLeft) {
        return Mono.defer(() -> operations.selectOneById(owner, SyncCursor.class)
                        .map(Optional::of)
                        .defaultIfEmpty(Optional.empty())
                        .flatMap(cursor -> cursor.isPresent() ? advance(cursor.get().getSeq()) : start()))
                .switchIfEmpty(Mono.defer(() -> {
                    if (attemptsLeft <= 1) {
                        log.warn("Change sequence for {} stayed contended", owner);
                        return Mono.error(new IllegalStateException("Too many concurrent writes, retry later"));
                    }
                    return attempt(attemptsLeft - 1);
                }));
    }

    // Empty when another writer created the cursor first.
    private Mono<Long> start() {
        return operations.insert(new SyncCursor(owner, 1), InsertOptions.builder().withIfNotExists().build())
                .filter(WriteResult::wasApplied)
                .map(applied -> 1L);
    }

    // Empty when another writer advanced the cursor first.
    private Mono<Long> advance(long current) {
        UpdateOptions condition = UpdateOptions.builder()
                .ifCondition(Criteria.where("seq").is(current))
                .build();
        return operations.update(new SyncCursor(owner, current + 1), condition)
                .filter(WriteResult::wasApplied)
                .map(applied -> current + 1);
    }
}
