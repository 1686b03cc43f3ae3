package com.zeronote.sync.arbiter;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import com.zeronote.error.ValidationFailureException;
import com.zeronote.model.LockoutState;
import com.zeronote.model.SyncEntity;
import com.zeronote.sync.EntityPushResult;
import com.zeronote.sync.PushOutcome;
import com.zeronote.sync.PushStatus;

/**
 * Server-side push algorithm, shared by every remote so the file remote and the HTTP server
 * resolve conflicts identically.
 *
 * <p>Each entity is decided on its own: unknown entities are inserted at version 1, known ones
 * go through {@link ConflictResolver}. Every write is compare-and-set against the version that
 * was read, so two devices can never be handed the same version number; a lost race re-reads
 * and decides again, up to {@code maxRetries} times.
 *
 * <p>When the account's key epoch is known, an entity stamped with any other epoch is refused
 * as {@link PushStatus#STALE_KEYS} before anything is read, so DEKs wrapped under replaced keys
 * never reach storage.
 */
public class PushArbiter {

    private static final Logger log = LoggerFactory.getLogger(PushArbiter.class);

    public static final int DEFAULT_MAX_RETRIES = 3;

    private final ConflictResolver resolver;
    private final int maxRetries;

    public PushArbiter() {
        this(new ConflictResolver(), DEFAULT_MAX_RETRIES);
    }

    public PushArbiter(ConflictResolver resolver, int maxRetries) {
        this.resolver = resolver;
        this.maxRetries = maxRetries;
    }

    public <T extends SyncEntity<T>> Mono<EntityPushResult<T>> arbitrate(String deviceId, List<T> incoming,
                                                                    EntityLedger<T> ledger,
                                                                    SequenceCounter sequence,
                                                                    PlacementCheck<T> placement) {
        return arbitrate(deviceId, incoming, ledger, sequence, placement, null);
    }

    /**
     * @param keyEpoch the account's current key epoch, or null to accept any
     */
    public <T extends SyncEntity<T>> Mono<EntityPushResult<T>> arbitrate(String deviceId, List<T> incoming,
                                                                    EntityLedger<T> ledger,
                                                                    SequenceCounter sequence,
                                                                    PlacementCheck<T> placement,
                                                                    String keyEpoch) {
        return Flux.fromIterable(incoming)
                .concatMap(entity -> arbitrateOne(deviceId, entity, ledger, sequence, placement, keyEpoch))
                .collectList()
                .map(EntityPushResult::of);
    }

    private <T extends SyncEntity<T>> Mono<PushOutcome<T>> arbitrateOne(String deviceId, T entity,
                                                                  EntityLedger<T> ledger,
                                                                  SequenceCounter sequence,
                                                                  PlacementCheck<T> placement,
                                                                  String keyEpoch) {
        if (entity.getId() == null || entity.getId().isBlank()) {
            return Mono.just(PushOutcome.<T>rejected(entity.getId(), "Entity id is required"));
        }
        if (keyEpoch != null && !keyEpoch.equals(entity.getKeyEpoch())) {
            log.info("Refused {} {} from {}: key epoch {} is not the account's {}",
                    entity.getEntityType(), entity.getId(), deviceId, entity.getKeyEpoch(), keyEpoch);
            return Mono.just(PushOutcome.<T>staleKeys(entity.getId(), entity.getKeyEpoch(), keyEpoch));
        }
        return placement.check(entity)
                .then(attempt(deviceId, entity, ledger, sequence, maxRetries))
                .onErrorResume(ValidationFailureException.class, e -> {
                    log.warn("Rejected {} {}: {}", entity.getEntityType(), entity.getId(), e.getMessage());
                    return Mono.just(PushOutcome.<T>rejected(entity.getId(), e.getMessage()));
                });
    }

    private <T extends SyncEntity<T>> Mono<PushOutcome<T>> attempt(String deviceId, T entity, EntityLedger<T> ledger,
                                                             SequenceCounter sequence, int retriesLeft) {
        return Mono.defer(() -> ledger.find(entity.getId())
                        .map(Optional::of)
                        .defaultIfEmpty(Optional.empty())
                        .flatMap(stored -> stored.isPresent()
                                ? update(deviceId, stored.get(), entity, ledger, sequence)
                                : create(deviceId, entity, ledger, sequence)))
                .switchIfEmpty(Mono.defer(() -> {
                    if (retriesLeft <= 0) {
                        log.warn("Gave up on {} {} after repeated concurrent writes", entity.getEntityType(), entity.getId());
                        return Mono.just(PushOutcome.<T>rejected(entity.getId(), "Concurrent modification, retry later"));
                    }
                    return attempt(deviceId, entity, ledger, sequence, retriesLeft - 1);
                }));
    }

    // Empty when the insert lost to a concurrent insert.
    private <T extends SyncEntity<T>> Mono<PushOutcome<T>> create(String deviceId, T entity, EntityLedger<T> ledger,
                                                            SequenceCounter sequence) {
        return sequence.next().flatMap(seq -> {
            T stored = stamp(entity, deviceId, 1, seq);
            return ledger.insertIfAbsent(stored)
                    .filter(Boolean::booleanValue)
                    .map(applied -> PushOutcome.<T>applied(entity.getId(), PushStatus.CREATED, 1, seq));
        });
    }

    // Empty when the replace lost to a concurrent write.
    private <T extends SyncEntity<T>> Mono<PushOutcome<T>> update(String deviceId, T current, T entity,
                                                            EntityLedger<T> ledger, SequenceCounter sequence) {
        ConflictResolver.Resolution resolution = resolver.resolve(current, entity, deviceId);
        if (resolution == ConflictResolver.Resolution.REMOTE_WINS) {
            log.info("Conflict on {} {}: stored copy is newer, push dropped", entity.getEntityType(), entity.getId());
            return Mono.just(PushOutcome.remoteWon(entity.getId(), current.getSyncVersion(), current.getChangeSeq(), current));
        }
        PushStatus status = resolution == ConflictResolver.Resolution.LOCAL_WINS
                ? PushStatus.CONFLICT_LOCAL_WON
                : PushStatus.UPDATED;
        long version = current.getSyncVersion() + 1;
        return sequence.next().flatMap(seq -> ledger.replaceIfVersion(stamp(entity, deviceId, version, seq), current.getSyncVersion())
                .filter(Boolean::booleanValue)
                .map(applied -> {
                    if (status == PushStatus.CONFLICT_LOCAL_WON) {
                        log.info("Conflict on {} {}: pushed copy is newer, stored copy replaced",
                                entity.getEntityType(), entity.getId());
                    }
                    return PushOutcome.<T>applied(entity.getId(), status, version, seq);
                }));
    }

    private static <T extends SyncEntity<T>> T stamp(T entity, String deviceId, long version, long seq) {
        T stored = entity.copy();
        stored.setSyncVersion(version);
        stored.setChangeSeq(seq);
        stored.setLastModifiedDeviceId(deviceId);
        stored.setDirty(false);
        stored.setLockout(LockoutState.unlocked());
        return stored;
    }
}
