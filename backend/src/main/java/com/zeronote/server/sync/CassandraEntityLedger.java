package com.zeronote.server.sync;

import java.io.UncheckedIOException;
import java.util.Comparator;
import java.util.function.Supplier;

import org.springframework.data.cassandra.core.InsertOptions;
import org.springframework.data.cassandra.core.ReactiveCassandraOperations;
import org.springframework.data.cassandra.core.UpdateOptions;
import org.springframework.data.cassandra.core.WriteResult;
import org.springframework.data.cassandra.core.query.Criteria;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zeronote.model.SyncEntity;
import com.zeronote.sync.arbiter.EntityLedger;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * {@link EntityLedger} over one account's partition of a Cassandra table. Both writes are
 * lightweight transactions, so two servers racing on the same entity cannot both win.
 */
public class CassandraEntityLedger<T extends SyncEntity<T>, R extends EntityRow> implements EntityLedger<T> {

    private final String owner;
    private final Class<T> entityType;
    private final Supplier<R> rowFactory;
    private final EntityRowRepository<R> repository;
    private final ReactiveCassandraOperations operations;
    private final ObjectMapper objectMapper;

    public CassandraEntityLedger(String owner, Class<T> entityType, Supplier<R> rowFactory,
                                 EntityRowRepository<R> repository, ReactiveCassandraOperations operations,
                                 ObjectMapper objectMapper) {
        this.owner = owner;
        this.entityType = entityType;
        this.rowFactory = rowFactory;
        this.repository = repository;
        this.operations = operations;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<T> find(String id) {
        return repository.findById(new EntityKey(owner, id)).map(this::toEntity);
    }

    @Override
    public Mono<Boolean> insertIfAbsent(T entity) {
        return Mono.fromCallable(() -> toRow(entity))
                .flatMap(row -> operations.insert(row, InsertOptions.builder().withIfNotExists().build()))
                .map(WriteResult::wasApplied);
    }

    @Override
    public Mono<Boolean> replaceIfVersion(T entity, long expectedVersion) {
        UpdateOptions condition = UpdateOptions.builder()
                .ifCondition(Criteria.where("sync_version").is(expectedVersion))
                .build();
        return Mono.fromCallable(() -> toRow(entity))
                .flatMap(row -> operations.update(row, condition))
                .map(WriteResult::wasApplied);
    }

    // Reads the whole partition; an account's entity count is small next to a sequence index.
    @Override
    public Flux<T> changedSince(long sinceSeq) {
        return repository.findAllByKeyOwner(owner)
                .filter(row -> row.getChangeSeq() > sinceSeq)
                .sort(Comparator.comparingLong(EntityRow::getChangeSeq))
                .map(this::toEntity);
    }

    private R toRow(T entity) {
        R row = rowFactory.get();
        row.setKey(new EntityKey(owner, entity.getId()));
        row.setSyncVersion(entity.getSyncVersion());
        row.setChangeSeq(entity.getChangeSeq());
        row.setUpdatedAt(entity.getUpdatedAt());
        row.setDeleted(entity.isDeleted());
        try {
            row.setPayload(objectMapper.writeValueAsString(entity));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
        return row;
    }

    private T toEntity(R row) {
        try {
            return objectMapper.readValue(row.getPayload(), entityType);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Stored " + entityType.getSimpleName() + " " + row.getKey().id()
                    + " is unreadable", e);
        }
    }
}
