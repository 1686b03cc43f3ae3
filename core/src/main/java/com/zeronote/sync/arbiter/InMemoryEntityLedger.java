package com.zeronote.sync.arbiter;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import com.zeronote.model.SyncEntity;

/** Ledger over a map, for the file remote and for tests. */
public class InMemoryEntityLedger<T extends SyncEntity<T>> implements EntityLedger<T> {

    private final Map<String, T> entities = new LinkedHashMap<>();

    public InMemoryEntityLedger() {
    }

    public InMemoryEntityLedger(Collection<T> initial) {
        initial.forEach(entity -> entities.put(entity.getId(), entity));
    }

    @Override
    public Mono<T> find(String id) {
        return Mono.fromSupplier(() -> get(id));
    }

    @Override
    public Mono<Boolean> insertIfAbsent(T entity) {
        return Mono.fromSupplier(() -> {
            synchronized (entities) {
                return entities.putIfAbsent(entity.getId(), entity) == null;
            }
        });
    }

    @Override
    public Mono<Boolean> replaceIfVersion(T entity, long expectedVersion) {
        return Mono.fromSupplier(() -> {
            synchronized (entities) {
                T stored = entities.get(entity.getId());
                if (stored == null || stored.getSyncVersion() != expectedVersion) {
                    return false;
                }
                entities.put(entity.getId(), entity);
                return true;
            }
        });
    }

    @Override
    public Flux<T> changedSince(long sinceSeq) {
        return Flux.defer(() -> Flux.fromIterable(snapshot().stream()
                .filter(entity -> entity.getChangeSeq() > sinceSeq)
                .sorted(Comparator.comparingLong(SyncEntity::getChangeSeq))
                .collect(Collectors.toList())));
    }

    public List<T> snapshot() {
        synchronized (entities) {
            return List.copyOf(entities.values());
        }
    }

    private T get(String id) {
        synchronized (entities) {
            return entities.get(id);
        }
    }
}
