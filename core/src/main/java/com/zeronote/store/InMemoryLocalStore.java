package com.zeronote.store;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import com.zeronote.model.SyncEntity;

public class InMemoryLocalStore<T extends SyncEntity<T>> implements LocalStore<T> {

    private final Map<String, T> entities = new ConcurrentHashMap<>();

    @Override
    public Optional<T> get(String id) {
        return Optional.ofNullable(entities.get(id)).map(InMemoryLocalStore::copyOf);
    }

    @Override
    public void put(T entity) {
        entities.put(entity.getId(), copyOf(entity));
    }

    @Override
    public synchronized void putAll(Collection<T> batch) {
        batch.forEach(this::put);
    }

    @Override
    public List<T> getAll() {
        return entities.values().stream().map(InMemoryLocalStore::copyOf).collect(Collectors.toList());
    }

    @Override
    public void delete(String id) {
        entities.remove(id);
    }

    @Override
    public List<T> findByParent(String parentId) {
        return entities.values().stream()
                .filter(entity -> Objects.equals(entity.getContainerId(), parentId))
                .map(InMemoryLocalStore::copyOf)
                .collect(Collectors.toList());
    }

    @Override
    public List<T> findDirty() {
        return entities.values().stream()
                .filter(SyncEntity::isDirty)
                .map(InMemoryLocalStore::copyOf)
                .collect(Collectors.toList());
    }

    static <T extends SyncEntity<T>> T copyOf(T entity) {
        return entity.copy();
    }
}
