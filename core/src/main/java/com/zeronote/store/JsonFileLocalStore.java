package com.zeronote.store;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zeronote.model.SyncEntity;

/**
 * One JSON file per entity type holding every entity, keyed by id. Each write replaces the file
 * through a temp file and an atomic move, so a crash leaves either the old or the new contents.
 * Lockout state is part of the file and survives restarts.
 */
public class JsonFileLocalStore<T extends SyncEntity<T>> implements LocalStore<T> {

    private static final Logger log = LoggerFactory.getLogger(JsonFileLocalStore.class);

    private final Path file;
    private final ObjectMapper mapper;
    private final JavaType listType;
    private final Map<String, T> entities = new LinkedHashMap<>();

    public JsonFileLocalStore(Path file, Class<T> type, ObjectMapper mapper) {
        this.file = file;
        this.mapper = mapper;
        this.listType = mapper.getTypeFactory().constructCollectionType(List.class, type);
        load();
    }

    @Override
    public synchronized Optional<T> get(String id) {
        return Optional.ofNullable(entities.get(id)).map(InMemoryLocalStore::copyOf);
    }

    @Override
    public synchronized void put(T entity) {
        putAll(List.of(entity));
    }

    @Override
    public synchronized void putAll(Collection<T> batch) {
        Map<String, T> next = new LinkedHashMap<>(entities);
        batch.forEach(entity -> next.put(entity.getId(), InMemoryLocalStore.copyOf(entity)));
        write(next);
        entities.clear();
        entities.putAll(next);
    }

    @Override
    public synchronized List<T> getAll() {
        return select(entity -> true);
    }

    @Override
    public synchronized void delete(String id) {
        if (!entities.containsKey(id)) {
            return;
        }
        Map<String, T> next = new LinkedHashMap<>(entities);
        next.remove(id);
        write(next);
        entities.remove(id);
    }

    @Override
    public synchronized List<T> findByParent(String parentId) {
        return select(entity -> Objects.equals(entity.getContainerId(), parentId));
    }

    @Override
    public synchronized List<T> findDirty() {
        return select(SyncEntity::isDirty);
    }

    private List<T> select(Predicate<T> filter) {
        return entities.values().stream()
                .filter(filter)
                .map(InMemoryLocalStore::copyOf)
                .collect(Collectors.toList());
    }

    private void load() {
        if (!Files.exists(file)) {
            return;
        }
        try {
            List<T> stored = mapper.readValue(file.toFile(), listType);
            stored.forEach(entity -> entities.put(entity.getId(), entity));
            log.debug("Loaded {} entities from {}", entities.size(), file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read local store " + file, e);
        }
    }

    private void write(Map<String, T> snapshot) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
            mapper.writeValue(temp.toFile(), new ArrayList<>(snapshot.values()));
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write local store " + file, e);
        }
    }
}
