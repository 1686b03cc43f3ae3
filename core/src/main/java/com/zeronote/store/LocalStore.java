package com.zeronote.store;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import com.zeronote.model.SyncEntity;

/**
 * Durable per-device store for one entity type. Implementations hand out copies, so mutating
 * a returned entity has no effect until it is {@link #put} back.
 */
public interface LocalStore<T extends SyncEntity<T>> {

    Optional<T> get(String id);

    void put(T entity);

    /** Stores every entity or none of them. */
    void putAll(Collection<T> entities);

    List<T> getAll();

    void delete(String id);

    /** Notes in a folder, or folders under a parent. A null parent means top level. */
    List<T> findByParent(String parentId);

    List<T> findDirty();
}
