package com.zeronote.sync;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import reactor.core.publisher.Mono;

import com.zeronote.error.TransportFailureException;
import com.zeronote.model.Folder;
import com.zeronote.model.Note;
import com.zeronote.model.SyncEntity;
import com.zeronote.protection.FolderTree;
import com.zeronote.store.LocalStore;

/**
 * Runs pull, merge and push against one {@link SyncAdapter}.
 *
 * <p>Only one cycle runs at a time; a request that arrives while one is in flight is answered
 * immediately with a failed result rather than queued. A cycle that hits a transport failure
 * leaves dirty flags and the cursor untouched, so the next cycle retries the same working set.
 *
 * <p>An entity is marked clean after its push only if it was not edited again while the push
 * was in flight. An entity the remote refuses for stale keys stays dirty; the key epoch listener
 * hears the remote's epoch after every merge, before dirty entities are collected, which is the
 * point where a device holding the current keys can rewrap them.
 */
public class SyncEngine {

    private static final Logger log = LoggerFactory.getLogger(SyncEngine.class);

    private final SyncAdapter adapter;
    private final LocalStore<Note> notes;
    private final LocalStore<Folder> folders;
    private final SyncConfigStore configStore;
    private final MergePolicy mergePolicy;
    private final AtomicBoolean inProgress = new AtomicBoolean();
    private volatile Consumer<String> keyEpochListener = epoch -> { };

    public SyncEngine(SyncAdapter adapter, LocalStore<Note> notes, LocalStore<Folder> folders,
                      SyncConfigStore configStore) {
        this(adapter, notes, folders, configStore, new MergePolicy());
    }

    public SyncEngine(SyncAdapter adapter, LocalStore<Note> notes, LocalStore<Folder> folders,
                      SyncConfigStore configStore, MergePolicy mergePolicy) {
        this.adapter = adapter;
        this.notes = notes;
        this.folders = folders;
        this.configStore = configStore;
        this.mergePolicy = mergePolicy;
    }

    public boolean isSyncing() {
        return inProgress.get();
    }

    public void setKeyEpochListener(Consumer<String> listener) {
        this.keyEpochListener = listener == null ? epoch -> { } : listener;
    }

    public Mono<SyncResult> synchronize() {
        return Mono.defer(() -> {
            if (!inProgress.compareAndSet(false, true)) {
                log.debug("Sync request ignored, a cycle is already running");
                return Mono.just(SyncResult.failed(SyncResult.ALREADY_RUNNING));
            }
            SyncConfig config = configStore.load();
            return cycle(config)
                    .doOnNext(result -> log.info("Sync with {} complete: {}", adapter.name(), result.stats()))
                    .onErrorResume(TransportFailureException.class, e -> {
                        log.warn("Sync with {} deferred: {}", adapter.name(), e.getMessage());
                        return Mono.just(SyncResult.failed(e.getMessage()));
                    })
                    .doFinally(signal -> inProgress.set(false));
        });
    }

    private Mono<SyncResult> cycle(SyncConfig config) {
        SyncTally tally = new SyncTally();
        return adapter.pullChanges(config.lastSyncVersion())
                .flatMap(pull -> {
                    merge(pull.folders(), folders, tally);
                    merge(pull.notes(), notes, tally);
                    if (pull.keyEpoch() != null) {
                        keyEpochListener.accept(pull.keyEpoch());
                    }

                    List<Note> dirtyNotes = notes.findDirty();
                    List<Folder> dirtyFolders = parentsFirst(folders.findDirty());
                    Mono<Void> push = dirtyNotes.isEmpty() && dirtyFolders.isEmpty()
                            ? Mono.empty()
                            : adapter.pushChanges(config.deviceId(), dirtyNotes, dirtyFolders)
                                    .doOnNext(response -> {
                                        apply(response.folders(), dirtyFolders, folders, config.deviceId(), tally);
                                        apply(response.notes(), dirtyNotes, notes, config.deviceId(), tally);
                                    })
                                    .then();
                    return push.then(Mono.fromCallable(() -> {
                        configStore.save(configStore.load().withLastSyncVersion(pull.currentSyncVersion()));
                        return tally.result(pull.keyEpoch());
                    }));
                });
    }

    private <T extends SyncEntity<T>> void merge(List<T> remote, LocalStore<T> store, SyncTally tally) {
        for (T incoming : remote) {
            T local = store.get(incoming.getId()).orElse(null);
            MergePolicy.Decision decision = mergePolicy.decide(local, incoming);
            if (decision == MergePolicy.Decision.SKIP || decision == MergePolicy.Decision.KEEP_LOCAL) {
                continue;
            }
            if (decision == MergePolicy.Decision.OVERWRITE_CONFLICT) {
                log.info("{} {} edited here and remotely; remote edit is newer and replaces it",
                        incoming.getEntityType(), incoming.getId());
                tally.conflict(local, incoming, SyncConflict.Winner.REMOTE);
            }
            store.put(adopt(incoming, local));
            tally.downloaded(incoming.getEntityType());
        }
    }

    private <T extends SyncEntity<T>> void apply(EntityPushResult<T> result, List<T> sent, LocalStore<T> store,
                                              String deviceId, SyncTally tally) {
        if (result == null) {
            return;
        }
        Map<String, T> snapshots = sent.stream().collect(Collectors.toMap(SyncEntity::getId, Function.identity()));
        for (PushOutcome<T> outcome : result.outcomes()) {
            T local = store.get(outcome.id()).orElse(null);
            T snapshot = snapshots.get(outcome.id());
            if (local == null || snapshot == null) {
                continue;
            }
            if (outcome.status() == PushStatus.REJECTED) {
                log.warn("{} {} rejected by {}: {}", local.getEntityType(), local.getId(), adapter.name(), outcome.reason());
                tally.rejected();
                continue;
            }
            if (outcome.status() == PushStatus.STALE_KEYS) {
                log.warn("{} {} kept back by {}: {}", local.getEntityType(), local.getId(), adapter.name(), outcome.reason());
                tally.staleKeys();
                continue;
            }
            if (outcome.status() == PushStatus.CONFLICT_REMOTE_WON) {
                tally.conflict(snapshot, outcome.serverCopy(), SyncConflict.Winner.REMOTE);
                if (outcome.serverCopy() != null && local.getUpdatedAt() == snapshot.getUpdatedAt()) {
                    store.put(adopt(outcome.serverCopy(), local));
                }
                continue;
            }
            if (outcome.status() == PushStatus.CONFLICT_LOCAL_WON) {
                tally.conflict(snapshot, null, SyncConflict.Winner.LOCAL);
            }
            local.setSyncVersion(outcome.syncVersion());
            local.setChangeSeq(outcome.changeSeq());
            local.setLastModifiedDeviceId(deviceId);
            if (local.getUpdatedAt() == snapshot.getUpdatedAt()) {
                local.setDirty(false);
            }
            store.put(local);
            tally.uploaded(local.getEntityType());
        }
    }

    /** Remote copy as it should be stored locally: clean, keeping the device's own lockout state. */
    private static <T extends SyncEntity<T>> T adopt(T remote, T local) {
        T adopted = remote.copy();
        adopted.setDirty(false);
        adopted.setLockout(local == null ? null : local.getLockout());
        return adopted;
    }

    private static List<Folder> parentsFirst(List<Folder> dirty) {
        FolderTree tree = FolderTree.of(dirty);
        return dirty.stream()
                .sorted(Comparator.comparingInt(folder -> folder.isDeleted() ? 0 : tree.depth(folder.getId())))
                .collect(Collectors.toList());
    }
}
