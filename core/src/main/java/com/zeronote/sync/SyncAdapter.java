package com.zeronote.sync;

import java.util.List;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import com.zeronote.model.Folder;
import com.zeronote.model.Note;

/**
 * Transport to a sync remote. The engine only ever talks to this interface, so the same merge
 * and conflict logic runs against every remote.
 *
 * <p>Implementations signal {@link com.zeronote.error.TransportFailureException} when the remote
 * is unreachable.
 */
public interface SyncAdapter {

    String name();

    Mono<Boolean> testConnection();

    Mono<PullResponse> pullChanges(long sinceVersion);

    Mono<PushResponse> pushChanges(String deviceId, List<Note> notes, List<Folder> folders);

    /** Wake-up hints pushed by the remote, if it has a channel for them. */
    default Flux<SyncHint> hints() {
        return Flux.empty();
    }
}
