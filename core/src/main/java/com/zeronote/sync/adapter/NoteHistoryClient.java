package com.zeronote.sync.adapter;

import java.util.List;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zeronote.error.EntityNotFoundException;
import com.zeronote.error.ValidationFailureException;
import com.zeronote.model.Note;
import com.zeronote.model.NoteVersion;
import com.zeronote.sync.PushOutcome;

import reactor.core.publisher.Mono;

/**
 * The server's retained note versions. Versions come back as ciphertext; a restore is a new
 * write on the server that devices receive on their next pull like any other change.
 */
public class NoteHistoryClient {

    private static final Logger log = LoggerFactory.getLogger(NoteHistoryClient.class);

    static final String VERSIONS = "/api/notes/{noteId}/versions";
    static final String VERSION = "/api/notes/{noteId}/versions/{versionId}";
    static final String RESTORE = "/api/notes/{noteId}/versions/{versionId}/restore";

    private final WebClient webClient;

    public NoteHistoryClient(WebClient webClient) {
        this.webClient = webClient;
    }

    public static NoteHistoryClient create(String baseUrl, Supplier<String> token, ObjectMapper mapper) {
        return new NoteHistoryClient(RemoteSyncAdapter.builder(mapper)
                .baseUrl(baseUrl)
                .filter(RemoteSyncAdapter.bearer(token))
                .build());
    }

    /** Newest first, at most {@code limit}. */
    public Mono<List<NoteVersion>> list(String noteId, int limit) {
        return webClient.get()
                .uri(uri -> uri.path(VERSIONS).queryParam("limit", limit).build(noteId))
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> toFailure(response, noteId))
                .bodyToMono(new ParameterizedTypeReference<List<NoteVersion>>() {})
                .onErrorMap(WebClientRequestException.class, RemoteSyncAdapter::unreachable);
    }

    public Mono<NoteVersion> get(String noteId, String versionId) {
        return webClient.get()
                .uri(VERSION, noteId, versionId)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> toFailure(response, versionId))
                .bodyToMono(NoteVersion.class)
                .onErrorMap(WebClientRequestException.class, RemoteSyncAdapter::unreachable);
    }

    /** The restored write as the server stored it. */
    public Mono<PushOutcome<Note>> restore(String noteId, String versionId) {
        return webClient.post()
                .uri(RESTORE, noteId, versionId)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> toFailure(response, versionId))
                .bodyToMono(new ParameterizedTypeReference<PushOutcome<Note>>() {})
                .onErrorMap(WebClientRequestException.class, RemoteSyncAdapter::unreachable)
                .doOnNext(outcome -> log.info("Restored note {} to version {} as syncVersion {}",
                        noteId, versionId, outcome.syncVersion()));
    }

    // 404 and 409 carry a message worth showing; everything else maps like sync.
    private static Mono<? extends Throwable> toFailure(ClientResponse response, String id) {
        int status = response.statusCode().value();
        if (status == HttpStatus.NOT_FOUND.value()) {
            return response.releaseBody().then(Mono.just(new EntityNotFoundException("Note version", id)));
        }
        if (status == HttpStatus.CONFLICT.value()) {
            return response.bodyToMono(ServerError.class)
                    .map(error -> (Throwable) new ValidationFailureException(error.error()))
                    .defaultIfEmpty(new ValidationFailureException("Version " + id + " cannot be restored"));
        }
        return RemoteSyncAdapter.toFailure(response);
    }

    record ServerError(String error, int status) {
    }
}
