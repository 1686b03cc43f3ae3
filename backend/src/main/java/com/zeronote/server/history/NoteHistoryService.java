package com.zeronote.server.history;

import java.io.UncheckedIOException;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.datastax.oss.driver.api.core.uuid.Uuids;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zeronote.crypto.CipherEnvelope;
import com.zeronote.crypto.EncryptedBlob;
import com.zeronote.crypto.WrappedKey;
import com.zeronote.error.ValidationFailureException;
import com.zeronote.model.Note;
import com.zeronote.model.NoteVersion;
import com.zeronote.server.config.ZeroNoteProperties;
import com.zeronote.server.web.NotFoundException;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Bounded per-note history. Each accepted push of a note body is kept as ciphertext together
 * with the DEK wrap current at the time; once a note has more than {@code capacity} versions
 * the oldest are dropped.
 */
@Service
public class NoteHistoryService {

    private static final Logger log = LoggerFactory.getLogger(NoteHistoryService.class);

    private final NoteVersionRepository repository;
    private final ObjectMapper objectMapper;
    private final int capacity;

    public NoteHistoryService(NoteVersionRepository repository, ObjectMapper objectMapper,
                              ZeroNoteProperties properties) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.capacity = properties.history().capacity();
    }

    public Mono<Void> record(String owner, Note note, long syncVersion) {
        return Mono.fromCallable(() -> toRow(owner, note, syncVersion))
                .flatMap(repository::save)
                .thenMany(repository.findAllByKeyOwnerAndKeyNoteId(owner, note.getId()).skip(capacity))
                .concatMap(expired -> repository.delete(expired).thenReturn(expired))
                .count()
                .doOnNext(evicted -> {
                    if (evicted > 0) {
                        log.debug("Evicted {} old versions of note {}", evicted, note.getId());
                    }
                })
                .then();
    }

    /** Newest first. */
    public Flux<NoteVersion> list(String owner, String noteId, int limit) {
        if (limit < 1 || limit > capacity) {
            return Flux.error(new ValidationFailureException("Limit must be between 1 and " + capacity));
        }
        return repository.findAllByKeyOwnerAndKeyNoteId(owner, noteId)
                .take(limit)
                .map(this::toVersion);
    }

    public Mono<NoteVersion> get(String owner, String noteId, String versionId) {
        UUID id;
        try {
            id = UUID.fromString(versionId);
        } catch (IllegalArgumentException e) {
            return Mono.error(new NotFoundException("Unknown version: " + versionId));
        }
        return repository.findById(new NoteVersionKey(owner, noteId, id))
                .switchIfEmpty(Mono.error(new NotFoundException("Unknown version: " + versionId)))
                .map(this::toVersion);
    }

    private NoteVersionRow toRow(String owner, Note note, long syncVersion) {
        NoteVersionRow row = new NoteVersionRow();
        row.setKey(new NoteVersionKey(owner, note.getId(), Uuids.timeBased()));
        row.setEncryptedTitle(write(note.getEncryptedTitle()));
        row.setEncryptedContent(write(note.getEncryptedContent()));
        row.setEncryptedDek(write(note.getEncryptedDek()));
        row.setDekId(note.getDekId());
        row.setKeyEpoch(note.getKeyEpoch());
        row.setSize(byteLength(note.getEncryptedTitle()) + byteLength(note.getEncryptedContent()));
        row.setSyncVersion(syncVersion);
        row.setCreatedAt(System.currentTimeMillis());
        return row;
    }

    private NoteVersion toVersion(NoteVersionRow row) {
        return new NoteVersion(
                row.getKey().versionId().toString(),
                row.getKey().noteId(),
                read(row.getEncryptedTitle(), EncryptedBlob.class),
                read(row.getEncryptedContent(), EncryptedBlob.class),
                read(row.getEncryptedDek(), WrappedKey.class),
                row.getDekId(),
                row.getKeyEpoch(),
                row.getSize(),
                row.getSyncVersion(),
                row.getCreatedAt());
    }

    private static int byteLength(CipherEnvelope envelope) {
        return envelope == null ? 0 : envelope.byteLength();
    }

    private String write(CipherEnvelope envelope) {
        if (envelope == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private <E extends CipherEnvelope> E read(String json, Class<E> type) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Stored note version is unreadable", e);
        }
    }
}
