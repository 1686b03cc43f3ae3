package com.zeronote.server.history;

import org.springframework.data.cassandra.repository.ReactiveCassandraRepository;
import org.springframework.stereotype.Repository;

import reactor.core.publisher.Flux;

@Repository
public interface NoteVersionRepository extends ReactiveCassandraRepository<NoteVersionRow, NoteVersionKey> {

    // Clustering order makes this newest first.
    Flux<NoteVersionRow> findAllByKeyOwnerAndKeyNoteId(String owner, String noteId);
}
