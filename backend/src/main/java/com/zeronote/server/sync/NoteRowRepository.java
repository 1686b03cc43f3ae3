package com.zeronote.server.sync;

import org.springframework.stereotype.Repository;

@Repository
public interface NoteRowRepository extends EntityRowRepository<NoteRow> {
}
