package com.zeronote.server.sync;

import org.springframework.data.cassandra.core.mapping.Table;

@Table("notes")
public class NoteRow extends EntityRow {

    public NoteRow() {}
}
