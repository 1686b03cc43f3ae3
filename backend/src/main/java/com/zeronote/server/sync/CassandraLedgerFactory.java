package com.zeronote.server.sync;

import org.springframework.data.cassandra.core.ReactiveCassandraOperations;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zeronote.model.Folder;
import com.zeronote.model.Note;
import com.zeronote.sync.arbiter.EntityLedger;
import com.zeronote.sync.arbiter.SequenceCounter;

@Component
public class CassandraLedgerFactory implements LedgerFactory {

    private final NoteRowRepository noteRows;
    private final FolderRowRepository folderRows;
    private final ReactiveCassandraOperations operations;
    private final ObjectMapper objectMapper;

    public CassandraLedgerFactory(NoteRowRepository noteRows, FolderRowRepository folderRows,
                                  ReactiveCassandraOperations operations, ObjectMapper objectMapper) {
        this.noteRows = noteRows;
        this.folderRows = folderRows;
        this.operations = operations;
        this.objectMapper = objectMapper;
    }

    @Override
    public EntityLedger<Note> notes(String owner) {
        return new CassandraEntityLedger<>(owner, Note.class, NoteRow::new, noteRows, operations, objectMapper);
    }

    @Override
    public EntityLedger<Folder> folders(String owner) {
        return new CassandraEntityLedger<>(owner, Folder.class, FolderRow::new, folderRows, operations, objectMapper);
    }

    @Override
    public SequenceCounter sequence(String owner) {
        return new CassandraSequenceCounter(owner, operations);
    }
}
