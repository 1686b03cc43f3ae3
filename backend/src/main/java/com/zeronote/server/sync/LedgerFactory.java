package com.zeronote.server.sync;

import com.zeronote.model.Folder;
import com.zeronote.model.Note;
import com.zeronote.sync.arbiter.EntityLedger;
import com.zeronote.sync.arbiter.SequenceCounter;

/** Opens the per-account ledgers a push or pull works against. */
public interface LedgerFactory {

    EntityLedger<Note> notes(String owner);

    EntityLedger<Folder> folders(String owner);

    SequenceCounter sequence(String owner);
}
