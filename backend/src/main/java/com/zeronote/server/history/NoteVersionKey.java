package com.zeronote.server.history;

import java.io.Serializable;
import java.util.UUID;

import org.springframework.data.cassandra.core.cql.Ordering;
import org.springframework.data.cassandra.core.cql.PrimaryKeyType;
import org.springframework.data.cassandra.core.mapping.PrimaryKeyClass;
import org.springframework.data.cassandra.core.mapping.PrimaryKeyColumn;

/** Newest version first within a note's partition. */
@PrimaryKeyClass
public record NoteVersionKey(
    @PrimaryKeyColumn(name = "owner", ordinal = 0, type = PrimaryKeyType.PARTITIONED)
    String owner,

    @PrimaryKeyColumn(name = "note_id", ordinal = 1, type = PrimaryKeyType.PARTITIONED)
    String noteId,

    @PrimaryKeyColumn(name = "version_id", ordinal = 2, type = PrimaryKeyType.CLUSTERED, ordering = Ordering.DESCENDING)
    UUID versionId
) implements Serializable {}
