package com.zeronote.server.sync;

import org.springframework.data.cassandra.core.mapping.Table;

@Table("folders")
public class FolderRow extends EntityRow {

    public FolderRow() {}
}
