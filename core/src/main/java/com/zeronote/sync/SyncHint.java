package com.zeronote.sync;

import com.zeronote.model.EntityType;

/** Wake-up signal from the server. Never trusted as data: receiving one only triggers a normal pull. */
public record SyncHint(EntityType entityType, String entityId, long syncVersion) {
}
