package com.zeronote.sync;

import com.zeronote.model.SyncEntity;

/** Pull-side counterpart of the server's conflict rule. */
public class MergePolicy {

    public enum Decision {
        /** Not known locally. */
        INSERT,
        /** Local copy is already at or past this version. */
        SKIP,
        /** Local copy is clean. */
        OVERWRITE,
        /** Local copy is dirty but the remote edit is strictly newer; local edits are lost. */
        OVERWRITE_CONFLICT,
        /** Local copy is dirty and at least as new; it stays and goes out with the next push. */
        KEEP_LOCAL
    }

    public Decision decide(SyncEntity<?> local, SyncEntity<?> remote) {
        if (local == null) {
            return Decision.INSERT;
        }
        if (remote.getSyncVersion() <= local.getSyncVersion()) {
            return Decision.SKIP;
        }
        if (!local.isDirty()) {
            return Decision.OVERWRITE;
        }
        return remote.getUpdatedAt() > local.getUpdatedAt() ? Decision.OVERWRITE_CONFLICT : Decision.KEEP_LOCAL;
    }
}
