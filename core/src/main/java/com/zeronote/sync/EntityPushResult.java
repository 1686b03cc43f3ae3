package com.zeronote.sync;

import java.util.List;

/**
 * Per-type push tally. {@code updated} counts plain updates only; an update that won a conflict
 * is counted under {@code conflicts}. Writes refused for stale keys count as rejected.
 */
public record EntityPushResult<T>(int created, int updated, int conflicts, int rejected,
                                  List<PushOutcome<T>> outcomes) {

    public EntityPushResult {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public static <T> EntityPushResult<T> empty() {
        return of(List.of());
    }

    public static <T> EntityPushResult<T> of(List<PushOutcome<T>> outcomes) {
        int created = 0, updated = 0, conflicts = 0, rejected = 0;
        for (PushOutcome<T> outcome : outcomes) {
            switch (outcome.status()) {
                case CREATED -> created++;
                case UPDATED -> updated++;
                case CONFLICT_LOCAL_WON, CONFLICT_REMOTE_WON -> conflicts++;
                case REJECTED, STALE_KEYS -> rejected++;
            }
        }
        return new EntityPushResult<>(created, updated, conflicts, rejected, outcomes);
    }
}
