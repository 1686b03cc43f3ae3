package com.zeronote.sync;

/**
 * What the server did with one pushed entity.
 *
 * @param syncVersion the stored version after the push
 * @param changeSeq   the account sequence stamped on the stored copy
 * @param serverCopy  the stored entity when it won a conflict, otherwise null
 * @param reason      why the entity was rejected, otherwise null
 */
public record PushOutcome<T>(String id, PushStatus status, long syncVersion, long changeSeq, T serverCopy,
                             String reason) {

    public static <T> PushOutcome<T> applied(String id, PushStatus status, long syncVersion, long changeSeq) {
        return new PushOutcome<>(id, status, syncVersion, changeSeq, null, null);
    }

    public static <T> PushOutcome<T> remoteWon(String id, long syncVersion, long changeSeq, T serverCopy) {
        return new PushOutcome<>(id, PushStatus.CONFLICT_REMOTE_WON, syncVersion, changeSeq, serverCopy, null);
    }

    public static <T> PushOutcome<T> rejected(String id, String reason) {
        return new PushOutcome<>(id, PushStatus.REJECTED, 0, 0, null, reason);
    }

    public static <T> PushOutcome<T> staleKeys(String id, String entityEpoch, String accountEpoch) {
        return new PushOutcome<>(id, PushStatus.STALE_KEYS, 0, 0, null,
                "Written under key epoch " + entityEpoch + ", account is at " + accountEpoch);
    }
}
