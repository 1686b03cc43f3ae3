package com.zeronote.sync;

import java.util.UUID;

/**
 * Device sync settings.
 *
 * @param target          where to sync, or {@link SyncTarget#NONE}
 * @param intervalMinutes scheduled cycle period; 0 disables the schedule
 * @param deviceId        stable id this device stamps on its writes
 * @param lastSyncVersion pull cursor: the account sequence seen at the end of the last complete cycle
 * @param remoteUrl       server base URL for {@link SyncTarget#SERVER}, state file path for {@link SyncTarget#FILE}
 * @param credentials     bearer token for {@link SyncTarget#SERVER}
 * @param account         username on the server for {@link SyncTarget#SERVER}
 */
public record SyncConfig(
        SyncTarget target,
        int intervalMinutes,
        String deviceId,
        long lastSyncVersion,
        String remoteUrl,
        String credentials,
        String account) {

    public static final int DEFAULT_INTERVAL_MINUTES = 5;

    public static SyncConfig defaults() {
        return new SyncConfig(SyncTarget.NONE, DEFAULT_INTERVAL_MINUTES, UUID.randomUUID().toString(), 0, null, null, null);
    }

    public SyncConfig withLastSyncVersion(long version) {
        return new SyncConfig(target, intervalMinutes, deviceId, version, remoteUrl, credentials, account);
    }

    public SyncConfig withCredentials(String newCredentials) {
        return new SyncConfig(target, intervalMinutes, deviceId, lastSyncVersion, remoteUrl, newCredentials, account);
    }

    public SyncConfig withRemote(SyncTarget newTarget, String newRemoteUrl, String newCredentials) {
        return new SyncConfig(newTarget, intervalMinutes, deviceId, 0, newRemoteUrl, newCredentials, account);
    }

    @Override
    public String toString() {
        return "SyncConfig[target=" + target + ", intervalMinutes=" + intervalMinutes + ", deviceId=" + deviceId
                + ", lastSyncVersion=" + lastSyncVersion + ", remoteUrl=" + remoteUrl + ", account=" + account + "]";
    }
}
