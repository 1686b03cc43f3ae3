package com.zeronote.sync;

/** Answer to a connection test: the remote's clock and its current account sequence. */
public record Heartbeat(long serverTime, long currentSyncVersion) {
}
