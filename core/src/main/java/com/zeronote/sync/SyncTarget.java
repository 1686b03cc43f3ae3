package com.zeronote.sync;

public enum SyncTarget {
    NONE,
    SERVER,
    FILE
}
