package com.zeronote.recovery;

import java.util.List;

/** A 24-word mnemonic, shown to the user exactly once at registration. */
public record RecoveryKey(List<String> words, long createdAt) {

    public RecoveryKey {
        words = List.copyOf(words);
    }

    public String phrase() {
        return String.join(" ", words);
    }

    @Override
    public String toString() {
        return "RecoveryKey[" + words.size() + " words, createdAt=" + createdAt + "]";
    }
}
