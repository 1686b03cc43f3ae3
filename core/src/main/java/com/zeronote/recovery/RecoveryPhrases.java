package com.zeronote.recovery;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.zeronote.crypto.CryptoRandom;
import com.zeronote.crypto.Digests;
import com.zeronote.crypto.Kek;
import com.zeronote.crypto.KeyDerivation;
import com.zeronote.crypto.KeyLabels;
import com.zeronote.crypto.MasterKey;
import com.zeronote.error.ValidationFailureException;

/**
 * Mnemonic generation, validation and phrase-to-key derivation.
 *
 * <p>Derivation runs PBKDF2 over the normalized phrase with a fixed, public salt, then HKDF with
 * the recovery label. No per-user salt exists before authentication, so the phrase's entropy is
 * the whole of its strength.
 */
public final class RecoveryPhrases {

    public static final int WORD_COUNT = 24;

    private static final byte[] RECOVERY_SALT = "zeronote-recovery-salt".getBytes(StandardCharsets.UTF_8);

    private final KeyDerivation keyDerivation;
    private final RecoveryWordlist wordlist;
    private final Clock clock;

    public RecoveryPhrases(KeyDerivation keyDerivation) {
        this(keyDerivation, RecoveryWordlist.standard(), Clock.systemUTC());
    }

    public RecoveryPhrases(KeyDerivation keyDerivation, RecoveryWordlist wordlist, Clock clock) {
        this.keyDerivation = keyDerivation;
        this.wordlist = wordlist;
        this.clock = clock;
    }

    public RecoveryKey generate() {
        List<String> words = new ArrayList<>(WORD_COUNT);
        for (int i = 0; i < WORD_COUNT; i++) {
            words.add(wordlist.get(CryptoRandom.nextInt(wordlist.size())));
        }
        return new RecoveryKey(words, clock.millis());
    }

    /**
     * Lower-cases the words after checking count and membership.
     *
     * @throws ValidationFailureException on a wrong word count or an unlisted word
     */
    public List<String> normalize(List<String> words) {
        if (words == null || words.size() != WORD_COUNT) {
            throw new ValidationFailureException("Recovery key must have " + WORD_COUNT + " words");
        }
        List<String> normalized = new ArrayList<>(WORD_COUNT);
        for (String word : words) {
            String trimmed = word == null ? "" : word.trim();
            if (!wordlist.contains(trimmed)) {
                throw new ValidationFailureException("Invalid recovery word: " + trimmed);
            }
            normalized.add(trimmed.toLowerCase(Locale.ROOT));
        }
        return normalized;
    }

    /** Splits a typed phrase on whitespace, then validates it. */
    public List<String> parse(String phrase) {
        String trimmed = phrase == null ? "" : phrase.trim();
        return normalize(trimmed.isEmpty() ? List.of() : List.of(trimmed.split("\\s+")));
    }

    /** Hex SHA-256 of the lower-cased, space-joined phrase. This is all the server keeps. */
    public String hash(List<String> words) {
        return Digests.sha256Hex(String.join(" ", normalize(words)));
    }

    public boolean verify(List<String> words, String expectedHash) {
        try {
            return Digests.constantTimeEquals(hash(words), expectedHash);
        } catch (ValidationFailureException e) {
            return false;
        }
    }

    public Kek deriveKek(List<String> words) {
        String phrase = String.join(" ", normalize(words));
        MasterKey phraseKey = keyDerivation.deriveMasterKey(phrase, RECOVERY_SALT);
        try {
            return keyDerivation.deriveKek(phraseKey, KeyLabels.RECOVERY_KEK);
        } finally {
            phraseKey.destroy();
        }
    }
}
