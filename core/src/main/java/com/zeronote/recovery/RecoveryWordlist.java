package com.zeronote.recovery;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The fixed mnemonic wordlist, one lower-case word per line. Changing it breaks every phrase
 * already handed out.
 */
public final class RecoveryWordlist {

    private static final String RESOURCE = "/recovery-wordlist.txt";

    private static volatile RecoveryWordlist standard;

    private final List<String> words;
    private final Set<String> index;

    RecoveryWordlist(List<String> words) {
        this.words = List.copyOf(words);
        this.index = new HashSet<>(this.words);
        if (index.size() != this.words.size()) {
            throw new IllegalArgumentException("Wordlist contains duplicates");
        }
    }

    public static RecoveryWordlist standard() {
        RecoveryWordlist local = standard;
        if (local == null) {
            synchronized (RecoveryWordlist.class) {
                local = standard;
                if (local == null) {
                    local = load();
                    standard = local;
                }
            }
        }
        return local;
    }

    private static RecoveryWordlist load() {
        InputStream stream = RecoveryWordlist.class.getResourceAsStream(RESOURCE);
        if (stream == null) {
            throw new IllegalStateException(RESOURCE + " not found on classpath");
        }
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            return new RecoveryWordlist(reader.lines()
                    .map(String::trim)
                    .filter(line -> !line.isEmpty())
                    .map(line -> line.toLowerCase(Locale.ROOT))
                    .collect(Collectors.toList()));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
    }

    public int size() {
        return words.size();
    }

    public String get(int index) {
        return words.get(index);
    }

    public boolean contains(String word) {
        return word != null && index.contains(word.toLowerCase(Locale.ROOT));
    }
}
