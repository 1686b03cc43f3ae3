package com.zeronote.account;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

import com.fasterxml.jackson.databind.ObjectMapper;

/** Keeps the key bundle in a JSON file, replaced atomically. A missing file means no account yet. */
public class JsonFileAccountKeyStore implements AccountKeyStore {

    private final Path file;
    private final ObjectMapper mapper;

    public JsonFileAccountKeyStore(Path file, ObjectMapper mapper) {
        this.file = file;
        this.mapper = mapper;
    }

    @Override
    public synchronized Optional<AccountKeys> load() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(file.toFile(), AccountKeys.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read account keys " + file, e);
        }
    }

    @Override
    public synchronized void save(AccountKeys keys) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
            mapper.writeValue(temp.toFile(), keys);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write account keys " + file, e);
        }
    }
}
