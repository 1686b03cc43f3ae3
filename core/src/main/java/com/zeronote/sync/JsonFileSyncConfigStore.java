package com.zeronote.sync;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import com.fasterxml.jackson.databind.ObjectMapper;

/** Keeps {@link SyncConfig} in a JSON file. A missing file yields defaults with a fresh device id, saved at once. */
public class JsonFileSyncConfigStore implements SyncConfigStore {

    private final Path file;
    private final ObjectMapper mapper;

    public JsonFileSyncConfigStore(Path file, ObjectMapper mapper) {
        this.file = file;
        this.mapper = mapper;
    }

    @Override
    public synchronized SyncConfig load() {
        if (!Files.exists(file)) {
            SyncConfig defaults = SyncConfig.defaults();
            save(defaults);
            return defaults;
        }
        try {
            return mapper.readValue(file.toFile(), SyncConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read sync config " + file, e);
        }
    }

    @Override
    public synchronized void save(SyncConfig config) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
            mapper.writeValue(temp.toFile(), config);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write sync config " + file, e);
        }
    }
}
