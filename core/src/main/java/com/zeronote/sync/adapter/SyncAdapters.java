package com.zeronote.sync.adapter;

import java.net.URI;
import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zeronote.account.KeyDirectory;
import com.zeronote.error.ValidationFailureException;
import com.zeronote.sync.SyncAdapter;
import com.zeronote.sync.SyncConfig;
import com.zeronote.sync.SyncTarget;
import com.zeronote.sync.arbiter.PushArbiter;

/** Builds the adapter a {@link SyncConfig} asks for. */
public final class SyncAdapters {

    private SyncAdapters() {
    }

    /** Adapter bound to the token in {@code config}, which must be present for a server target. */
    public static SyncAdapter create(SyncConfig config, ObjectMapper mapper) {
        if (config.target() == SyncTarget.SERVER && isBlank(config.credentials())) {
            throw new ValidationFailureException("Server sync needs credentials");
        }
        String token = config.credentials();
        return create(config, mapper, () -> token);
    }

    /** Adapter that reads the bearer token from {@code token} on every request. */
    public static SyncAdapter create(SyncConfig config, ObjectMapper mapper, Supplier<String> token) {
        switch (config.target()) {
            case SERVER:
                requireRemote(config);
                return RemoteSyncAdapter.create(config.remoteUrl(), token, mapper);
            case FILE:
                requireRemote(config);
                return new FileSyncAdapter(toPath(config.remoteUrl()), mapper, new PushArbiter());
            default:
                throw new ValidationFailureException("Sync is not configured");
        }
    }

    /**
     * Where {@code adapter}'s remote keeps the key bundle: the state file itself for a file
     * remote, the account endpoints for a server with a configured account name.
     */
    public static Optional<KeyDirectory> keyDirectory(SyncConfig config, SyncAdapter adapter, ObjectMapper mapper,
                                                      Supplier<String> token, Consumer<String> tokenSink) {
        if (adapter instanceof KeyDirectory directory) {
            return Optional.of(directory);
        }
        if (config.target() == SyncTarget.SERVER && !isBlank(config.account())) {
            return Optional.of(AccountClient.create(config.remoteUrl(), config.account(), token, tokenSink, mapper));
        }
        return Optional.empty();
    }

    /** Note history lives on the server only. */
    public static Optional<NoteHistoryClient> history(SyncConfig config, ObjectMapper mapper, Supplier<String> token) {
        if (config.target() != SyncTarget.SERVER || isBlank(config.remoteUrl())) {
            return Optional.empty();
        }
        return Optional.of(NoteHistoryClient.create(config.remoteUrl(), token, mapper));
    }

    private static void requireRemote(SyncConfig config) {
        if (isBlank(config.remoteUrl())) {
            throw new ValidationFailureException("Sync target " + config.target() + " needs a remote location");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static Path toPath(String location) {
        return location.startsWith("file:") ? Path.of(URI.create(location)) : Path.of(location);
    }
}
