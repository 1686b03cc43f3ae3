package com.zeronote.sync.adapter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zeronote.account.AccountKeys;
import com.zeronote.account.KeyDirectory;
import com.zeronote.account.Registration;
import com.zeronote.account.Rekey;
import com.zeronote.error.AuthenticationFailureException;
import com.zeronote.error.TransportFailureException;
import com.zeronote.error.ValidationFailureException;
import com.zeronote.model.Folder;
import com.zeronote.model.Note;
import com.zeronote.sync.PullResponse;
import com.zeronote.sync.PushResponse;
import com.zeronote.sync.SyncAdapter;
import com.zeronote.sync.arbiter.FolderPlacementCheck;
import com.zeronote.sync.arbiter.InMemoryEntityLedger;
import com.zeronote.sync.arbiter.InMemorySequenceCounter;
import com.zeronote.sync.arbiter.PlacementCheck;
import com.zeronote.sync.arbiter.PushArbiter;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * A remote that is just a JSON file, typically in a folder another tool replicates (a network
 * share, a WebDAV mount). Pushes run through the same {@link PushArbiter} the server uses and
 * rewrite the file atomically. Pushes from this process are serialized; concurrent writers in
 * other processes are not coordinated.
 *
 * <p>The same file holds the account key bundle, and its epoch is enforced on every push.
 */
public class FileSyncAdapter implements SyncAdapter, KeyDirectory {

    private static final Logger log = LoggerFactory.getLogger(FileSyncAdapter.class);

    private final Path stateFile;
    private final ObjectMapper mapper;
    private final PushArbiter arbiter;
    private final ReentrantLock lock = new ReentrantLock();

    public FileSyncAdapter(Path stateFile, ObjectMapper mapper, PushArbiter arbiter) {
        this.stateFile = stateFile;
        this.mapper = mapper;
        this.arbiter = arbiter;
    }

    @Override
    public String name() {
        return "file:" + stateFile.getFileName();
    }

    @Override
    public Mono<Boolean> testConnection() {
        return Mono.fromCallable(() -> {
                    Path dir = stateFile.toAbsolutePath().getParent();
                    return Files.isDirectory(dir) && Files.isWritable(dir)
                            && (!Files.exists(stateFile) || Files.isReadable(stateFile));
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<PullResponse> pullChanges(long sinceVersion) {
        return Mono.fromCallable(this::read)
                .subscribeOn(Schedulers.boundedElastic())
                .map(state -> new PullResponse(
                        state.notes().stream().filter(note -> note.getChangeSeq() > sinceVersion).collect(Collectors.toList()),
                        state.folders().stream().filter(folder -> folder.getChangeSeq() > sinceVersion).collect(Collectors.toList()),
                        state.currentSyncVersion(),
                        state.keyEpoch()));
    }

    @Override
    public Mono<PushResponse> pushChanges(String deviceId, List<Note> notes, List<Folder> folders) {
        return Mono.fromCallable(() -> {
                    lock.lock();
                    try {
                        FileSyncState state = read();
                        InMemoryEntityLedger<Note> noteLedger = new InMemoryEntityLedger<>(state.notes());
                        InMemoryEntityLedger<Folder> folderLedger = new InMemoryEntityLedger<>(state.folders());
                        InMemorySequenceCounter sequence = new InMemorySequenceCounter(state.currentSyncVersion());

                        String keyEpoch = state.keyEpoch();

                        PushResponse response = arbiter.arbitrate(deviceId, folders, folderLedger, sequence,
                                        new FolderPlacementCheck(folderLedger), keyEpoch)
                                .flatMap(folderResult -> arbiter.arbitrate(deviceId, notes, noteLedger, sequence,
                                                PlacementCheck.<Note>none(), keyEpoch)
                                        .map(noteResult -> new PushResponse(noteResult, folderResult)))
                                .block();

                        write(new FileSyncState(noteLedger.snapshot(), folderLedger.snapshot(),
                                sequence.current().block(), state.accountKeys()));
                        return response;
                    } finally {
                        lock.unlock();
                    }
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<AccountKeys> fetch() {
        return Mono.fromCallable(this::read)
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(state -> Mono.justOrEmpty(state.accountKeys()));
    }

    @Override
    public Mono<Void> register(Registration registration) {
        return update(state -> {
            if (state.accountKeys() != null) {
                throw new ValidationFailureException("An account is already registered on " + stateFile.getFileName());
            }
            return state.withAccountKeys(registration.keys());
        });
    }

    /** Compare-and-set on the epoch: the stored bundle must still be the one the rekey started from. */
    @Override
    public Mono<Void> publish(Rekey rekey) {
        return update(state -> {
            String stored = state.keyEpoch();
            if (stored != null && !stored.equals(rekey.previous().keyEpoch())) {
                throw new AuthenticationFailureException("Account keys were changed on another device");
            }
            log.info("Publishing key bundle epoch {} to {}", rekey.keys().keyEpoch(), stateFile.getFileName());
            return state.withAccountKeys(rekey.keys());
        });
    }

    private Mono<Void> update(UnaryOperator<FileSyncState> change) {
        return Mono.fromRunnable(() -> {
                    lock.lock();
                    try {
                        write(change.apply(read()));
                    } finally {
                        lock.unlock();
                    }
                })
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    private FileSyncState read() {
        if (!Files.exists(stateFile)) {
            return FileSyncState.empty();
        }
        try {
            return mapper.readValue(stateFile.toFile(), FileSyncState.class);
        } catch (IOException e) {
            throw new TransportFailureException("Cannot read sync state " + stateFile, e);
        }
    }

    private void write(FileSyncState state) {
        try {
            Path dir = stateFile.toAbsolutePath().getParent();
            Path temp = Files.createTempFile(dir, stateFile.getFileName().toString(), ".tmp");
            mapper.writeValue(temp.toFile(), state);
            Files.move(temp, stateFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Wrote sync state {} at sequence {}", stateFile, state.currentSyncVersion());
        } catch (IOException e) {
            throw new TransportFailureException("Cannot write sync state " + stateFile, e);
        }
    }
}
