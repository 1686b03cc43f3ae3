package com.zeronote.server.sync;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.zeronote.error.ValidationFailureException;
import com.zeronote.model.EntityType;
import com.zeronote.model.Folder;
import com.zeronote.model.Note;
import com.zeronote.model.NoteVersion;
import com.zeronote.server.config.ZeroNoteProperties;
import com.zeronote.server.history.NoteHistoryService;
import com.zeronote.server.web.NotFoundException;
import com.zeronote.sync.EntityPushResult;
import com.zeronote.sync.Heartbeat;
import com.zeronote.sync.PullResponse;
import com.zeronote.sync.PushOutcome;
import com.zeronote.sync.PushRequest;
import com.zeronote.sync.PushResponse;
import com.zeronote.sync.SyncHint;
import com.zeronote.sync.arbiter.EntityLedger;
import com.zeronote.sync.arbiter.FolderPlacementCheck;
import com.zeronote.sync.arbiter.PlacementCheck;
import com.zeronote.sync.arbiter.PushArbiter;
import com.zeronote.sync.arbiter.SequenceCounter;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Server side of sync. Conflict handling lives in {@link PushArbiter}; this class scopes it to
 * an account, keeps note history and tells listening devices what changed.
 *
 * <p>Folders are arbitrated before notes so a note never lands in a folder the same push is
 * about to reject.
 */
@Service
public class SyncService {

    private static final Logger log = LoggerFactory.getLogger(SyncService.class);

    /** Device id stamped on writes the server makes itself when a version is restored. */
    public static final String RESTORE_DEVICE = "version-restore";

    private final LedgerFactory ledgers;
    private final PushArbiter arbiter;
    private final NoteHistoryService history;
    private final SyncNotifier notifier;
    private final InFlightPushes inFlight;
    private final KeyEpochSource keyEpochs;
    private final ZeroNoteProperties properties;

    public SyncService(LedgerFactory ledgers, PushArbiter arbiter, NoteHistoryService history,
                       SyncNotifier notifier, InFlightPushes inFlight, KeyEpochSource keyEpochs,
                       ZeroNoteProperties properties) {
        this.ledgers = ledgers;
        this.arbiter = arbiter;
        this.history = history;
        this.notifier = notifier;
        this.inFlight = inFlight;
        this.keyEpochs = keyEpochs;
        this.properties = properties;
    }

    /**
     * Everything stamped after {@code since}. The cursor is settled before any row is read and
     * never passes a sequence value an unfinished push has reserved, so an entity written
     * during the pull is either included or picked up by the next one. Entities past the
     * cursor may come back again on the next pull; devices skip versions they already hold.
     * The account's key epoch rides along so a device can tell its keys were replaced.
     */
    public Mono<PullResponse> pull(String owner, long since) {
        if (since < 0) {
            return Mono.error(new ValidationFailureException("Cursor cannot be negative"));
        }
        return safeCursor(owner)
                .flatMap(current -> Mono.zip(
                                ledgers.notes(owner).changedSince(since).collectList(),
                                ledgers.folders(owner).changedSince(since).collectList(),
                                epochOf(owner))
                        .map(changes -> new PullResponse(changes.getT1(), changes.getT2(), current,
                                changes.getT3().orElse(null))))
                .doOnNext(response -> log.debug("Pull for {} since {}: {} notes, {} folders",
                        owner, since, response.notes().size(), response.folders().size()));
    }

    /** Entities stamped with any key epoch but the account's current one are refused as stale. */
    public Mono<PushResponse> push(String owner, PushRequest request) {
        int size = request.notes().size() + request.folders().size();
        if (size > properties.sync().maxBatch()) {
            return Mono.error(new ValidationFailureException(
                    "Push of " + size + " entities exceeds the limit of " + properties.sync().maxBatch()));
        }
        if (request.deviceId() == null || request.deviceId().isBlank()) {
            return Mono.error(new ValidationFailureException("Device id is required"));
        }
        EntityLedger<Folder> folders = ledgers.folders(owner);
        EntityLedger<Note> notes = ledgers.notes(owner);
        SequenceCounter sequence = ledgers.sequence(owner);

        return epochOf(owner).flatMap(epoch -> sequence.current()
                .flatMap(floor -> {
                    String keyEpoch = epoch.orElse(null);
                    InFlightPushes.Ticket ticket = inFlight.open(owner, floor);
                    return arbiter.arbitrate(request.deviceId(), request.folders(), folders, sequence,
                                    new FolderPlacementCheck(folders), keyEpoch)
                            .flatMap(folderResult -> arbiter.arbitrate(request.deviceId(), request.notes(), notes,
                                            sequence, PlacementCheck.<Note>none(), keyEpoch)
                                    .map(noteResult -> new PushResponse(noteResult, folderResult)))
                            .doFinally(signal -> inFlight.close(ticket));
                }))
                .flatMap(response -> recordHistory(owner, request.notes(), response.notes()).thenReturn(response))
                .doOnNext(response -> {
                    announce(owner, EntityType.FOLDER, response.folders());
                    announce(owner, EntityType.NOTE, response.notes());
                    log.info("Push from {} device {}: notes {}/{} applied, folders {}/{} applied, {} conflicts, {} rejected",
                            owner, request.deviceId(),
                            applied(response.notes()), request.notes().size(),
                            applied(response.folders()), request.folders().size(),
                            response.notes().conflicts() + response.folders().conflicts(),
                            response.notes().rejected() + response.folders().rejected());
                });
    }

    /**
     * Puts a retained version's ciphertext back as a new write on top of the current note. The
     * note keeps its current DEK wrap and key epoch, so a version taken before a password change
     * still restores. A version sealed under a DEK the note no longer uses cannot be opened with
     * the current wrap and is refused.
     */
    public Mono<PushOutcome<Note>> restore(String owner, String noteId, String versionId) {
        return ledgers.notes(owner).find(noteId)
                .switchIfEmpty(Mono.error(new NotFoundException("Unknown note: " + noteId)))
                .flatMap(current -> history.get(owner, noteId, versionId)
                        .flatMap(version -> {
                            if (!sameDek(current, version)) {
                                return Mono.<PushResponse>error(new IllegalStateException(
                                        "Version " + versionId + " was encrypted under a key the note no longer uses"));
                            }
                            Note restored = current.copy();
                            restored.setEncryptedTitle(version.encryptedTitle());
                            restored.setEncryptedContent(version.encryptedContent());
                            restored.setDeleted(false);
                            restored.setDeletedAt(null);
                            restored.touch(Math.max(System.currentTimeMillis(), current.getUpdatedAt() + 1));
                            return push(owner, new PushRequest(RESTORE_DEVICE, List.of(restored), List.of()));
                        }))
                .flatMap(response -> {
                    PushOutcome<Note> outcome = response.notes().outcomes().get(0);
                    if (!outcome.status().isApplied()) {
                        return Mono.<PushOutcome<Note>>error(new IllegalStateException("Restore of note " + noteId + " was not applied: "
                                + (outcome.reason() != null ? outcome.reason() : outcome.status())));
                    }
                    log.info("Restored note {} of {} to version {} as syncVersion {}",
                            noteId, owner, versionId, outcome.syncVersion());
                    return Mono.just(outcome);
                });
    }

    public Mono<Heartbeat> heartbeat(String owner) {
        return safeCursor(owner)
                .map(current -> new Heartbeat(System.currentTimeMillis(), current));
    }

    public Flux<SyncHint> hints(String owner) {
        return notifier.subscribe(owner);
    }

    private static boolean sameDek(Note current, NoteVersion version) {
        if (version.dekId() != null && current.getDekId() != null) {
            return version.dekId().equals(current.getDekId());
        }
        // Versions recorded before DEKs were named can only match on the wrap itself.
        return Objects.equals(version.encryptedDek(), current.getEncryptedDek());
    }

    private Mono<Optional<String>> epochOf(String owner) {
        return keyEpochs.keyEpoch(owner)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty());
    }

    private Mono<Long> safeCursor(String owner) {
        return ledgers.sequence(owner).current()
                .map(current -> inFlight.safeCursor(owner, current));
    }

    // Each accepted note body becomes a version; tombstones carry nothing worth keeping.
    private Mono<Void> recordHistory(String owner, List<Note> pushed, EntityPushResult<Note> result) {
        Map<String, Note> byId = pushed.stream()
                .filter(note -> note.getId() != null)
                .collect(Collectors.toMap(Note::getId, Function.identity(), (first, second) -> second));
        return Flux.fromIterable(result.outcomes())
                .filter(outcome -> outcome.status().isApplied())
                .concatMap(outcome -> {
                    Note note = byId.get(outcome.id());
                    if (note == null || note.isDeleted() || note.getEncryptedContent() == null) {
                        return Mono.empty();
                    }
                    return history.record(owner, note, outcome.syncVersion());
                })
                .then();
    }

    private void announce(String owner, EntityType type, EntityPushResult<?> result) {
        for (PushOutcome<?> outcome : result.outcomes()) {
            if (outcome.status().isApplied()) {
                notifier.publish(owner, new SyncHint(type, outcome.id(), outcome.syncVersion()));
            }
        }
    }

    private static int applied(EntityPushResult<?> result) {
        return (int) result.outcomes().stream().filter(outcome -> outcome.status().isApplied()).count();
    }
}
