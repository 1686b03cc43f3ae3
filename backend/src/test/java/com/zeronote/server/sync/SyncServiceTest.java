package com.zeronote.server.sync;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import com.zeronote.error.ValidationFailureException;
import com.zeronote.model.EntityType;
import com.zeronote.model.Folder;
import com.zeronote.model.Note;
import com.zeronote.model.NoteVersion;
import com.zeronote.model.SyncEntity;
import com.zeronote.server.ServerFixtures;
import com.zeronote.server.config.ZeroNoteProperties;
import com.zeronote.server.history.NoteHistoryService;
import com.zeronote.server.web.NotFoundException;
import com.zeronote.sync.PullResponse;
import com.zeronote.sync.PushOutcome;
import com.zeronote.sync.PushRequest;
import com.zeronote.sync.PushResponse;
import com.zeronote.sync.PushStatus;
import com.zeronote.sync.arbiter.EntityLedger;
import com.zeronote.sync.arbiter.PushArbiter;
import com.zeronote.sync.arbiter.SequenceCounter;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SyncServiceTest {

    private static final String OWNER = "ada";

    @Mock
    private NoteHistoryService history;

    private InMemoryLedgerFactory ledgers;
    private SyncNotifier notifier;
    private InFlightPushes inFlight;
    private final Map<String, String> keyEpochs = new HashMap<>();
    private SyncService syncService;

    @BeforeEach
    void setup() {
        ledgers = new InMemoryLedgerFactory();
        notifier = new SyncNotifier();
        inFlight = new InFlightPushes();
        syncService = buildService(ServerFixtures.properties());
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private SyncService buildService(ZeroNoteProperties properties) {
        return buildService(ledgers, properties);
    }

    private SyncService buildService(LedgerFactory factory, ZeroNoteProperties properties) {
        return new SyncService(factory, new PushArbiter(), history, notifier, inFlight,
                owner -> Mono.justOrEmpty(keyEpochs.get(owner)), properties);
    }

    /** Note ledger that runs {@code beforeWrite} after the sequence is reserved and before the row lands. */
    private LedgerFactory interleaving(Runnable beforeWrite) {
        return new LedgerFactory() {
            @Override
            public EntityLedger<Note> notes(String owner) {
                return new InterleavingLedger<>(ledgers.notes(owner), beforeWrite);
            }

            @Override
            public EntityLedger<Folder> folders(String owner) {
                return ledgers.folders(owner);
            }

            @Override
            public SequenceCounter sequence(String owner) {
                return ledgers.sequence(owner);
            }
        };
    }

    private static final class InterleavingLedger<T extends SyncEntity<T>> implements EntityLedger<T> {
        private final EntityLedger<T> delegate;
        private final Runnable beforeWrite;

        InterleavingLedger(EntityLedger<T> delegate, Runnable beforeWrite) {
            this.delegate = delegate;
            this.beforeWrite = beforeWrite;
        }

        @Override
        public Mono<T> find(String id) {
            return delegate.find(id);
        }

        @Override
        public Mono<Boolean> insertIfAbsent(T entity) {
            return Mono.fromRunnable(beforeWrite).then(Mono.defer(() -> delegate.insertIfAbsent(entity)));
        }

        @Override
        public Mono<Boolean> replaceIfVersion(T entity, long expectedVersion) {
            return Mono.fromRunnable(beforeWrite).then(Mono.defer(() -> delegate.replaceIfVersion(entity, expectedVersion)));
        }

        @Override
        public Flux<T> changedSince(long sinceSeq) {
            return delegate.changedSince(sinceSeq);
        }
    }

    private void stubHistory() {
        when(history.record(any(), any(), anyLong())).thenReturn(Mono.empty());
    }

    private PushResponse push(String owner, String deviceId, List<Note> notes, List<Folder> folders) {
        return syncService.push(owner, new PushRequest(deviceId, notes, folders)).block();
    }

    private static NoteVersion versionOf(Note note, String versionId) {
        return new NoteVersion(versionId, note.getId(), note.getEncryptedTitle(), note.getEncryptedContent(),
                note.getEncryptedDek(), note.getDekId(), note.getKeyEpoch(), 64, note.getSyncVersion(), 1_000);
    }

    private static Note stamped(Note note, String dekId, String keyEpoch) {
        note.setDekId(dekId);
        note.setKeyEpoch(keyEpoch);
        return note;
    }

    private static PushOutcome<Note> onlyNoteOutcome(PushResponse response) {
        assertEquals(1, response.notes().outcomes().size());
        return response.notes().outcomes().get(0);
    }

    // ── Push and pull ─────────────────────────────────────────────────────────

    @Test
    void pushedNoteComesBackStampedOnPull() {
        stubHistory();

        PushResponse response = push(OWNER, "laptop", List.of(ServerFixtures.note("n1", "hello", 0, 1_000)), List.of());

        PushOutcome<Note> outcome = onlyNoteOutcome(response);
        assertEquals(PushStatus.CREATED, outcome.status());
        assertEquals(1, outcome.syncVersion(), "New entities start at version 1");

        StepVerifier.create(syncService.pull(OWNER, 0))
                .assertNext(pull -> {
                    assertEquals(1, pull.currentSyncVersion());
                    assertEquals(1, pull.notes().size());
                    Note stored = pull.notes().get(0);
                    assertEquals(1, stored.getSyncVersion());
                    assertEquals("laptop", stored.getLastModifiedDeviceId());
                    assertFalse(stored.isDirty(), "Stored copies are never dirty");
                    assertEquals(ServerFixtures.blob("hello"), stored.getEncryptedContent());
                })
                .verifyComplete();

        StepVerifier.create(syncService.pull(OWNER, 1))
                .assertNext(pull -> {
                    assertTrue(pull.notes().isEmpty(), "Nothing changed after the cursor");
                    assertEquals(1, pull.currentSyncVersion());
                })
                .verifyComplete();
    }

    @Test
    void accountsDoNotSeeEachOther() {
        stubHistory();
        push(OWNER, "laptop", List.of(ServerFixtures.note("n1", "mine", 0, 1_000)), List.of());

        PullResponse other = syncService.pull("bob", 0).block();

        assertNotNull(other);
        assertTrue(other.notes().isEmpty());
        assertEquals(0, other.currentSyncVersion());
    }

    @Test
    void pullDuringAnUnfinishedWriteKeepsItsCursorBelowThatWrite() {
        stubHistory();
        List<PullResponse> duringWrite = new ArrayList<>();
        syncService = buildService(interleaving(() -> duringWrite.add(syncService.pull(OWNER, 0).block())),
                ServerFixtures.properties());

        push(OWNER, "laptop", List.of(ServerFixtures.note("n1", "hello", 0, 1_000)), List.of());

        assertEquals(1, duringWrite.size());
        PullResponse early = duringWrite.get(0);
        assertTrue(early.notes().isEmpty(), "The row had not landed yet");
        assertEquals(0, early.currentSyncVersion(), "Cursor must not pass the reserved sequence value");

        StepVerifier.create(syncService.pull(OWNER, early.currentSyncVersion()))
                .assertNext(next -> {
                    assertEquals(1, next.notes().size(), "Following the cursor picks the write up");
                    assertEquals("n1", next.notes().get(0).getId());
                    assertEquals(1, next.currentSyncVersion());
                })
                .verifyComplete();
        assertEquals(0, inFlight.openTickets(OWNER));
    }

    @Test
    void heartbeatAlsoWaitsForUnfinishedWrites() {
        stubHistory();
        List<Long> duringWrite = new ArrayList<>();
        syncService = buildService(interleaving(
                        () -> duringWrite.add(syncService.heartbeat(OWNER).block().currentSyncVersion())),
                ServerFixtures.properties());

        push(OWNER, "laptop", List.of(ServerFixtures.note("n1", "hello", 0, 1_000)), List.of());

        assertEquals(List.of(0L), duringWrite);
        assertEquals(1, syncService.heartbeat(OWNER).block().currentSyncVersion());
    }

    @Test
    void failedPushReleasesItsHoldOnTheCursor() {
        syncService = buildService(interleaving(() -> {
            throw new IllegalStateException("disk full");
        }), ServerFixtures.properties());

        StepVerifier.create(syncService.push(OWNER,
                        new PushRequest("laptop", List.of(ServerFixtures.note("n1", "x", 0, 1)), List.of())))
                .expectError(IllegalStateException.class)
                .verify();

        assertEquals(0, inFlight.openTickets(OWNER));
        assertEquals(1, syncService.pull(OWNER, 0).block().currentSyncVersion(),
                "The reserved value is skipped once nothing can still write it");
    }

    @Test
    void negativeCursorIsRejected() {
        StepVerifier.create(syncService.pull(OWNER, -1))
                .expectError(ValidationFailureException.class)
                .verify();
    }

    // ── Key epochs ────────────────────────────────────────────────────────────

    @Test
    void writesUnderReplacedKeysAreRefusedAndNothingIsStored() {
        stubHistory();
        keyEpochs.put(OWNER, "epoch-2");
        Note current = ServerFixtures.note("n1", "rewrapped", 0, 1_000);
        current.setKeyEpoch("epoch-2");
        Note stale = ServerFixtures.note("n2", "old keys", 0, 1_000);
        stale.setKeyEpoch("epoch-1");

        PushResponse response = push(OWNER, "phone", List.of(current, stale), List.of());

        assertEquals(PushStatus.CREATED, response.notes().outcomes().get(0).status());
        assertEquals(PushStatus.STALE_KEYS, response.notes().outcomes().get(1).status());
        assertEquals(1, response.notes().rejected());
        assertEquals(List.of("n1"), ledgers.storedNotes(OWNER).snapshot().stream().map(Note::getId).toList());
        verify(history, never()).record(eq(OWNER), argThat(note -> note.getId().equals("n2")), anyLong());
    }

    @Test
    void pullTellsDevicesWhichKeysAreCurrent() {
        keyEpochs.put(OWNER, "epoch-2");

        assertEquals("epoch-2", syncService.pull(OWNER, 0).block().keyEpoch());
        assertNull(syncService.pull("bob", 0).block().keyEpoch(), "No bundle on record, no epoch");
    }

    // ── Conflicts ─────────────────────────────────────────────────────────────

    @Test
    void laterConcurrentEditWinsAndEarlierOneIsDropped() {
        stubHistory();
        push(OWNER, "laptop", List.of(ServerFixtures.note("n1", "first", 0, 1_000)), List.of());

        PushOutcome<Note> later = onlyNoteOutcome(
                push(OWNER, "phone", List.of(ServerFixtures.note("n1", "phone edit", 0, 5_000)), List.of()));
        assertEquals(PushStatus.CONFLICT_LOCAL_WON, later.status());
        assertEquals(2, later.syncVersion());

        PushOutcome<Note> earlier = onlyNoteOutcome(
                push(OWNER, "tablet", List.of(ServerFixtures.note("n1", "tablet edit", 0, 3_000)), List.of()));
        assertEquals(PushStatus.CONFLICT_REMOTE_WON, earlier.status());
        assertEquals(ServerFixtures.blob("phone edit"), earlier.serverCopy().getEncryptedContent(),
                "The losing device is handed the stored copy");

        Note stored = ledgers.storedNotes(OWNER).snapshot().get(0);
        assertEquals(2, stored.getSyncVersion());
        assertEquals("phone", stored.getLastModifiedDeviceId());
    }

    // ── Limits ────────────────────────────────────────────────────────────────

    @Test
    void oversizedBatchIsRejectedBeforeAnyWrite() {
        SyncService limited = buildService(ServerFixtures.properties(50, 2));
        List<Note> notes = List.of(
                ServerFixtures.note("n1", "a", 0, 1), ServerFixtures.note("n2", "b", 0, 1),
                ServerFixtures.note("n3", "c", 0, 1));

        StepVerifier.create(limited.push(OWNER, new PushRequest("laptop", notes, List.of())))
                .expectError(ValidationFailureException.class)
                .verify();

        assertTrue(ledgers.storedNotes(OWNER).snapshot().isEmpty());
        verifyNoInteractions(history);
    }

    @Test
    void pushWithoutDeviceIdIsRejected() {
        StepVerifier.create(syncService.push(OWNER, new PushRequest(" ", List.of(), List.of())))
                .expectError(ValidationFailureException.class)
                .verify();
    }

    @Test
    void folderNestedElevenDeepIsRejectedAndTheRestStored() {
        List<Folder> chain = new ArrayList<>();
        for (int i = 1; i <= 11; i++) {
            chain.add(ServerFixtures.folder("f" + i, i == 1 ? null : "f" + (i - 1)));
        }

        PushResponse response = push(OWNER, "laptop", List.of(), chain);

        assertEquals(10, response.folders().created());
        assertEquals(1, response.folders().rejected());
        assertEquals(10, ledgers.storedFolders(OWNER).snapshot().size());
    }

    // ── Restore ───────────────────────────────────────────────────────────────

    @Test
    void restoredVersionBecomesTheNextWrite() {
        stubHistory();
        Note first = stamped(ServerFixtures.note("n1", "v1", 0, 1_000), "dek-a", null);
        push(OWNER, "laptop", List.of(first), List.of());
        push(OWNER, "laptop", List.of(stamped(ServerFixtures.note("n1", "v2", 1, 2_000), "dek-a", null)), List.of());
        when(history.get(OWNER, "n1", "ver-1")).thenReturn(Mono.just(versionOf(first, "ver-1")));

        PushOutcome<Note> outcome = syncService.restore(OWNER, "n1", "ver-1").block();

        assertEquals(PushStatus.UPDATED, outcome.status());
        assertEquals(3, outcome.syncVersion());
        Note stored = ledgers.notes(OWNER).find("n1").block();
        assertEquals(ServerFixtures.blob("v1"), stored.getEncryptedContent());
        assertEquals(SyncService.RESTORE_DEVICE, stored.getLastModifiedDeviceId());
        assertTrue(stored.getUpdatedAt() > 2_000);
        verify(history).record(eq(OWNER), argThat(note -> note.getEncryptedContent().equals(ServerFixtures.blob("v1"))), eq(3L));
    }

    @Test
    void versionFromBeforeAPasswordChangeRestoresUnderTheCurrentWrap() {
        stubHistory();
        keyEpochs.put(OWNER, "epoch-1");
        Note original = stamped(ServerFixtures.note("n1", "before", 0, 1_000), "dek-a", "epoch-1");
        push(OWNER, "laptop", List.of(original), List.of());

        keyEpochs.put(OWNER, "epoch-2");
        Note rewrapped = stamped(ServerFixtures.note("n1", "after", 1, 2_000), "dek-a", "epoch-2");
        rewrapped.setEncryptedDek(ServerFixtures.wrapped((byte) 8));
        push(OWNER, "laptop", List.of(rewrapped), List.of());
        when(history.get(OWNER, "n1", "ver-1")).thenReturn(Mono.just(versionOf(original, "ver-1")));

        PushOutcome<Note> outcome = syncService.restore(OWNER, "n1", "ver-1").block();

        assertTrue(outcome.status().isApplied());
        Note stored = ledgers.notes(OWNER).find("n1").block();
        assertEquals(ServerFixtures.blob("before"), stored.getEncryptedContent());
        assertEquals(ServerFixtures.wrapped((byte) 8), stored.getEncryptedDek(), "The wrap under the new keys stays");
        assertEquals("epoch-2", stored.getKeyEpoch());
    }

    @Test
    void versionUnderADekTheNoteNoLongerUsesIsRefused() {
        stubHistory();
        Note original = stamped(ServerFixtures.note("n1", "open", 0, 1_000), "dek-a", null);
        push(OWNER, "laptop", List.of(original), List.of());
        push(OWNER, "laptop", List.of(stamped(ServerFixtures.note("n1", "protected", 1, 2_000), "dek-b", null)), List.of());
        when(history.get(OWNER, "n1", "ver-1")).thenReturn(Mono.just(versionOf(original, "ver-1")));

        StepVerifier.create(syncService.restore(OWNER, "n1", "ver-1"))
                .expectError(IllegalStateException.class)
                .verify();

        Note stored = ledgers.notes(OWNER).find("n1").block();
        assertEquals(2, stored.getSyncVersion());
        assertEquals(ServerFixtures.blob("protected"), stored.getEncryptedContent());
    }

    @Test
    void restoreRespectsTheAccountKeyEpoch() {
        stubHistory();
        Note original = stamped(ServerFixtures.note("n1", "v1", 0, 1_000), "dek-a", "epoch-1");
        push(OWNER, "laptop", List.of(original), List.of());
        keyEpochs.put(OWNER, "epoch-2");
        when(history.get(OWNER, "n1", "ver-1")).thenReturn(Mono.just(versionOf(original, "ver-1")));

        StepVerifier.create(syncService.restore(OWNER, "n1", "ver-1"))
                .expectErrorMatches(e -> e instanceof IllegalStateException && e.getMessage().contains("epoch-1"))
                .verify();
    }

    @Test
    void restoreOfAnUnknownNoteIsNotFound() {
        StepVerifier.create(syncService.restore(OWNER, "missing", "ver-1"))
                .expectError(NotFoundException.class)
                .verify();
        verifyNoInteractions(history);
    }

    // ── History and hints ─────────────────────────────────────────────────────

    @Test
    void historyKeepsAppliedNoteBodiesOnly() {
        stubHistory();
        Note tombstone = ServerFixtures.note("gone", "x", 0, 1_000);
        tombstone.setDeleted(true);
        push(OWNER, "laptop", List.of(ServerFixtures.note("n1", "v1", 0, 1_000), tombstone), List.of());

        push(OWNER, "tablet", List.of(ServerFixtures.note("n1", "stale", 0, 500)), List.of());

        verify(history).record(eq(OWNER), argThat(note -> note.getId().equals("n1")
                && note.getEncryptedContent().equals(ServerFixtures.blob("v1"))), eq(1L));
        verify(history, never()).record(eq(OWNER), argThat(note -> note.getId().equals("gone")), anyLong());
        verify(history, never()).record(eq(OWNER), argThat(note -> note.getEncryptedContent().equals(ServerFixtures.blob("stale"))), anyLong());
    }

    @Test
    void acceptedWritesAreAnnouncedFoldersFirst() {
        stubHistory();

        StepVerifier.create(syncService.hints(OWNER))
                .then(() -> push(OWNER, "laptop",
                        List.of(ServerFixtures.note("n1", "hi", 0, 1_000)),
                        List.of(ServerFixtures.folder("f1", null))))
                .assertNext(hint -> {
                    assertEquals(EntityType.FOLDER, hint.entityType());
                    assertEquals("f1", hint.entityId());
                })
                .assertNext(hint -> {
                    assertEquals(EntityType.NOTE, hint.entityType());
                    assertEquals("n1", hint.entityId());
                    assertEquals(1, hint.syncVersion());
                })
                .thenCancel()
                .verify();
    }

    @Test
    void heartbeatReportsTheAccountSequence() {
        stubHistory();
        push(OWNER, "laptop", List.of(ServerFixtures.note("n1", "a", 0, 1), ServerFixtures.note("n2", "b", 0, 1)), List.of());

        StepVerifier.create(syncService.heartbeat(OWNER))
                .assertNext(heartbeat -> {
                    assertEquals(2, heartbeat.currentSyncVersion());
                    assertTrue(heartbeat.serverTime() > 0);
                })
                .verifyComplete();
    }
}
