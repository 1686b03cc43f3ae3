package com.zeronote.sync.arbiter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import com.zeronote.model.Folder;
import com.zeronote.model.LockoutState;
import com.zeronote.model.Note;
import com.zeronote.sync.EntityPushResult;
import com.zeronote.sync.PushOutcome;
import com.zeronote.sync.PushStatus;

@ExtendWith(MockitoExtension.class)
class PushArbiterTest {

    private final PushArbiter arbiter = new PushArbiter();
    private final InMemoryEntityLedger<Note> ledger = new InMemoryEntityLedger<>();
    private final InMemorySequenceCounter sequence = new InMemorySequenceCounter(0);

    @Mock
    private EntityLedger<Note> racingLedger;

    // ── Create / update ──────────────────────────────────────────────────────

    @Test
    void unknownEntityIsCreatedAtVersionOne() {
        Note note = buildNote("n1", 0, 100);
        note.setDirty(true);
        note.setLockout(new LockoutState(3, null));

        StepVerifier.create(arbiter.arbitrate("dev-a", List.of(note), ledger, sequence, PlacementCheck.none()))
                .assertNext(result -> {
                    assertEquals(1, result.created());
                    PushOutcome<Note> outcome = result.outcomes().get(0);
                    assertEquals(PushStatus.CREATED, outcome.status());
                    assertEquals(1, outcome.syncVersion());
                    assertEquals(1, outcome.changeSeq());
                })
                .verifyComplete();

        Note stored = ledger.snapshot().get(0);
        assertEquals("dev-a", stored.getLastModifiedDeviceId());
        assertFalse(stored.isDirty(), "Device-local dirty flag is not stored");
        assertEquals(LockoutState.unlocked(), stored.getLockout(), "Device-local lockout is not stored");
    }

    @Test
    void everyAcceptedWriteBumpsVersionByOne() {
        push("dev-a", buildNote("n1", 0, 100));
        push("dev-a", buildNote("n1", 1, 200));
        EntityPushResult<Note> third = push("dev-a", buildNote("n1", 2, 300));

        assertEquals(3, third.outcomes().get(0).syncVersion());
        assertEquals(3, third.outcomes().get(0).changeSeq());
        assertEquals(1, third.updated(), "Counted as a plain update");
    }

    // ── Conflicts ────────────────────────────────────────────────────────────

    @Test
    void newerConcurrentEditReplacesTheStoredCopy() {
        push("dev-a", buildNote("n1", 0, 100));
        push("dev-a", buildNote("n1", 1, 200));

        EntityPushResult<Note> result = push("dev-b", buildNote("n1", 1, 300));

        assertEquals(1, result.conflicts());
        assertEquals(0, result.updated(), "A conflict win is not counted as an update");
        assertEquals(PushStatus.CONFLICT_LOCAL_WON, result.outcomes().get(0).status());
        assertEquals(3, ledger.snapshot().get(0).getSyncVersion());
        assertEquals(300, ledger.snapshot().get(0).getUpdatedAt());
    }

    @Test
    void olderConcurrentEditIsDroppedAndTheStoredCopyReturned() {
        push("dev-a", buildNote("n1", 0, 100));
        push("dev-a", buildNote("n1", 1, 500));

        EntityPushResult<Note> result = push("dev-b", buildNote("n1", 1, 300));

        PushOutcome<Note> outcome = result.outcomes().get(0);
        assertEquals(PushStatus.CONFLICT_REMOTE_WON, outcome.status());
        assertNotNull(outcome.serverCopy());
        assertEquals(500, outcome.serverCopy().getUpdatedAt());
        assertEquals(2, ledger.snapshot().get(0).getSyncVersion(), "Stored copy untouched");
    }

    // ── Rejections and races ─────────────────────────────────────────────────

    @Test
    void placementFailureRejectsOnlyThatEntity() {
        InMemoryEntityLedger<Folder> folders = new InMemoryEntityLedger<>();
        List<Folder> batch = new ArrayList<>();
        for (int i = 1; i <= 11; i++) {
            Folder folder = new Folder();
            folder.setId("f" + i);
            folder.setParentId(i == 1 ? null : "f" + (i - 1));
            batch.add(folder);
        }

        StepVerifier.create(arbiter.arbitrate("dev-a", batch, folders, sequence, new FolderPlacementCheck(folders)))
                .assertNext(result -> {
                    assertEquals(10, result.created());
                    assertEquals(1, result.rejected());
                    PushOutcome<Folder> rejected = result.outcomes().get(10);
                    assertEquals("f11", rejected.id());
                    assertEquals(PushStatus.REJECTED, rejected.status());
                    assertNotNull(rejected.reason());
                })
                .verifyComplete();
    }

    @Test
    void blankIdIsRejected() {
        EntityPushResult<Note> result = push("dev-a", buildNote(" ", 0, 100));

        assertEquals(1, result.rejected());
        assertNull(result.outcomes().get(0).serverCopy());
    }

    @Test
    void lostCompareAndSetRereadsAndRetries() {
        Note stored = buildNote("n1", 1, 100);
        stored.setLastModifiedDeviceId("dev-a");
        when(racingLedger.find("n1")).thenReturn(Mono.just(stored));
        when(racingLedger.replaceIfVersion(any(), anyLong()))
                .thenReturn(Mono.just(false))
                .thenReturn(Mono.just(true));

        StepVerifier.create(arbiter.arbitrate("dev-a", List.of(buildNote("n1", 1, 200)), racingLedger, sequence,
                        PlacementCheck.none()))
                .assertNext(result -> assertEquals(PushStatus.UPDATED, result.outcomes().get(0).status()))
                .verifyComplete();

        verify(racingLedger, times(2)).find("n1");
    }

    @Test
    void persistentRaceEndsInARejection() {
        when(racingLedger.find("n1")).thenReturn(Mono.empty());
        when(racingLedger.insertIfAbsent(any())).thenReturn(Mono.just(false));

        StepVerifier.create(arbiter.arbitrate("dev-a", List.of(buildNote("n1", 0, 200)), racingLedger, sequence,
                        PlacementCheck.none()))
                .assertNext(result -> assertEquals(PushStatus.REJECTED, result.outcomes().get(0).status()))
                .verifyComplete();

        verify(racingLedger, times(PushArbiter.DEFAULT_MAX_RETRIES + 1)).insertIfAbsent(any());
    }

    // ── Key epochs ───────────────────────────────────────────────────────────

    @Test
    void entityUnderReplacedKeysIsRefusedWithoutTouchingTheLedger() {
        Note stale = buildNote("n1", 0, 100);
        stale.setKeyEpoch("epoch-1");

        StepVerifier.create(arbiter.arbitrate("dev-b", List.of(stale), racingLedger, sequence,
                        PlacementCheck.none(), "epoch-2"))
                .assertNext(result -> {
                    assertEquals(1, result.rejected());
                    PushOutcome<Note> outcome = result.outcomes().get(0);
                    assertEquals(PushStatus.STALE_KEYS, outcome.status());
                    assertNotNull(outcome.reason());
                })
                .verifyComplete();

        verifyNoInteractions(racingLedger);
        StepVerifier.create(sequence.current()).expectNext(0L).verifyComplete();
    }

    @Test
    void unstampedEntityIsRefusedOnceTheAccountHasAnEpoch() {
        EntityPushResult<Note> result = arbiter.arbitrate("dev-a", List.of(buildNote("n1", 0, 100)), ledger, sequence,
                PlacementCheck.none(), "epoch-2").block();

        assertEquals(PushStatus.STALE_KEYS, result.outcomes().get(0).status());
        assertTrue(ledger.snapshot().isEmpty());
    }

    @Test
    void entityUnderCurrentKeysIsArbitratedAsUsual() {
        Note current = buildNote("n1", 0, 100);
        current.setKeyEpoch("epoch-2");

        EntityPushResult<Note> result = arbiter.arbitrate("dev-a", List.of(current), ledger, sequence,
                PlacementCheck.none(), "epoch-2").block();

        assertEquals(PushStatus.CREATED, result.outcomes().get(0).status());
        assertEquals("epoch-2", ledger.snapshot().get(0).getKeyEpoch());
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private EntityPushResult<Note> push(String deviceId, Note note) {
        return arbiter.arbitrate(deviceId, List.of(note), ledger, sequence, PlacementCheck.none()).block();
    }

    private static Note buildNote(String id, long baseVersion, long updatedAt) {
        Note note = new Note();
        note.setId(id);
        note.setSyncVersion(baseVersion);
        note.setUpdatedAt(updatedAt);
        return note;
    }
}
