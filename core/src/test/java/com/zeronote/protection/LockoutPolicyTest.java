package com.zeronote.protection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.zeronote.MutableClock;
import com.zeronote.error.AuthenticationFailureException;
import com.zeronote.error.IntegrityFailureException;
import com.zeronote.error.LockoutActiveException;
import com.zeronote.model.LockoutState;
import com.zeronote.model.Note;

class LockoutPolicyTest {

    private static final long START = 1_700_000_000_000L;

    private MutableClock clock;
    private LockoutPolicy policy;
    private Note note;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        policy = new LockoutPolicy(clock);
        note = new Note();
        note.setId("n1");
    }

    // ── Counting ─────────────────────────────────────────────────────────────

    @Test
    void fourFailuresStayUnlocked() {
        for (int i = 0; i < 4; i++) {
            fail();
        }

        assertEquals(new LockoutState(4, null), note.getLockout());
    }

    @Test
    void fifthFailureLocksForFiveMinutes() {
        for (int i = 0; i < 5; i++) {
            fail();
        }

        assertEquals(5, note.getLockout().attempts());
        assertEquals(START + Duration.ofMinutes(5).toMillis(), note.getLockout().lockedUntil());
    }

    @Test
    void successResetsTheCounter() {
        fail();
        fail();

        assertEquals("ok", policy.attempt(note, () -> "ok"));
        assertEquals(LockoutState.unlocked(), note.getLockout());
    }

    @Test
    void errorsOtherThanAuthenticationDoNotCount() {
        assertThrows(IntegrityFailureException.class, () -> policy.attempt(note, () -> {
            throw new IntegrityFailureException("corrupt", null);
        }));

        assertEquals(0, note.getLockout().attempts());
    }

    // ── Locked window ────────────────────────────────────────────────────────

    @Test
    void lockedEntityRejectsEvenTheRightPasswordWithoutEvaluatingIt() {
        for (int i = 0; i < 5; i++) {
            fail();
        }
        clock.advance(Duration.ofMinutes(4));
        AtomicInteger evaluations = new AtomicInteger();

        LockoutActiveException ex = assertThrows(LockoutActiveException.class,
                () -> policy.attempt(note, evaluations::incrementAndGet));

        assertEquals(0, evaluations.get(), "Verification must not run while locked");
        assertEquals(START + Duration.ofMinutes(5).toMillis(), ex.getLockedUntil().toEpochMilli());
        assertEquals(5, note.getLockout().attempts(), "State unchanged while locked");
    }

    @Test
    void expiredLockResetsToAFreshCounter() {
        for (int i = 0; i < 5; i++) {
            fail();
        }
        clock.advance(Duration.ofMinutes(5));

        fail();

        assertEquals(1, note.getLockout().attempts(), "Counting restarts after the window");
        assertNull(note.getLockout().lockedUntil());
        assertFalse(note.getLockout().isLockedAt(clock.millis()));
    }

    private void fail() {
        assertThrows(AuthenticationFailureException.class, () -> policy.attempt(note, () -> {
            throw AuthenticationFailureException.incorrectPassword(null);
        }));
    }
}
