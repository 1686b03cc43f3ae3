package com.zeronote.protection;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

import com.zeronote.error.AuthenticationFailureException;
import com.zeronote.error.LockoutActiveException;
import com.zeronote.model.LockoutState;
import com.zeronote.model.SyncEntity;

/**
 * Per-entity attempt limiter for secondary passwords.
 *
 * <pre>
 *   Unlocked{n} --fail, n+1 &lt; 5--&gt; Unlocked{n+1}
 *   Unlocked{n} --fail, n+1 = 5--&gt; Locked{now + 5 min}
 *   Unlocked{n} --success-------&gt; Unlocked{0}
 *   Locked{t}   --any, now &lt; t---&gt; rejected, state unchanged
 *   Locked{t}   --now &gt;= t-------&gt; Unlocked{0}
 * </pre>
 *
 * The state lives on the entity; the caller persists the entity after every attempt, whether it
 * succeeded or threw.
 */
public class LockoutPolicy {

    public static final int MAX_ATTEMPTS = 5;
    public static final Duration LOCK_DURATION = Duration.ofMinutes(5);

    private final Clock clock;

    public LockoutPolicy(Clock clock) {
        this.clock = clock;
    }

    /**
     * Runs {@code verification} unless the entity is locked. Only an
     * {@link AuthenticationFailureException} counts as a failed attempt.
     *
     * @throws LockoutActiveException while the lock is open, without running the verification
     */
    public <R> R attempt(SyncEntity<?> entity, Supplier<R> verification) {
        long now = clock.millis();
        LockoutState state = entity.getLockout();
        if (state.isLockedAt(now)) {
            throw new LockoutActiveException(Instant.ofEpochMilli(state.lockedUntil()));
        }
        if (state.lockedUntil() != null) {
            state = LockoutState.unlocked();
        }
        try {
            R result = verification.get();
            entity.setLockout(LockoutState.unlocked());
            return result;
        } catch (AuthenticationFailureException e) {
            entity.setLockout(afterFailure(state, now));
            throw e;
        }
    }

    LockoutState afterFailure(LockoutState state, long now) {
        int attempts = state.attempts() + 1;
        if (attempts >= MAX_ATTEMPTS) {
            return new LockoutState(attempts, now + LOCK_DURATION.toMillis());
        }
        return new LockoutState(attempts, null);
    }
}
