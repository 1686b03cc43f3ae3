package com.zeronote.sync;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * "Dirty since T, flush after a quiet period D". Every edit calls {@link #markDirty()}, which
 * cancels the pending flush and schedules a new one D from now; the flush runs once edits stop.
 * {@link #dirtySince()} is the time of the first edit not yet flushed.
 */
public class DebouncedFlush implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DebouncedFlush.class);

    private final Duration quietPeriod;
    private final Scheduler scheduler;
    private final Supplier<Mono<?>> flush;

    private Disposable pending;
    private Long dirtySince;

    public DebouncedFlush(Duration quietPeriod, Scheduler scheduler, Supplier<Mono<?>> flush) {
        this.quietPeriod = quietPeriod;
        this.scheduler = scheduler;
        this.flush = flush;
    }

    public synchronized void markDirty() {
        if (dirtySince == null) {
            dirtySince = scheduler.now(TimeUnit.MILLISECONDS);
        }
        if (pending != null) {
            pending.dispose();
        }
        pending = scheduler.schedule(this::fire, quietPeriod.toMillis(), TimeUnit.MILLISECONDS);
    }

    public synchronized Optional<Instant> dirtySince() {
        return Optional.ofNullable(dirtySince).map(Instant::ofEpochMilli);
    }

    public synchronized boolean isPending() {
        return pending != null && !pending.isDisposed();
    }

    public synchronized void cancel() {
        if (pending != null) {
            pending.dispose();
            pending = null;
        }
        dirtySince = null;
    }

    @Override
    public void close() {
        cancel();
    }

    private void fire() {
        synchronized (this) {
            pending = null;
            dirtySince = null;
        }
        flush.get().subscribe(
                result -> log.debug("Debounced flush finished"),
                error -> log.warn("Debounced flush failed", error));
    }
}
