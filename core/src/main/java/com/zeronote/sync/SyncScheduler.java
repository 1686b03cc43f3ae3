package com.zeronote.sync;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/** Runs a sync cycle every interval. Ticks that land while a cycle is running are dropped. */
public class SyncScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SyncScheduler.class);

    private final SyncEngine engine;
    private final Duration interval;
    private final Scheduler scheduler;
    private Disposable subscription;

    public SyncScheduler(SyncEngine engine, Duration interval) {
        this(engine, interval, Schedulers.parallel());
    }

    public SyncScheduler(SyncEngine engine, Duration interval, Scheduler scheduler) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Sync interval must be positive");
        }
        this.engine = engine;
        this.interval = interval;
        this.scheduler = scheduler;
    }

    public static SyncScheduler forConfig(SyncEngine engine, SyncConfig config, Scheduler scheduler) {
        return new SyncScheduler(engine, Duration.ofMinutes(config.intervalMinutes()), scheduler);
    }

    public synchronized void start() {
        if (isRunning()) {
            return;
        }
        subscription = Flux.interval(interval, interval, scheduler)
                .onBackpressureDrop()
                .concatMap(tick -> engine.synchronize()
                        .onErrorResume(e -> {
                            log.warn("Scheduled sync failed", e);
                            return Mono.empty();
                        }), 1)
                .subscribe(result -> log.debug("Scheduled sync finished: success={}", result.success()));
        log.info("Sync scheduled every {}", interval);
    }

    public synchronized boolean isRunning() {
        return subscription != null && !subscription.isDisposed();
    }

    public synchronized void stop() {
        if (subscription != null) {
            subscription.dispose();
            subscription = null;
        }
    }

    @Override
    public void close() {
        stop();
    }
}
