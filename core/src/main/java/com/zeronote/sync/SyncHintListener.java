package com.zeronote.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import reactor.core.Disposable;
import reactor.core.publisher.Mono;

/**
 * Turns remote hints into ordinary sync cycles. The hint's contents are logged and otherwise
 * ignored; data only ever arrives through a pull.
 */
public class SyncHintListener implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SyncHintListener.class);

    private final SyncAdapter adapter;
    private final SyncEngine engine;
    private Disposable subscription;

    public SyncHintListener(SyncAdapter adapter, SyncEngine engine) {
        this.adapter = adapter;
        this.engine = engine;
    }

    public synchronized void start() {
        if (subscription != null && !subscription.isDisposed()) {
            return;
        }
        subscription = adapter.hints()
                .doOnNext(hint -> log.debug("Hint from {}: {} {} at version {}",
                        adapter.name(), hint.entityType(), hint.entityId(), hint.syncVersion()))
                .onBackpressureLatest()
                .concatMap(hint -> engine.synchronize()
                        .onErrorResume(e -> {
                            log.warn("Sync after hint failed", e);
                            return Mono.empty();
                        }), 1)
                .subscribe(
                        result -> log.debug("Hinted sync finished: success={}", result.success()),
                        error -> log.warn("Hint channel from {} closed", adapter.name(), error));
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
