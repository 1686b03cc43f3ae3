package com.zeronote.server.sync;

import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.zeronote.sync.SyncHint;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Fans accepted writes out to the account's open event streams. Best effort: a device that
 * is not listening, or is too slow, catches up on its next scheduled pull.
 *
 * <p>An account's stream lives only while someone listens. The last listener to cancel or
 * complete drops it, and hints for an account nobody listens to are discarded.
 */
@Component
public class SyncNotifier {

    private static final Logger log = LoggerFactory.getLogger(SyncNotifier.class);

    private final ConcurrentHashMap<String, Channel> streams = new ConcurrentHashMap<>();

    public Flux<SyncHint> subscribe(String owner) {
        return Flux.defer(() -> {
            Channel channel = streams.compute(owner, (key, existing) -> {
                Channel joined = existing == null ? new Channel() : existing;
                joined.listeners++;
                return joined;
            });
            return channel.sink.asFlux().doFinally(signal -> leave(owner, channel));
        });
    }

    public void publish(String owner, SyncHint hint) {
        Channel channel = streams.get(owner);
        if (channel == null) {
            return;
        }
        Sinks.EmitResult result;
        synchronized (channel) {
            result = channel.sink.tryEmitNext(hint);
        }
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.debug("Dropped hint for {} {}: {}", hint.entityType(), hint.entityId(), result);
        }
    }

    /** Accounts with at least one open event stream. */
    int openStreams() {
        return streams.size();
    }

    private void leave(String owner, Channel channel) {
        streams.computeIfPresent(owner, (key, existing) -> {
            if (existing != channel) {
                return existing;
            }
            existing.listeners--;
            if (existing.listeners > 0) {
                return existing;
            }
            log.debug("Closed event stream for {}", owner);
            return null;
        });
    }

    private static final class Channel {
        private final Sinks.Many<SyncHint> sink = Sinks.many().multicast().directBestEffort();
        // guarded by the map's per-key compute
        private int listeners;
    }
}
