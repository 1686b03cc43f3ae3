package com.zeronote.sync.arbiter;

import java.util.concurrent.atomic.AtomicLong;

import reactor.core.publisher.Mono;

public class InMemorySequenceCounter implements SequenceCounter {

    private final AtomicLong sequence;

    public InMemorySequenceCounter(long start) {
        this.sequence = new AtomicLong(start);
    }

    @Override
    public Mono<Long> next() {
        return Mono.fromSupplier(sequence::incrementAndGet);
    }

    @Override
    public Mono<Long> current() {
        return Mono.fromSupplier(sequence::get);
    }
}
