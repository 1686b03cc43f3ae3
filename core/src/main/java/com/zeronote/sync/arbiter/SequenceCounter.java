package com.zeronote.sync.arbiter;

import reactor.core.publisher.Mono;

/** Account-wide monotonically increasing change sequence; the pull cursor. */
public interface SequenceCounter {

    Mono<Long> next();

    Mono<Long> current();
}
