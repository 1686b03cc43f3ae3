package com.zeronote.server.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import com.zeronote.crypto.KeyDerivation;
import com.zeronote.model.NoteVersion;
import com.zeronote.sync.arbiter.PushArbiter;

/**
 * Server tunables under the {@code zeronote} prefix.
 *
 * @param sync    push arbitration limits
 * @param history note version retention
 * @param crypto  the weakest key bundle a sign-up may register
 */
@ConfigurationProperties("zeronote")
public record ZeroNoteProperties(
        @DefaultValue Sync sync,
        @DefaultValue History history,
        @DefaultValue Crypto crypto) {

    /**
     * @param casRetries how often a push re-reads an entity after losing a compare-and-set
     * @param maxBatch   most notes plus folders accepted in one push
     */
    public record Sync(
            @DefaultValue("" + PushArbiter.DEFAULT_MAX_RETRIES) int casRetries,
            @DefaultValue("500") int maxBatch) {
    }

    public record History(@DefaultValue("" + NoteVersion.CAPACITY) int capacity) {
    }

    public record Crypto(@DefaultValue("" + KeyDerivation.DEFAULT_ITERATIONS) int minIterations) {
    }
}
