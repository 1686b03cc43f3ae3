package com.zeronote.account;

import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.zeronote.CryptoFixtures;
import com.zeronote.error.SessionExpiredException;

class SessionKeyCacheTest {

    private final SessionKeyCache cache = new SessionKeyCache();

    @Test
    void requireReturnsTheCachedSession() {
        KeySession session = CryptoFixtures.keyring().register("pw").session();

        String id = cache.put(session);

        assertSame(session, cache.require(id));
    }

    @Test
    void evictClosesTheSession() {
        KeySession session = CryptoFixtures.keyring().register("pw").session();
        String id = cache.put(session);

        cache.evict(id);

        assertTrue(session.isClosed());
        assertThrows(SessionExpiredException.class, () -> cache.require(id));
    }

    @Test
    void unknownOrMissingIdIsExpired() {
        assertThrows(SessionExpiredException.class, () -> cache.require("nope"));
        assertThrows(SessionExpiredException.class, () -> cache.require(null));
    }
}
