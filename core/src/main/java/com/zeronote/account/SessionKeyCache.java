package com.zeronote.account;

import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zeronote.error.SessionExpiredException;

/**
 * Process-local lookup of open sessions by id, for callers that can only carry a session id
 * across a reload. Never persisted. Evicting a session closes it.
 */
public class SessionKeyCache {

    private static final Logger log = LoggerFactory.getLogger(SessionKeyCache.class);

    private final ConcurrentHashMap<String, KeySession> sessions = new ConcurrentHashMap<>();

    public String put(KeySession session) {
        sessions.put(session.id(), session);
        return session.id();
    }

    public KeySession require(String sessionId) {
        KeySession session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null || session.isClosed()) {
            throw new SessionExpiredException("No active session");
        }
        return session;
    }

    public void evict(String sessionId) {
        KeySession session = sessions.remove(sessionId);
        if (session != null) {
            session.close();
            log.debug("Session {} evicted", sessionId);
        }
    }

    public void clear() {
        sessions.keySet().forEach(this::evict);
    }
}
