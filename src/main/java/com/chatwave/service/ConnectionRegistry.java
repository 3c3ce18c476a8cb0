package com.chatwave.service;

import com.chatwave.model.UserSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-memory map of user identity ↔ live sessions (multi-device).
 *
 * Process-local: a restart loses it and clients rebuild it by reconnecting.
 * Kept behind an injected instance so it can later move to a shared store.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConnectionRegistry {

    // sessionId → UserSession
    private final Map<String, UserSession> sessions = new ConcurrentHashMap<>();

    // userId → sessionIds
    private final Map<String, Set<String>> sessionsByUser = new ConcurrentHashMap<>();

    private final Clock clock;

    /**
     * Adds a session to its user's set. Registering the same session twice is a no-op.
     *
     * @return true if this is the user's first live session
     */
    public boolean register(String sessionId, String userId) {
        UserSession existing = sessions.putIfAbsent(sessionId, UserSession.builder()
                .sessionId(sessionId)
                .userId(userId)
                .connectedAt(clock.instant())
                .build());
        if (existing != null) {
            if (!existing.getUserId().equals(userId)) {
                throw new IllegalStateException("Session " + sessionId + " is already bound to another user");
            }
            return false;
        }

        boolean[] first = new boolean[1];
        sessionsByUser.compute(userId, (uid, current) -> {
            Set<String> updated = current == null ? ConcurrentHashMap.newKeySet() : current;
            first[0] = updated.isEmpty();
            updated.add(sessionId);
            return updated;
        });
        log.debug("Session registered: user={} session={}", userId, sessionId);
        return first[0];
    }

    /**
     * Removes a session.
     *
     * @return true iff the owning user now has zero remaining sessions
     */
    public boolean unregister(String sessionId) {
        UserSession removed = sessions.remove(sessionId);
        if (removed == null) {
            return false;
        }

        boolean[] none = new boolean[1];
        sessionsByUser.computeIfPresent(removed.getUserId(), (uid, current) -> {
            current.remove(sessionId);
            none[0] = current.isEmpty();
            return none[0] ? null : current;
        });
        log.debug("Session unregistered: user={} session={} lastSession={}", removed.getUserId(), sessionId, none[0]);
        return none[0];
    }

    /** Snapshot of all live session ids, safe to iterate while sessions come and go. */
    public List<String> sessionIds() {
        return List.copyOf(sessions.keySet());
    }

    public Optional<UserSession> getSession(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public Optional<String> userOf(String sessionId) {
        return getSession(sessionId).map(UserSession::getUserId);
    }

    public boolean isActive(String sessionId) {
        return sessions.containsKey(sessionId);
    }

    /** Snapshot of the user's live session ids. */
    public Set<String> sessionsOf(String userId) {
        Set<String> current = sessionsByUser.get(userId);
        return current == null ? Set.of() : Set.copyOf(current);
    }

    public boolean isOnline(String userId) {
        Set<String> current = sessionsByUser.get(userId);
        return current != null && !current.isEmpty();
    }
}
