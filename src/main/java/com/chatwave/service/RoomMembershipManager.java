package com.chatwave.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks which sessions are subscribed to which chat's live events.
 *
 * Every change for a session runs inside that session's entry of
 * {@code roomsBySession}, and the chat's session set is updated from there, so
 * the two indexes never disagree. Joins and leaves of unrelated sessions never
 * contend.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoomMembershipManager {

    // chatId → sessionIds
    private final Map<String, Set<String>> rooms = new ConcurrentHashMap<>();

    // sessionId → chatIds, for cleanup on disconnect
    private final Map<String, Set<String>> roomsBySession = new ConcurrentHashMap<>();

    private final ConnectionRegistry connectionRegistry;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * @return true if the session was not already in the room
     */
    public boolean join(String sessionId, String chatId) {
        boolean[] added = new boolean[1];
        boolean[] active = new boolean[1];
        roomsBySession.compute(sessionId, (id, chats) -> {
            // a racing disconnect either sees this join or makes it fail here
            active[0] = connectionRegistry.isActive(sessionId);
            if (!active[0]) {
                return chats;
            }
            Set<String> updated = chats == null ? ConcurrentHashMap.newKeySet() : chats;
            updated.add(chatId);
            added[0] = addToRoom(chatId, sessionId);
            return updated;
        });
        if (!active[0]) {
            log.debug("Ignoring join of unknown session {} to chat {}", sessionId, chatId);
        }
        return added[0];
    }

    /**
     * Removes the session from the room and clears the user's typing entry there.
     *
     * @return true if the session was in the room
     */
    public boolean leave(String sessionId, String chatId) {
        boolean[] removed = new boolean[1];
        roomsBySession.computeIfPresent(sessionId, (id, chats) -> {
            chats.remove(chatId);
            removed[0] = removeFromRoom(chatId, sessionId);
            return chats.isEmpty() ? null : chats;
        });
        if (removed[0]) {
            connectionRegistry.userOf(sessionId).ifPresent(userId ->
                    eventPublisher.publishEvent(new RoomLeftEvent(chatId, sessionId, userId)));
        }
        return removed[0];
    }

    /**
     * Leaves every room the session joined. Called when the session is destroyed,
     * after it is removed from the {@link ConnectionRegistry} so that no join can
     * slip in behind it.
     *
     * @return the chats the session was in
     */
    public Set<String> leaveAll(String sessionId, String userId) {
        Set<String> left = new LinkedHashSet<>();
        roomsBySession.computeIfPresent(sessionId, (id, chats) -> {
            for (String chatId : chats) {
                if (removeFromRoom(chatId, sessionId)) {
                    left.add(chatId);
                }
            }
            return null;
        });
        for (String chatId : left) {
            eventPublisher.publishEvent(new RoomLeftEvent(chatId, sessionId, userId));
        }
        return left;
    }

    /** Snapshot of the sessions currently joined to the chat. */
    public Set<String> sessionsFor(String chatId) {
        Set<String> current = rooms.get(chatId);
        return current == null ? Set.of() : Set.copyOf(current);
    }

    public boolean isJoined(String sessionId, String chatId) {
        Set<String> current = rooms.get(chatId);
        return current != null && current.contains(sessionId);
    }

    /** Snapshot of the chats the session is following. */
    public Set<String> roomsOf(String sessionId) {
        Set<String> current = roomsBySession.get(sessionId);
        return current == null ? Set.of() : Set.copyOf(current);
    }

    /** Number of chats with at least one joined session. */
    int roomCount() {
        return rooms.size();
    }

    private boolean addToRoom(String chatId, String sessionId) {
        boolean[] added = new boolean[1];
        rooms.compute(chatId, (id, current) -> {
            Set<String> updated = current == null ? ConcurrentHashMap.newKeySet() : current;
            added[0] = updated.add(sessionId);
            return updated;
        });
        return added[0];
    }

    private boolean removeFromRoom(String chatId, String sessionId) {
        boolean[] removed = new boolean[1];
        rooms.computeIfPresent(chatId, (id, current) -> {
            removed[0] = current.remove(sessionId);
            return current.isEmpty() ? null : current;
        });
        return removed[0];
    }
}
