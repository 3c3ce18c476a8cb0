package com.chatwave.service;

import com.chatwave.config.LiveChatProperties;
import com.chatwave.model.ChatDTOs;
import com.chatwave.model.LiveEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-chat "currently typing" sets.
 *
 * Entries carry their last update time and are treated as gone once older than
 * the configured TTL, whether or not the client ever sent a stop. Expiry is
 * evaluated on access, there is no background timer.
 */
@Slf4j
@Service
public class TypingIndicatorTracker {

    // chatId → (userId → last update)
    private final Map<String, Map<String, Instant>> typing = new ConcurrentHashMap<>();

    private final RoomMembershipManager roomMembership;
    private final MessageDispatcher dispatcher;
    private final Clock clock;
    private final Duration ttl;

    public TypingIndicatorTracker(RoomMembershipManager roomMembership,
                                  MessageDispatcher dispatcher,
                                  LiveChatProperties properties,
                                  Clock clock) {
        this.roomMembership = roomMembership;
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.ttl = properties.getTypingTtl();
    }

    /**
     * Records a typing start or stop and tells every other session in the room.
     * The originating session must have joined the chat.
     */
    public void setTyping(String chatId, String userId, String originSessionId, boolean isTyping) {
        if (!roomMembership.isJoined(originSessionId, chatId)) {
            log.debug("Ignoring typing from session {} not joined to chat {}", originSessionId, chatId);
            return;
        }
        Instant now = clock.instant();
        expireStale(chatId, now);

        if (isTyping) {
            if (!start(chatId, userId, originSessionId, now)) {
                log.debug("Session {} left chat {} before its typing start landed", originSessionId, chatId);
                return;
            }
        } else {
            remove(chatId, userId);
        }
        broadcast(chatId, userId, isTyping, now, originSessionId);
    }

    /** Users typing in the chat right now; expired entries are pruned on the way. */
    public Set<String> typingUsers(String chatId) {
        Map<String, Instant> users = typing.get(chatId);
        if (users == null) {
            return Set.of();
        }
        Instant cutoff = clock.instant().minus(ttl);
        users.values().removeIf(updatedAt -> updatedAt.isBefore(cutoff));
        return Set.copyOf(users.keySet());
    }

    /**
     * Drops the user's entry, if any.
     *
     * @return true if the user was typing
     */
    public boolean clear(String chatId, String userId) {
        Instant removed = remove(chatId, userId);
        return removed != null && !removed.isBefore(clock.instant().minus(ttl));
    }

    @EventListener
    public void onRoomLeft(RoomLeftEvent event) {
        if (clear(event.getChatId(), event.getUserId())) {
            broadcast(event.getChatId(), event.getUserId(), false, clock.instant(), event.getSessionId());
        }
    }

    /**
     * Removes entries older than the TTL and tells the room they stopped.
     *
     * @return users whose entries expired
     */
    public Set<String> expireStale(String chatId, Instant now) {
        Map<String, Instant> users = typing.get(chatId);
        if (users == null) {
            return Set.of();
        }
        Instant cutoff = now.minus(ttl);
        Set<String> expired = new LinkedHashSet<>();
        for (Map.Entry<String, Instant> entry : List.copyOf(users.entrySet())) {
            if (entry.getValue().isBefore(cutoff) && users.remove(entry.getKey(), entry.getValue())) {
                expired.add(entry.getKey());
            }
        }
        for (String userId : expired) {
            log.debug("Typing entry expired: chat={} user={}", chatId, userId);
            broadcast(chatId, userId, false, now, null);
        }
        return expired;
    }

    /** Adds the entry unless the session left meanwhile; a leave clears under the same chat entry. */
    private boolean start(String chatId, String userId, String originSessionId, Instant now) {
        boolean[] started = new boolean[1];
        typing.compute(chatId, (id, users) -> {
            if (!roomMembership.isJoined(originSessionId, chatId)) {
                return users;
            }
            Map<String, Instant> updated = users == null ? new ConcurrentHashMap<>() : users;
            updated.put(userId, now);
            started[0] = true;
            return updated;
        });
        return started[0];
    }

    private Instant remove(String chatId, String userId) {
        Instant[] removed = new Instant[1];
        typing.computeIfPresent(chatId, (id, users) -> {
            removed[0] = users.remove(userId);
            return users.isEmpty() ? null : users;
        });
        return removed[0];
    }

    private void broadcast(String chatId, String userId, boolean isTyping, Instant now, String excludeSessionId) {
        var payload = ChatDTOs.TypingPayload.builder()
                .chatId(chatId)
                .userId(userId)
                .typing(isTyping)
                .expiresAt(isTyping ? now.plus(ttl) : null)
                .build();
        dispatcher.publishToRoom(chatId, LiveEventType.TYPING_CHANGED, payload, excludeSessionId);
    }
}
