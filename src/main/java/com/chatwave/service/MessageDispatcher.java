package com.chatwave.service;

import com.chatwave.model.ChatDTOs;
import com.chatwave.model.LiveEvent;
import com.chatwave.model.LiveEventType;
import com.chatwave.repository.ChatRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.*;

/**
 * Resolves target sessions and pushes events to them, exactly once per session.
 *
 * Delivery is fire-and-forget. The durable store is the source of truth and a
 * client that missed a push re-fetches history when it reconnects or rejoins,
 * so failures are logged and never retried or propagated.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MessageDispatcher {

    private final ConnectionRegistry connectionRegistry;
    private final RoomMembershipManager roomMembership;
    private final ChatRepository chatRepository;
    private final SessionGateway gateway;
    private final Clock clock;

    /** Pushes a newly persisted message to everyone who should see it live. */
    public int dispatch(ChatDTOs.MessagePayload message) {
        return publishToChat(message.getChatId(), LiveEventType.MESSAGE_NEW, message);
    }

    /**
     * Sends to the sessions viewing the chat plus the direct sessions of participants
     * who are online but have not opened it.
     */
    public int publishToChat(String chatId, LiveEventType type, Object payload) {
        List<String> participants;
        try {
            participants = chatRepository.findParticipantIds(chatId);
        } catch (RuntimeException e) {
            // the mutation is already committed; fall back to the room
            log.warn("Participant lookup for chat {} failed, pushing to joined sessions only: {}", chatId, e.getMessage());
            participants = List.of();
        }
        return fanOut(resolveTargets(chatId, participants), event(type, chatId, payload));
    }

    /** Sends to the sessions joined to the chat, except {@code excludeSessionId}. */
    public int publishToRoom(String chatId, LiveEventType type, Object payload, String excludeSessionId) {
        Set<String> targets = new LinkedHashSet<>(roomMembership.sessionsFor(chatId));
        if (excludeSessionId != null) {
            targets.remove(excludeSessionId);
        }
        return fanOut(targets, event(type, chatId, payload));
    }

    /** Sends to every live session of each user. */
    public int publishToUsers(Collection<String> userIds, LiveEventType type, String chatId, Object payload) {
        Set<String> targets = new LinkedHashSet<>();
        for (String userId : userIds) {
            targets.addAll(connectionRegistry.sessionsOf(userId));
        }
        return fanOut(targets, event(type, chatId, payload));
    }

    public int publishToSession(String sessionId, LiveEventType type, String chatId, Object payload) {
        return fanOut(Set.of(sessionId), event(type, chatId, payload));
    }

    /**
     * Union of room sessions and the direct sessions of participants with no session
     * in the room, deduplicated by session id.
     */
    public Set<String> resolveTargets(String chatId, Collection<String> participantIds) {
        Set<String> roomSessions = roomMembership.sessionsFor(chatId);
        Set<String> targets = new LinkedHashSet<>(roomSessions);
        for (String participantId : participantIds) {
            Set<String> direct = connectionRegistry.sessionsOf(participantId);
            if (!direct.isEmpty() && Collections.disjoint(direct, roomSessions)) {
                targets.addAll(direct);
            }
        }
        return targets;
    }

    /**
     * The single send path. Each target gets the event at most once.
     *
     * @return number of sessions the event was handed to
     */
    public int fanOut(Collection<String> sessionIds, LiveEvent event) {
        int delivered = 0;
        for (String sessionId : new LinkedHashSet<>(sessionIds)) {
            if (!connectionRegistry.isActive(sessionId)) {
                log.debug("Delivery dropped: session {} is gone ({} for chat {})", sessionId, event.getType(), event.getChatId());
                continue;
            }
            try {
                gateway.send(sessionId, event);
                delivered++;
            } catch (RuntimeException e) {
                log.warn("Delivery dropped: {} to session {} failed: {}", event.getType(), sessionId, e.getMessage());
            }
        }
        log.debug("{} for chat {} delivered to {} session(s)", event.getType(), event.getChatId(), delivered);
        return delivered;
    }

    private LiveEvent event(LiveEventType type, String chatId, Object payload) {
        return LiveEvent.of(type, chatId, payload, clock.instant());
    }
}
