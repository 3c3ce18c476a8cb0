package com.chatwave.service;

import com.chatwave.model.ChatDTOs;
import com.chatwave.model.LiveEventType;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Session lifecycle: connect, join, leave, disconnect.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LiveSessionCoordinator {

    private final ConnectionRegistry connectionRegistry;
    private final RoomMembershipManager roomMembership;
    private final PresenceTracker presenceTracker;
    private final ChatService chatService;
    private final MessageService messageService;
    private final MessageDispatcher dispatcher;

    /** {@code userId} must come from a verified token. */
    public void onConnected(String sessionId, String userId) {
        connectionRegistry.register(sessionId, userId);
        presenceTracker.onSessionAdded(userId);
        log.info("User '{}' connected (session={})", userId, sessionId);
    }

    public void onDisconnected(String sessionId) {
        Optional<String> userId = connectionRegistry.userOf(sessionId);
        if (userId.isEmpty()) {
            return;
        }
        boolean noSessionsLeft = connectionRegistry.unregister(sessionId);
        roomMembership.leaveAll(sessionId, userId.get());
        presenceTracker.onSessionRemoved(userId.get(), noSessionsLeft);
        log.info("User '{}' disconnected (session={})", userId.get(), sessionId);
    }

    /**
     * Subscribes the session to the chat's live events, sends it the viewer's history
     * and tells the rest of the room.
     */
    public void joinRoom(String sessionId, String userId, String chatId) {
        chatService.requireParticipant(chatId, userId);
        boolean added = roomMembership.join(sessionId, chatId);
        log.info("User '{}' joined chat '{}' (session={})", userId, chatId, sessionId);

        // clients reconcile missed pushes from this
        List<ChatDTOs.MessagePayload> history = messageService.getHistory(chatId, userId, 0, null);
        dispatcher.publishToSession(sessionId, LiveEventType.HISTORY, chatId,
                ChatDTOs.HistoryPayload.builder().chatId(chatId).messages(history).build());

        if (added) {
            dispatcher.publishToRoom(chatId, LiveEventType.USER_JOINED,
                    ChatDTOs.MembershipPayload.builder().chatId(chatId).userId(userId).build(), sessionId);
        }
    }

    public void leaveRoom(String sessionId, String userId, String chatId) {
        if (roomMembership.leave(sessionId, chatId)) {
            log.info("User '{}' left chat '{}' (session={})", userId, chatId, sessionId);
        }
    }

    /** Releases every live session, e.g. when the server stops. */
    @PreDestroy
    public void shutdown() {
        List<String> sessionIds = connectionRegistry.sessionIds();
        for (String sessionId : sessionIds) {
            try {
                onDisconnected(sessionId);
            } catch (RuntimeException e) {
                log.warn("Failed to release session {} on shutdown: {}", sessionId, e.getMessage());
            }
        }
        if (!sessionIds.isEmpty()) {
            log.info("Released {} live session(s) on shutdown", sessionIds.size());
        }
    }
}
