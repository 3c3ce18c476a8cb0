package com.chatwave.service;

import com.chatwave.model.ChatDTOs;
import com.chatwave.model.LiveEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.messaging.MessageHeaders;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Pushes to a single STOMP session. Clients subscribe to {@code /user/queue/events}
 * and {@code /user/queue/errors}.
 */
@Component
@RequiredArgsConstructor
public class StompSessionGateway implements SessionGateway {

    public static final String EVENTS_DESTINATION = "/queue/events";
    public static final String ERRORS_DESTINATION = "/queue/errors";

    private final SimpMessagingTemplate messagingTemplate;

    @Override
    public void send(String sessionId, LiveEvent event) {
        messagingTemplate.convertAndSendToUser(sessionId, EVENTS_DESTINATION, event, buildNativeHeaders(sessionId));
    }

    @Override
    public void sendError(String sessionId, ChatDTOs.ErrorPayload error) {
        messagingTemplate.convertAndSendToUser(sessionId, ERRORS_DESTINATION, error, buildNativeHeaders(sessionId));
    }

    /** Build headers that correctly target a session ID when using convertAndSendToUser */
    private MessageHeaders buildNativeHeaders(String sessionId) {
        SimpMessageHeaderAccessor headerAccessor = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
        headerAccessor.setSessionId(sessionId);
        headerAccessor.setLeaveMutable(true);
        return headerAccessor.getMessageHeaders();
    }
}
