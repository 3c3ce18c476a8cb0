package com.chatwave.config;

import com.chatwave.security.UserIdentity;
import com.chatwave.service.LiveSessionCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectedEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.security.Principal;

@Slf4j
@Component
@RequiredArgsConstructor
public class WebSocketEventListener {

    private final LiveSessionCoordinator sessionCoordinator;

    @EventListener
    public void handleWebSocketConnectListener(SessionConnectedEvent event) {
        SimpMessageHeaderAccessor headers = SimpMessageHeaderAccessor.wrap(event.getMessage());
        String sessionId = headers.getSessionId();
        Principal user = event.getUser();

        // the inbound interceptor only lets verified identities through
        if (!(user instanceof UserIdentity)) {
            log.warn("Connected session {} has no verified identity, ignoring", sessionId);
            return;
        }
        sessionCoordinator.onConnected(sessionId, ((UserIdentity) user).getUserId());
    }

    @EventListener
    public void handleWebSocketDisconnectListener(SessionDisconnectEvent event) {
        log.debug("WebSocket closed: sessionId={} status={}", event.getSessionId(), event.getCloseStatus());
        sessionCoordinator.onDisconnected(event.getSessionId());
    }
}
