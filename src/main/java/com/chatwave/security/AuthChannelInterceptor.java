package com.chatwave.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.stereotype.Component;

/**
 * Binds a verified {@link UserIdentity} to the STOMP session on CONNECT.
 *
 * Frames from a session that never authenticated are rejected, so handlers can
 * trust the session principal and must ignore any identity fields in payloads.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuthChannelInterceptor implements ChannelInterceptor {

    public static final String AUTHORIZATION_HEADER = "Authorization";

    private final TokenVerifier tokenVerifier;

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        if (accessor == null || accessor.getCommand() == null) {
            return message;
        }

        StompCommand command = accessor.getCommand();
        if (command == StompCommand.CONNECT) {
            try {
                UserIdentity identity = tokenVerifier.verifyHeader(accessor.getFirstNativeHeader(AUTHORIZATION_HEADER));
                accessor.setUser(identity);
                log.debug("Session {} authenticated as {}", accessor.getSessionId(), identity.getUserId());
            } catch (AuthenticationFailedException e) {
                log.warn("Rejected CONNECT for session {}: {}", accessor.getSessionId(), e.getMessage());
                throw new MessageDeliveryException(message, e.getMessage(), e);
            }
        } else if ((command == StompCommand.SEND || command == StompCommand.SUBSCRIBE)
                && !(accessor.getUser() instanceof UserIdentity)) {
            throw new MessageDeliveryException(message, "Session is not authenticated");
        }
        return message;
    }
}
