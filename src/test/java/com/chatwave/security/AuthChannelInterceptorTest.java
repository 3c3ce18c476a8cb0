package com.chatwave.security;

import com.chatwave.config.LiveChatProperties;
import com.chatwave.support.MutableClock;
import com.chatwave.support.TestTokens;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.MessageBuilder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class AuthChannelInterceptorTest {

    private final MessageChannel channel = mock(MessageChannel.class);
    private MutableClock clock;
    private AuthChannelInterceptor interceptor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        LiveChatProperties properties = new LiveChatProperties();
        properties.getJwt().setSecret(TestTokens.SECRET);
        properties.getJwt().setIssuer(TestTokens.ISSUER);
        interceptor = new AuthChannelInterceptor(new JwtTokenVerifier(properties, clock));
    }

    @Test
    void connectWithValidTokenBindsIdentity() {
        StompHeaderAccessor accessor = accessor(StompCommand.CONNECT);
        accessor.addNativeHeader(AuthChannelInterceptor.AUTHORIZATION_HEADER, TestTokens.bearer("alice", clock.instant()));
        Message<byte[]> message = build(accessor);

        interceptor.preSend(message, channel);

        assertThat(accessor.getUser()).isEqualTo(new UserIdentity("alice"));
    }

    @Test
    void connectWithoutTokenIsRejected() {
        Message<byte[]> message = build(accessor(StompCommand.CONNECT));

        assertThatThrownBy(() -> interceptor.preSend(message, channel))
                .isInstanceOf(MessageDeliveryException.class);
    }

    @Test
    void sendWithoutAuthenticatedSessionIsRejected() {
        StompHeaderAccessor accessor = accessor(StompCommand.SEND);
        accessor.setDestination("/app/chat.send");
        Message<byte[]> message = build(accessor);

        assertThatThrownBy(() -> interceptor.preSend(message, channel))
                .isInstanceOf(MessageDeliveryException.class);
    }

    @Test
    void sendFromAuthenticatedSessionPasses() {
        StompHeaderAccessor accessor = accessor(StompCommand.SEND);
        accessor.setDestination("/app/chat.send");
        accessor.setUser(new UserIdentity("alice"));
        Message<byte[]> message = build(accessor);

        assertThat(interceptor.preSend(message, channel)).isSameAs(message);
    }

    private StompHeaderAccessor accessor(StompCommand command) {
        StompHeaderAccessor accessor = StompHeaderAccessor.create(command);
        accessor.setSessionId("s1");
        accessor.setLeaveMutable(true);
        return accessor;
    }

    private Message<byte[]> build(StompHeaderAccessor accessor) {
        return MessageBuilder.createMessage(new byte[0], accessor.getMessageHeaders());
    }
}
