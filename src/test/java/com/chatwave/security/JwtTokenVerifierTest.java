package com.chatwave.security;

import com.chatwave.config.LiveChatProperties;
import com.chatwave.support.MutableClock;
import com.chatwave.support.TestTokens;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtTokenVerifierTest {

    private MutableClock clock;
    private JwtTokenVerifier verifier;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        LiveChatProperties properties = new LiveChatProperties();
        properties.getJwt().setSecret(TestTokens.SECRET);
        properties.getJwt().setIssuer(TestTokens.ISSUER);
        verifier = new JwtTokenVerifier(properties, clock);
    }

    @Test
    void acceptsValidToken() {
        String token = TestTokens.issue("alice", clock.instant());

        assertThat(verifier.verify(token)).isEqualTo(new UserIdentity("alice"));
    }

    @Test
    void acceptsBearerHeader() {
        assertThat(verifier.verifyHeader(TestTokens.bearer("alice", clock.instant())).getUserId())
                .isEqualTo("alice");
    }

    @Test
    void rejectsTokenSignedWithAnotherKey() {
        String forged = TestTokens.issue("alice", clock.instant(), Duration.ofHours(1),
                TestTokens.ISSUER, "some-other-secret-some-other-secret-42");

        assertThatThrownBy(() -> verifier.verify(forged)).isInstanceOf(AuthenticationFailedException.class);
    }

    @Test
    void rejectsExpiredToken() {
        String token = TestTokens.issue("alice", clock.instant());
        clock.advance(Duration.ofHours(2));

        assertThatThrownBy(() -> verifier.verify(token)).isInstanceOf(AuthenticationFailedException.class);
    }

    @Test
    void rejectsForeignIssuer() {
        String token = TestTokens.issue("alice", clock.instant(), Duration.ofHours(1), "elsewhere", TestTokens.SECRET);

        assertThatThrownBy(() -> verifier.verify(token)).isInstanceOf(AuthenticationFailedException.class);
    }

    @Test
    void rejectsMissingOrGarbage() {
        assertThatThrownBy(() -> verifier.verifyHeader(null)).isInstanceOf(AuthenticationFailedException.class);
        assertThatThrownBy(() -> verifier.verifyHeader("Bearer ")).isInstanceOf(AuthenticationFailedException.class);
        assertThatThrownBy(() -> verifier.verify("not-a-jwt")).isInstanceOf(AuthenticationFailedException.class);
    }
}
