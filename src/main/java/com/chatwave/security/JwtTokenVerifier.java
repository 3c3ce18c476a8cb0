package com.chatwave.security;

import com.chatwave.config.LiveChatProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Date;

/**
 * Verifies HMAC-signed JWTs. The subject claim is the user id.
 */
@Slf4j
@Component
public class JwtTokenVerifier implements TokenVerifier {

    private final JwtParser parser;

    public JwtTokenVerifier(LiveChatProperties properties, Clock clock) {
        LiveChatProperties.Jwt jwt = properties.getJwt();
        if (jwt.getSecret() == null || jwt.getSecret().isBlank()) {
            throw new IllegalStateException("chat.live.jwt.secret must be configured");
        }
        this.parser = Jwts.parser()
                .verifyWith(Keys.hmacShaKeyFor(jwt.getSecret().getBytes(StandardCharsets.UTF_8)))
                .requireIssuer(jwt.getIssuer())
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    @Override
    public UserIdentity verify(String token) {
        if (token == null || token.isBlank()) {
            throw new AuthenticationFailedException("Missing bearer token");
        }
        Claims claims;
        try {
            claims = parser.parseSignedClaims(token).getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("Rejected token: {}", e.getMessage());
            throw new AuthenticationFailedException("Invalid token", e);
        }
        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            throw new AuthenticationFailedException("Token has no subject");
        }
        return new UserIdentity(subject);
    }
}
