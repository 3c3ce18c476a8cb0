package com.chatwave.security;

/**
 * Authentication collaborator. Token issuance lives elsewhere; this side only verifies.
 */
public interface TokenVerifier {

    /**
     * @throws AuthenticationFailedException if the token is missing, malformed, expired
     *                                       or not signed by a trusted issuer
     */
    UserIdentity verify(String token);

    /** Accepts a raw {@code Authorization} header value, with or without the Bearer prefix. */
    default UserIdentity verifyHeader(String authorization) {
        if (authorization == null || authorization.isBlank()) {
            throw new AuthenticationFailedException("Missing bearer token");
        }
        String token = authorization.trim();
        if (token.regionMatches(true, 0, "Bearer ", 0, 7)) {
            token = token.substring(7).trim();
        }
        return verify(token);
    }
}
