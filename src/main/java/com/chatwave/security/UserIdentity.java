package com.chatwave.security;

import lombok.Value;

import java.security.Principal;

/**
 * A verified user id. Only {@link TokenVerifier} creates these for live sessions,
 * so holding one means the identity was checked at the connection boundary.
 */
@Value
public class UserIdentity implements Principal {
    String userId;

    @Override
    public String getName() {
        return userId;
    }
}
