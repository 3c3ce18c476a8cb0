package com.chatwave.service;

import lombok.Value;

import java.time.Instant;
import java.util.Set;

/**
 * User directory collaborator: contact lists and the stored online flag.
 */
public interface ContactDirectory {

    Set<String> contactsOf(String userId);

    /** Stores the user's online flag and last-seen time. Best-effort. */
    void recordPresence(String userId, boolean online, Instant at);

    Presence presenceOf(String userId);

    @Value
    class Presence {
        String userId;
        boolean online;
        Instant lastSeen;
    }
}
