package com.chatwave.service;

import com.chatwave.model.ChatDTOs;
import com.chatwave.model.LiveEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Online/offline derived from the {@link ConnectionRegistry}, announced to contacts.
 *
 * Announcements are best-effort: contacts without a live session simply miss them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PresenceTracker {

    // users last announced as online
    private final Set<String> announcedOnline = ConcurrentHashMap.newKeySet();

    private final ConnectionRegistry connectionRegistry;
    private final ContactDirectory contactDirectory;
    private final MessageDispatcher dispatcher;
    private final Clock clock;

    public void onSessionAdded(String userId) {
        if (connectionRegistry.isOnline(userId) && announcedOnline.add(userId)) {
            publish(userId, true);
        }
    }

    /**
     * @param noSessionsLeft what {@link ConnectionRegistry#unregister} reported
     */
    public void onSessionRemoved(String userId, boolean noSessionsLeft) {
        if (noSessionsLeft && !connectionRegistry.isOnline(userId) && announcedOnline.remove(userId)) {
            publish(userId, false);
        }
    }

    public boolean isOnline(String userId) {
        return connectionRegistry.isOnline(userId);
    }

    public ChatDTOs.PresencePayload presenceOf(String userId) {
        ContactDirectory.Presence stored = contactDirectory.presenceOf(userId);
        boolean online = connectionRegistry.isOnline(userId);
        return ChatDTOs.PresencePayload.builder()
                .userId(userId)
                .online(online)
                .lastSeen(stored.getLastSeen())
                .build();
    }

    private void publish(String userId, boolean online) {
        Instant now = clock.instant();
        try {
            contactDirectory.recordPresence(userId, online, now);
        } catch (RuntimeException e) {
            log.warn("Could not store presence for {}: {}", userId, e.getMessage());
        }

        Set<String> contacts = contactDirectory.contactsOf(userId);
        var payload = ChatDTOs.PresencePayload.builder()
                .userId(userId)
                .online(online)
                .lastSeen(now)
                .build();
        int delivered = dispatcher.publishToUsers(contacts, LiveEventType.PRESENCE_CHANGED, null, payload);
        log.info("User {} is {}, told {} contact(s) over {} session(s)", userId, online ? "online" : "offline", contacts.size(), delivered);
    }
}
