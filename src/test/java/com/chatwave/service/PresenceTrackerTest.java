package com.chatwave.service;

import com.chatwave.model.ChatDTOs;
import com.chatwave.model.LiveEventType;
import com.chatwave.repository.ChatRepository;
import com.chatwave.support.MutableClock;
import com.chatwave.support.RecordingSessionGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class PresenceTrackerTest {

    private ConnectionRegistry registry;
    private ContactDirectory contacts;
    private RecordingSessionGateway gateway;
    private PresenceTracker presence;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock();
        registry = new ConnectionRegistry(clock);
        RoomMembershipManager rooms = new RoomMembershipManager(registry, event -> { });
        gateway = new RecordingSessionGateway();
        MessageDispatcher dispatcher = new MessageDispatcher(registry, rooms, mock(ChatRepository.class), gateway, clock);
        contacts = mock(ContactDirectory.class);
        when(contacts.contactsOf("alice")).thenReturn(Set.of("bob", "carol"));
        presence = new PresenceTracker(registry, contacts, dispatcher, clock);

        registry.register("bob-phone", "bob");
    }

    @Test
    void staysOnlineUntilLastSessionCloses() {
        connect("alice-phone", "alice");
        connect("alice-laptop", "alice");
        assertThat(gateway.eventsFor("bob-phone", LiveEventType.PRESENCE_CHANGED)).hasSize(1);

        disconnect("alice-phone");
        assertThat(presence.isOnline("alice")).isTrue();
        assertThat(gateway.eventsFor("bob-phone", LiveEventType.PRESENCE_CHANGED)).hasSize(1);

        disconnect("alice-laptop");
        assertThat(presence.isOnline("alice")).isFalse();
        var events = gateway.eventsFor("bob-phone", LiveEventType.PRESENCE_CHANGED);
        assertThat(events).hasSize(2);
        assertThat(((ChatDTOs.PresencePayload) events.get(1).getPayload()).isOnline()).isFalse();

        verify(contacts).recordPresence(eq("alice"), eq(true), any());
        verify(contacts).recordPresence(eq("alice"), eq(false), any());
    }

    @Test
    void offlineContactsAreSkipped() {
        connect("alice-phone", "alice");

        // carol has no session, only bob hears about it
        assertThat(gateway.recipientsOf(LiveEventType.PRESENCE_CHANGED)).containsExactly("bob-phone");
    }

    @Test
    void storeFailureDoesNotBlockAnnouncement() {
        doThrow(new IllegalStateException("db down")).when(contacts).recordPresence(any(), anyBoolean(), any());

        connect("alice-phone", "alice");

        assertThat(gateway.eventsFor("bob-phone", LiveEventType.PRESENCE_CHANGED)).hasSize(1);
    }

    private void connect(String sessionId, String userId) {
        registry.register(sessionId, userId);
        presence.onSessionAdded(userId);
    }

    private void disconnect(String sessionId) {
        String userId = registry.userOf(sessionId).orElseThrow();
        presence.onSessionRemoved(userId, registry.unregister(sessionId));
    }
}
